package com.xai.xaichain.event;

import com.xai.xaichain.data.block.TipChange;
import org.jetbrains.annotations.NotNull;

/**
 * 链事件回调，在链锁释放后按发生顺序同步调用；实现不应阻塞
 */
public interface ChainEventListener {

    /**
     * 主链链尖变化（扩展或重组）
     */
    default void onNewTip(@NotNull TipChange change) {
    }

    /**
     * 每次重组只触发一次，在 onNewTip 之后
     */
    default void onReorg(@NotNull ReorgEvent event) {
    }

    default void onTransactionRejected(@NotNull RejectedTransactionEvent event) {
    }
}
