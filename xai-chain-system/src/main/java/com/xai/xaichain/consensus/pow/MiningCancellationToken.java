package com.xai.xaichain.consensus.pow;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 挖矿任务与共识引擎共享的取消标记，求解器按固定间隔检查
 */
public class MiningCancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile String reason;

    public void cancel(String reason) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = reason;
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }
}
