package com.xai.xaichain.service.mempool;

import com.xai.xaichain.ledger.LedgerView;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.function.Predicate;

/**
 * 交易池验证时依据的主链状态，由共识引擎在持有链锁时生成
 */
@Getter
@AllArgsConstructor
public class MempoolContext {

    private final LedgerView chainView;

    // 交易将被打包的高度（链尖高度 + 1）
    private final long nextHeight;

    private final String tipHash;

    private final long stateVersion;

    // 交易是否已在主链上
    private final Predicate<byte[]> confirmedTransaction;
}
