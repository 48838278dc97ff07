package com.xai.xaichain.data.mempool;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 交易池概况
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class MempoolStats {

    private int transactionCount;

    private long totalBytes;

    private int futureNonceCount;

    private int orphanCount;

    private int senderCount;

    private int bannedSenderCount;

    private double minFeeRate;

    private double maxFeeRate;

    private long totalFees;

    private long evictedTotal;

    private long expiredTotal;

    private long replacedTotal;
}
