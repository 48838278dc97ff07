package com.xai.xaichain.consensus.pow;

import static com.xai.xaichain.constant.BlockChainConstants.MAX_SUPPLY;

/**
 * 区块奖励：每 halvingInterval 个区块减半，总量不超过发行上限
 */
public class RewardSchedule {

    private final long initialReward;
    private final long halvingInterval;

    public RewardSchedule(long initialReward, long halvingInterval) {
        if (initialReward < 0 || halvingInterval <= 0) {
            throw new IllegalArgumentException("奖励参数非法");
        }
        this.initialReward = initialReward;
        this.halvingInterval = halvingInterval;
    }

    /**
     * 不考虑上限的计划奖励
     */
    public long scheduledReward(long height) {
        long halvings = height / halvingInterval;
        if (halvings >= 63) {
            return 0;
        }
        return initialReward >> halvings;
    }

    /**
     * 实际可发行的奖励
     * @param issuedSoFar 父区块之后的发行总量
     */
    public long rewardAt(long height, long issuedSoFar) {
        long remaining = Math.max(0, MAX_SUPPLY - issuedSoFar);
        return Math.min(scheduledReward(height), remaining);
    }
}
