package com.xai.xaichain.consensus.pow;

import com.xai.xaichain.consensus.fork.ChainIndex;
import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.util.CryptoUtil;
import com.xai.xaichain.util.DifficultyUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * 难度调整：每 retargetInterval 个区块按窗口实际耗时与期望耗时之比调整目标值，系数限制在 [1/4, 4]
 * 结果只取决于历史区块时间和难度，相同历史在任何节点上得到相同目标
 */
@Slf4j
public class DifficultyAdjuster {

    private final ChainIndex chainIndex;
    private final int retargetInterval;
    private final long targetSpacingSeconds;
    @Getter
    private final byte[] powLimitBits;
    @Getter
    private final BigInteger powLimit;
    private final long minDifficultyGapSeconds;

    public DifficultyAdjuster(ChainIndex chainIndex, int retargetInterval, long targetSpacingSeconds,
                              byte[] powLimitBits, long minDifficultyGapSeconds) {
        if (retargetInterval <= 0 || targetSpacingSeconds <= 0) {
            throw new IllegalArgumentException("难度调整参数非法");
        }
        this.chainIndex = chainIndex;
        this.retargetInterval = retargetInterval;
        this.targetSpacingSeconds = targetSpacingSeconds;
        this.powLimitBits = powLimitBits.clone();
        this.powLimit = DifficultyUtils.compactToTarget(powLimitBits);
        this.minDifficultyGapSeconds = minDifficultyGapSeconds;
    }

    /**
     * 父区块之后下一个区块必须使用的难度目标
     * @param newBlockTime 新区块的时间，只在最低难度规则中使用
     */
    public byte[] nextBits(BlockIndexEntry parent, long newBlockTime) {
        long height = parent.getHeight() + 1;
        if (height % retargetInterval != 0) {
            if (minDifficultyGapSeconds > 0) {
                return minDifficultyBits(parent, newBlockTime);
            }
            return parent.getDifficultyTarget();
        }

        BlockIndexEntry first = chainIndex.getAncestor(parent, Math.max(0, height - retargetInterval));
        long expectedTimespan = (parent.getHeight() - first.getHeight()) * targetSpacingSeconds;
        if (expectedTimespan <= 0) {
            return parent.getDifficultyTarget();
        }
        long actualTimespan = parent.getTime() - first.getTime();
        BigInteger oldTarget = DifficultyUtils.compactToTarget(parent.getDifficultyTarget());
        BigInteger newTarget = DifficultyUtils.retarget(oldTarget, actualTimespan, expectedTimespan, powLimit);
        byte[] bits = DifficultyUtils.targetToCompact(newTarget);
        log.info("高度 {} 难度调整: 实际耗时 {} 秒, 期望 {} 秒, 目标 {} -> {}", height, actualTimespan, expectedTimespan,
                CryptoUtil.bytesToHex(parent.getDifficultyTarget()), CryptoUtil.bytesToHex(bits));
        return bits;
    }

    /**
     * 测试网规则：距父区块超过间隔可用最低难度；否则沿用最近一个非最低难度区块的目标
     */
    private byte[] minDifficultyBits(BlockIndexEntry parent, long newBlockTime) {
        if (newBlockTime > parent.getTime() + minDifficultyGapSeconds) {
            return powLimitBits.clone();
        }
        BlockIndexEntry current = parent;
        while (current.getHeight() > 0
                && current.getHeight() % retargetInterval != 0
                && Arrays.equals(current.getDifficultyTarget(), powLimitBits)) {
            current = chainIndex.getParent(current);
        }
        return current.getDifficultyTarget();
    }
}
