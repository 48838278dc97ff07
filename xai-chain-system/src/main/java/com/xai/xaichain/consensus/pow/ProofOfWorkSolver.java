package com.xai.xaichain.consensus.pow;

import com.xai.xaichain.data.block.BlockHeader;
import com.xai.xaichain.util.DifficultyUtils;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * CPU 求解：遍历 nonce 直到哈希不大于目标值；每 cancelCheckInterval 次检查一次取消标记
 */
@Slf4j
public class ProofOfWorkSolver {

    private final int cancelCheckInterval;

    public ProofOfWorkSolver(int cancelCheckInterval) {
        if (cancelCheckInterval <= 0) {
            throw new IllegalArgumentException("取消检查间隔必须为正数");
        }
        this.cancelCheckInterval = cancelCheckInterval;
    }

    /**
     * @return 找到的结果；nonce 用尽或被取消时 found 为 false
     */
    public MiningResult solve(BlockHeader header, MiningCancellationToken token) {
        MiningResult result = new MiningResult();
        BigInteger target = DifficultyUtils.compactToTarget(header.getDifficultyTarget());
        long attempts = 0;
        for (int nonce = 0; nonce >= 0; nonce++) {
            if (nonce % cancelCheckInterval == 0) {
                if (token.isCancelled()) {
                    log.info("挖矿被取消: {}，已尝试 {} 次", token.getReason(), attempts);
                    result.setCancelled(true);
                    return result;
                }
                if (Thread.currentThread().isInterrupted()) {
                    log.info("挖矿线程被中断，已尝试 {} 次", attempts);
                    result.setCancelled(true);
                    return result;
                }
            }
            header.setNonce(nonce);
            byte[] hash = header.computeHash();
            attempts++;
            if (new BigInteger(1, hash).compareTo(target) <= 0) {
                result.setFound(true);
                result.setNonce(nonce);
                result.setHash(hash);
                result.setAttempts(attempts);
                return result;
            }
            if (nonce == Integer.MAX_VALUE) {
                break;
            }
        }
        log.info("nonce 空间已用尽，未找到有效哈希");
        result.setAttempts(attempts);
        return result;
    }

    @Data
    public static class MiningResult {
        private boolean found;
        private boolean cancelled;
        private int nonce;
        private byte[] hash;
        private long attempts;
    }
}
