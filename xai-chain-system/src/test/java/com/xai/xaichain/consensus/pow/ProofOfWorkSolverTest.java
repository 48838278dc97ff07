package com.xai.xaichain.consensus.pow;

import com.xai.xaichain.data.block.BlockHeader;
import com.xai.xaichain.util.DifficultyUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.xai.xaichain.constant.BlockChainConstants.BLOCK_VERSION_1;

public class ProofOfWorkSolverTest {

    private static BlockHeader header(String bits) {
        BlockHeader header = new BlockHeader();
        header.setVersion(BLOCK_VERSION_1);
        header.setPreviousHash(new byte[32]);
        header.setMerkleRoot(new byte[32]);
        header.setTime(1_700_000_000L);
        header.setDifficultyTarget(DifficultyUtils.hexToCompact(bits));
        return header;
    }

    @Test
    public void findsNonceMeetingTarget() {
        BlockHeader header = header("207fffff");

        ProofOfWorkSolver.MiningResult result = new ProofOfWorkSolver(100).solve(header, new MiningCancellationToken());

        Assertions.assertTrue(result.isFound());
        Assertions.assertFalse(result.isCancelled());
        header.setNonce(result.getNonce());
        Assertions.assertArrayEquals(header.computeHash(), result.getHash());
        Assertions.assertTrue(DifficultyUtils.isValidHash(result.getHash(), header.getDifficultyTarget()));
    }

    @Test
    public void cancelledTokenStopsSearch() {
        MiningCancellationToken token = new MiningCancellationToken();
        token.cancel("链尖变化");

        ProofOfWorkSolver.MiningResult result = new ProofOfWorkSolver(100).solve(header("1d00ffff"), token);

        Assertions.assertFalse(result.isFound());
        Assertions.assertTrue(result.isCancelled());
        Assertions.assertEquals("链尖变化", token.getReason());
    }

    @Test
    public void cancellationFromAnotherThreadIsObserved() throws InterruptedException {
        MiningCancellationToken token = new MiningCancellationToken();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel("停止挖矿");
        });
        canceller.start();

        // 1d00ffff 在测试时间内不可能解出
        ProofOfWorkSolver.MiningResult result = new ProofOfWorkSolver(1000).solve(header("1d00ffff"), token);
        canceller.join();

        Assertions.assertTrue(result.isCancelled());
        Assertions.assertFalse(result.isFound());
    }
}
