package com.xai.xaichain.consensus.pow;

import com.xai.xaichain.consensus.fork.ChainIndex;
import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.data.block.BlockStatus;
import com.xai.xaichain.storage.MemoryChainStore;
import com.xai.xaichain.util.CryptoUtil;
import com.xai.xaichain.util.DifficultyUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

public class DifficultyAdjusterTest {

    private static final int INTERVAL = 4;
    private static final long SPACING = 60;
    private static final byte[] POW_LIMIT_BITS = DifficultyUtils.hexToCompact("207fffff");
    private static final byte[] START_BITS = DifficultyUtils.hexToCompact("1f00ffff");

    private MemoryChainStore store;
    private ChainIndex chainIndex;

    @BeforeEach
    public void setUp() {
        store = new MemoryChainStore();
        chainIndex = new ChainIndex(store);
    }

    @Test
    public void targetIsKeptBetweenRetargets() {
        BlockIndexEntry tip = chain(START_BITS, 0, 60);
        DifficultyAdjuster adjuster = new DifficultyAdjuster(chainIndex, INTERVAL, SPACING, POW_LIMIT_BITS, 0);
        BlockIndexEntry parent = chainIndex.getAncestor(tip, 1);
        Assertions.assertArrayEquals(START_BITS, adjuster.nextBits(parent, parent.getTime() + 10_000));
    }

    @Test
    public void onScheduleWindowKeepsTarget() {
        BlockIndexEntry tip = chain(START_BITS, 0, 60, 120, 180);
        DifficultyAdjuster adjuster = new DifficultyAdjuster(chainIndex, INTERVAL, SPACING, POW_LIMIT_BITS, 0);
        Assertions.assertEquals("1f00ffff", CryptoUtil.bytesToHex(adjuster.nextBits(tip, 240)));
    }

    @Test
    public void slowWindowDoublesTarget() {
        BlockIndexEntry tip = chain(START_BITS, 0, 120, 240, 360);
        DifficultyAdjuster adjuster = new DifficultyAdjuster(chainIndex, INTERVAL, SPACING, POW_LIMIT_BITS, 0);
        Assertions.assertEquals("1f01fffe", CryptoUtil.bytesToHex(adjuster.nextBits(tip, 480)));
    }

    @Test
    public void fastWindowIsClampedToQuarter() {
        // 时间倒退也按最小耗时处理
        BlockIndexEntry tip = chain(START_BITS, 1000, 1000, 1000, 900);
        DifficultyAdjuster adjuster = new DifficultyAdjuster(chainIndex, INTERVAL, SPACING, POW_LIMIT_BITS, 0);
        BigInteger expected = DifficultyUtils.compactToTarget(START_BITS).shiftRight(2);
        Assertions.assertEquals(expected, DifficultyUtils.compactToTarget(adjuster.nextBits(tip, 1100)));
    }

    @Test
    public void easiestTargetIsCappedAtLimit() {
        BlockIndexEntry tip = chain(POW_LIMIT_BITS, 0, 1000, 2000, 3000);
        DifficultyAdjuster adjuster = new DifficultyAdjuster(chainIndex, INTERVAL, SPACING, POW_LIMIT_BITS, 0);
        Assertions.assertEquals(adjuster.getPowLimit(), DifficultyUtils.compactToTarget(adjuster.nextBits(tip, 4000)));
    }

    @Test
    public void sameHistoryGivesSameTarget() {
        BlockIndexEntry tip = chain(START_BITS, 0, 100, 170, 400);
        DifficultyAdjuster first = new DifficultyAdjuster(chainIndex, INTERVAL, SPACING, POW_LIMIT_BITS, 0);
        DifficultyAdjuster second = new DifficultyAdjuster(new ChainIndex(store), INTERVAL, SPACING, POW_LIMIT_BITS, 0);
        Assertions.assertArrayEquals(first.nextBits(tip, 500), second.nextBits(tip, 900));
    }

    @Test
    public void longGapAllowsMinimumDifficulty() {
        BlockIndexEntry tip = chain(START_BITS, 0, 60);
        DifficultyAdjuster adjuster = new DifficultyAdjuster(chainIndex, INTERVAL, SPACING, POW_LIMIT_BITS, 600);
        Assertions.assertArrayEquals(POW_LIMIT_BITS, adjuster.nextBits(tip, 60 + 601));
        Assertions.assertArrayEquals(START_BITS, adjuster.nextBits(tip, 60 + 600));

        // 最低难度区块之后恢复到最近一个正常难度
        BlockIndexEntry easy = append(tip, 700, POW_LIMIT_BITS);
        Assertions.assertArrayEquals(START_BITS, adjuster.nextBits(easy, 760));
    }

    /**
     * 从创世开始按给定时间构造一条索引链
     */
    private BlockIndexEntry chain(byte[] bits, long... times) {
        BlockIndexEntry genesis = new BlockIndexEntry(hashFor(0), new byte[32], 0, times[0], bits.clone(),
                DifficultyUtils.blockWork(bits), BlockStatus.VALID, null);
        store.newBatch().putIndexEntry(genesis).commit();
        BlockIndexEntry current = genesis;
        for (int i = 1; i < times.length; i++) {
            current = append(current, times[i], bits);
        }
        return current;
    }

    private BlockIndexEntry append(BlockIndexEntry parent, long time, byte[] bits) {
        long height = parent.getHeight() + 1;
        BlockIndexEntry entry = new BlockIndexEntry(hashFor(height), parent.getHash(), height, time, bits.clone(),
                parent.getChainWork().add(DifficultyUtils.blockWork(bits)), BlockStatus.VALID, null);
        store.newBatch().putIndexEntry(entry).commit();
        return entry;
    }

    private static byte[] hashFor(long height) {
        byte[] hash = new byte[32];
        hash[0] = 1;
        hash[31] = (byte) height;
        return hash;
    }
}
