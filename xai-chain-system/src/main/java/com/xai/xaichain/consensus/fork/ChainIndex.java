package com.xai.xaichain.consensus.fork;

import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.exception.StorageFailureException;
import com.xai.xaichain.storage.BlockStore;
import com.xai.xaichain.util.CryptoUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.xai.xaichain.constant.BlockChainConstants.TIME_WINDOW_SIZE;

/**
 * 区块索引上的遍历：父区块只通过哈希在存储中查找
 */
public class ChainIndex {

    private final BlockStore blockStore;

    public ChainIndex(BlockStore blockStore) {
        this.blockStore = blockStore;
    }

    public BlockIndexEntry getEntry(byte[] hash) {
        return hash == null ? null : blockStore.getIndexEntry(hash);
    }

    public BlockIndexEntry getParent(BlockIndexEntry entry) {
        if (entry.getHeight() == 0) {
            return null;
        }
        return requireEntry(entry.getPreviousHash());
    }

    /**
     * entry 所在分支上指定高度的祖先
     */
    public BlockIndexEntry getAncestor(BlockIndexEntry entry, long height) {
        if (height < 0 || height > entry.getHeight()) {
            return null;
        }
        BlockIndexEntry current = entry;
        while (current.getHeight() > height) {
            current = requireEntry(current.getPreviousHash());
        }
        return current;
    }

    /**
     * 包括 entry 在内的最近 11 个区块时间的中位数
     */
    public long medianTimePast(BlockIndexEntry entry) {
        List<Long> times = new ArrayList<>(TIME_WINDOW_SIZE);
        BlockIndexEntry current = entry;
        while (current != null && times.size() < TIME_WINDOW_SIZE) {
            times.add(current.getTime());
            current = getParent(current);
        }
        Collections.sort(times);
        return times.get(times.size() / 2);
    }

    /**
     * 两个分支的最近公共祖先
     */
    public BlockIndexEntry findCommonAncestor(BlockIndexEntry a, BlockIndexEntry b) {
        BlockIndexEntry left = a;
        BlockIndexEntry right = b;
        while (left.getHeight() > right.getHeight()) {
            left = requireEntry(left.getPreviousHash());
        }
        while (right.getHeight() > left.getHeight()) {
            right = requireEntry(right.getPreviousHash());
        }
        while (!Arrays.equals(left.getHash(), right.getHash())) {
            if (left.getHeight() == 0) {
                throw new StorageFailureException("两个分支没有公共祖先，创世区块不一致");
            }
            left = requireEntry(left.getPreviousHash());
            right = requireEntry(right.getPreviousHash());
        }
        return left;
    }

    /**
     * 从 ancestor（不含）到 tip（含）的分支，按高度升序
     */
    public List<BlockIndexEntry> branchFrom(BlockIndexEntry ancestor, BlockIndexEntry tip) {
        List<BlockIndexEntry> branch = new ArrayList<>();
        BlockIndexEntry current = tip;
        while (current.getHeight() > ancestor.getHeight()) {
            branch.add(current);
            current = requireEntry(current.getPreviousHash());
        }
        Collections.reverse(branch);
        return branch;
    }

    private BlockIndexEntry requireEntry(byte[] hash) {
        BlockIndexEntry entry = blockStore.getIndexEntry(hash);
        if (entry == null) {
            throw new StorageFailureException("区块索引缺失: " + CryptoUtil.bytesToHex(hash));
        }
        return entry;
    }
}
