package com.xai.xaichain.consensus.fork;

import com.xai.xaichain.consensus.checkpoint.CheckpointManager;
import com.xai.xaichain.consensus.pow.RewardSchedule;
import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.data.block.BlockStatus;
import com.xai.xaichain.data.block.ChainTip;
import com.xai.xaichain.data.block.TipChange;
import com.xai.xaichain.data.block.TipChangeType;
import com.xai.xaichain.data.checkpoint.Checkpoint;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.exception.ChainException;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ReorgTooDeepException;
import com.xai.xaichain.exception.StorageFailureException;
import com.xai.xaichain.ledger.UtxoLedger;
import com.xai.xaichain.storage.ChainStore;
import com.xai.xaichain.storage.StoreBatch;
import com.xai.xaichain.util.CryptoUtil;
import com.xai.xaichain.validation.BlockValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 分叉选择：维护全部链尖，选出累计工作量最大的作为主链，按深度限制执行重组
 * 状态变更全部委托给账本的 apply/revert；调用方必须持有链锁
 */
@Slf4j
public class ForkChoiceManager {

    private final ChainStore store;
    private final ChainIndex chainIndex;
    private final UtxoLedger ledger;
    private final BlockValidator blockValidator;
    private final RewardSchedule rewardSchedule;
    private final CheckpointManager checkpointManager;
    private final int maxReorgDepth;

    // 已知链尖（含主链链尖）：哈希 -> 链尖
    private final Map<String, ChainTip> tips = new ConcurrentHashMap<>();

    public ForkChoiceManager(ChainStore store, ChainIndex chainIndex, UtxoLedger ledger, BlockValidator blockValidator,
                             RewardSchedule rewardSchedule, CheckpointManager checkpointManager, int maxReorgDepth) {
        this.store = store;
        this.chainIndex = chainIndex;
        this.ledger = ledger;
        this.blockValidator = blockValidator;
        this.rewardSchedule = rewardSchedule;
        this.checkpointManager = checkpointManager;
        this.maxReorgDepth = maxReorgDepth;
    }

    /**
     * 启动时从区块索引恢复链尖：没有有效子区块的有效区块
     */
    public void rebuildTips() {
        tips.clear();
        List<BlockIndexEntry> valid = new ArrayList<>();
        Set<String> parents = new HashSet<>();
        store.forEachIndexEntry(entry -> {
            if (entry.isValid()) {
                valid.add(entry);
                if (entry.getHeight() > 0) {
                    parents.add(CryptoUtil.bytesToHex(entry.getPreviousHash()));
                }
            }
        });
        for (BlockIndexEntry entry : valid) {
            if (!parents.contains(entry.getHashHex())) {
                tips.put(entry.getHashHex(), entry.toTip());
            }
        }
        ChainTip mainTip = getMainTip();
        tips.put(mainTip.getHashHex(), mainTip);
        log.info("恢复链尖 {} 个，主链链尖: {}", tips.size(), mainTip);
    }

    public ChainTip getMainTip() {
        byte[] tipHash = store.getTipHash();
        BlockIndexEntry entry = chainIndex.getEntry(tipHash);
        if (entry == null) {
            throw new StorageFailureException("主链链尖索引缺失: " + CryptoUtil.bytesToHex(tipHash));
        }
        return entry.toTip();
    }

    public List<ChainTip> getTips() {
        return new ArrayList<>(tips.values());
    }

    public int getTipCount() {
        return tips.size();
    }

    /**
     * 新的有效区块成为链尖，它的父区块不再是链尖
     */
    public void addCandidate(BlockIndexEntry entry) {
        tips.remove(CryptoUtil.bytesToHex(entry.getPreviousHash()));
        tips.put(entry.getHashHex(), entry.toTip());
    }

    /**
     * 把主链切换到最优的链尖
     * @return 链尖未变化返回 null
     * @throws ReorgTooDeepException 最优分支需要的重组超过深度上限或越过检查点，且没有其他可切换的分支
     */
    public TipChange activateBestChain() {
        ChainTip mainTip = getMainTip();
        BlockIndexEntry mainEntry = chainIndex.getEntry(mainTip.getHash());
        List<ChainTip> candidates = new ArrayList<>(tips.values());
        candidates.sort((a, b) -> a.isBetterThan(b) ? -1 : (b.isBetterThan(a) ? 1 : 0));

        ReorgTooDeepException refused = null;
        for (ChainTip candidate : candidates) {
            if (!candidate.isBetterThan(mainTip)) {
                break;
            }
            BlockIndexEntry candidateEntry = chainIndex.getEntry(candidate.getHash());
            if (candidateEntry == null || !candidateEntry.isValid()) {
                tips.remove(candidate.getHashHex());
                continue;
            }
            BlockIndexEntry ancestor = chainIndex.findCommonAncestor(mainEntry, candidateEntry);
            try {
                checkReorgBounds(mainEntry, candidateEntry, ancestor);
            } catch (ReorgTooDeepException e) {
                log.warn("拒绝重组，疑似攻击: {}", e.getMessage());
                tips.remove(candidate.getHashHex());
                if (refused == null) {
                    refused = e;
                }
                continue;
            }
            return switchTo(mainEntry, candidateEntry, ancestor);
        }
        if (refused != null) {
            throw refused;
        }
        return null;
    }

    /**
     * 重组深度不能超过上限，公共祖先不能低于已确认的检查点
     */
    public void checkReorgBounds(BlockIndexEntry mainEntry, BlockIndexEntry candidate, BlockIndexEntry ancestor) {
        long depth = mainEntry.getHeight() - ancestor.getHeight();
        if (depth == 0) {
            return;
        }
        if (depth > maxReorgDepth) {
            throw new ReorgTooDeepException(RejectReason.REORG_TOO_DEEP,
                    "分支 " + candidate.getHashHex() + " 需要回滚 " + depth + " 个区块，上限 " + maxReorgDepth);
        }
        long finalized = checkpointManager.finalizedHeight(mainEntry.getHeight());
        if (ancestor.getHeight() < finalized) {
            throw new ReorgTooDeepException(RejectReason.REORG_BELOW_CHECKPOINT,
                    "分支 " + candidate.getHashHex() + " 的分叉点 " + ancestor.getHeight() + " 低于检查点高度 " + finalized);
        }
    }

    private TipChange switchTo(BlockIndexEntry oldTip, BlockIndexEntry newTip, BlockIndexEntry ancestor) {
        List<BlockIndexEntry> toDisconnect = chainIndex.branchFrom(ancestor, oldTip);
        List<BlockIndexEntry> toConnect = chainIndex.branchFrom(ancestor, newTip);
        if (!toDisconnect.isEmpty()) {
            log.info("开始重组: 公共祖先高度 {}，回滚 {} 个区块，应用 {} 个区块，旧链尖 {}，新链尖 {}",
                    ancestor.getHeight(), toDisconnect.size(), toConnect.size(), oldTip.getHashHex(), newTip.getHashHex());
        }

        // 先全部回滚，再应用新分支
        List<Block> disconnected = new ArrayList<>();
        for (int i = toDisconnect.size() - 1; i >= 0; i--) {
            BlockIndexEntry entry = toDisconnect.get(i);
            Block block = loadBlock(entry);
            disconnectBlock(block, entry.getHeight());
            disconnected.add(block);
        }

        List<Block> connected = new ArrayList<>();
        // 检查点在整个分支连接成功后才保存
        List<Checkpoint> pendingCheckpoints = new ArrayList<>();
        for (BlockIndexEntry entry : toConnect) {
            Block block = loadBlock(entry);
            try {
                connectBlock(block, entry.getHeight(), pendingCheckpoints);
            } catch (StorageFailureException e) {
                throw e;
            } catch (ChainException e) {
                log.warn("区块 {} 高度 {} 连接失败: {}，恢复原主链", entry.getHashHex(), entry.getHeight(), e.getMessage());
                restore(connected, disconnected);
                markInvalid(entry, newTip);
                throw e;
            }
            connected.add(block);
        }
        checkpointManager.commit(pendingCheckpoints);

        TipChangeType type = disconnected.isEmpty() ? TipChangeType.EXTENDED : TipChangeType.REORG;
        if (type == TipChangeType.REORG) {
            log.info("重组完成: 新主链高度 {}，哈希 {}", newTip.getHeight(), newTip.getHashHex());
        } else {
            log.info("主链扩展到高度: {}, 哈希: {}", newTip.getHeight(), newTip.getHashHex());
        }
        return new TipChange(type, oldTip.toTip(), newTip.toTip(), connected, disconnected);
    }

    /**
     * 在当前账本状态（即父区块状态）上完整验证交易并应用
     * @param pendingCheckpoints 收集到达间隔高度的快照，为 null 时不做快照
     */
    private void connectBlock(Block block, long height, List<Checkpoint> pendingCheckpoints) {
        block.setHeight(height);
        long reward = rewardSchedule.rewardAt(height, ledger.getTotalSupply());
        blockValidator.validateTransactions(block, height, ledger, reward);
        ledger.applyBlock(block, height, batch -> {
            batch.putMainBlockHash(height, block.getHash()).putTipHash(block.getHash());
            for (Transaction tx : block.getTransactions()) {
                batch.putTransactionIndex(tx.getTxId(), block.getHash());
            }
        });
        if (pendingCheckpoints != null) {
            Checkpoint checkpoint = checkpointManager.snapshotIfDue(height, block.getHash());
            if (checkpoint != null) {
                pendingCheckpoints.add(checkpoint);
            }
        }
    }

    private void disconnectBlock(Block block, long height) {
        ledger.revertBlock(block, height, batch -> {
            batch.deleteMainBlockHash(height).putTipHash(block.getPreviousHash());
            for (Transaction tx : block.getTransactions()) {
                batch.deleteTransactionIndex(tx.getTxId());
            }
        });
        log.debug("回滚区块 高度:{} 哈希:{}", height, block.getHashHex());
    }

    /**
     * 回滚本次已应用的新分支区块，重新应用被回滚的旧主链
     */
    private void restore(List<Block> connected, List<Block> disconnected) {
        for (int i = connected.size() - 1; i >= 0; i--) {
            Block block = connected.get(i);
            disconnectBlock(block, block.getHeight());
        }
        for (int i = disconnected.size() - 1; i >= 0; i--) {
            Block block = disconnected.get(i);
            try {
                connectBlock(block, block.getHeight(), null);
            } catch (StorageFailureException e) {
                throw e;
            } catch (ChainException e) {
                throw new StorageFailureException("恢复原主链失败，区块 " + block.getHashHex(), e);
            }
        }
    }

    /**
     * 标记失败区块及其所在分支的后代无效，并移除以它为祖先的链尖
     */
    private void markInvalid(BlockIndexEntry failed, BlockIndexEntry branchTip) {
        StoreBatch batch = store.newBatch();
        Set<String> marked = new HashSet<>();
        markRange(batch, branchTip, failed, marked);
        for (ChainTip tip : new ArrayList<>(tips.values())) {
            BlockIndexEntry tipEntry = chainIndex.getEntry(tip.getHash());
            if (tipEntry == null) {
                tips.remove(tip.getHashHex());
                continue;
            }
            BlockIndexEntry ancestor = chainIndex.getAncestor(tipEntry, failed.getHeight());
            if (ancestor != null && Arrays.equals(ancestor.getHash(), failed.getHash())) {
                markRange(batch, tipEntry, failed, marked);
                tips.remove(tip.getHashHex());
            }
        }
        batch.commit();

        BlockIndexEntry parent = chainIndex.getParent(failed);
        if (parent != null && !isAncestorOfAnyTip(parent)) {
            tips.put(parent.getHashHex(), parent.toTip());
        }
        log.warn("区块 {} 及其后代 {} 个区块被标记为无效", failed.getHashHex(), marked.size() - 1);
    }

    private void markRange(StoreBatch batch, BlockIndexEntry from, BlockIndexEntry failed, Set<String> marked) {
        BlockIndexEntry current = from;
        while (current.getHeight() >= failed.getHeight()) {
            if (marked.add(current.getHashHex())) {
                current.setStatus(BlockStatus.INVALID);
                batch.putIndexEntry(current);
            }
            if (current.getHeight() == failed.getHeight()) {
                break;
            }
            current = chainIndex.getParent(current);
        }
    }

    private boolean isAncestorOfAnyTip(BlockIndexEntry entry) {
        for (ChainTip tip : tips.values()) {
            BlockIndexEntry tipEntry = chainIndex.getEntry(tip.getHash());
            if (tipEntry == null) {
                continue;
            }
            BlockIndexEntry ancestor = chainIndex.getAncestor(tipEntry, entry.getHeight());
            if (ancestor != null && Arrays.equals(ancestor.getHash(), entry.getHash())) {
                return true;
            }
        }
        return false;
    }

    private Block loadBlock(BlockIndexEntry entry) {
        Block block = store.getBlock(entry.getHash());
        if (block == null) {
            throw new StorageFailureException("区块数据缺失: " + entry.getHashHex());
        }
        block.setHeight(entry.getHeight());
        return block;
    }
}
