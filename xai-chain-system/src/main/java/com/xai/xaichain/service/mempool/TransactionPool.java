package com.xai.xaichain.service.mempool;

import com.xai.xaichain.config.SystemConfig;
import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.mempool.AdmissionResult;
import com.xai.xaichain.data.mempool.MempoolEntry;
import com.xai.xaichain.data.mempool.MempoolStats;
import com.xai.xaichain.data.transaction.Outpoint;
import com.xai.xaichain.data.transaction.TXInput;
import com.xai.xaichain.data.transaction.TXOutput;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.data.transaction.TransactionKind;
import com.xai.xaichain.data.transaction.UTXO;
import com.xai.xaichain.exception.ChainException;
import com.xai.xaichain.exception.ConsensusViolationException;
import com.xai.xaichain.exception.MissingOutpointException;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ResourceExhaustedException;
import com.xai.xaichain.exception.ValidationException;
import com.xai.xaichain.ledger.LedgerView;
import com.xai.xaichain.ledger.OverlayLedgerView;
import com.xai.xaichain.network.PeerReputationReporter;
import com.xai.xaichain.util.CryptoUtil;
import com.xai.xaichain.validation.TransactionValidator;
import com.xai.xaichain.validation.TxValidationResult;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 交易池：按手续费率排序，同费率先进先出
 * 准入检查费率下限、单发送者上限、冷却期；超出容量时淘汰费率最低的交易及依赖它的交易
 * 交易池锁独立于链锁，两者同时持有时顺序为 链锁 -> 交易池锁
 */
@Slf4j
public class TransactionPool {

    // 费率高的在前，同费率按插入序号
    private static final Comparator<MempoolEntry> PRIORITY_ORDER = (a, b) -> {
        int compare = b.compareFeeRate(a);
        if (compare != 0) {
            return compare;
        }
        return Long.compare(a.getSequence(), b.getSequence());
    };

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final TransactionValidator validator;
    private final SystemConfig.Mempool config;
    private final SenderBanTracker banTracker;
    private final PeerReputationReporter reputationReporter;
    private final Clock clock;

    // 交易ID -> 条目
    private final Map<String, MempoolEntry> entries = new HashMap<>();
    private final TreeSet<MempoolEntry> byPriority = new TreeSet<>(PRIORITY_ORDER);
    // 输出引用 -> 花费它的池内交易
    private final Map<String, String> spentInputs = new HashMap<>();
    // 账户发送者 -> nonce -> 池内交易
    private final Map<String, NavigableMap<Long, String>> accountNonces = new HashMap<>();
    // 发送者 -> 池内交易
    private final Map<String, Set<String>> bySender = new HashMap<>();
    private long totalBytes;
    private long sequence;

    // nonce 超前的账户交易：发送者 -> nonce -> 交易
    private final Map<String, NavigableMap<Long, PendingTransaction>> futureBySender = new HashMap<>();
    private int futureCount;

    // 引用未知交易输出的孤儿交易，按到达顺序
    private final LinkedHashMap<String, PendingTransaction> orphans = new LinkedHashMap<>();
    // 缺失的父交易 -> 等待它的孤儿交易
    private final Map<String, Set<String>> orphansByParent = new HashMap<>();

    private long evictedTotal;
    private long expiredTotal;
    private long replacedTotal;

    public TransactionPool(TransactionValidator validator, SystemConfig.Mempool config, Clock clock,
                           PeerReputationReporter reputationReporter) {
        this.validator = validator;
        this.config = config;
        this.clock = clock;
        this.reputationReporter = reputationReporter;
        this.banTracker = new SenderBanTracker(config.getInvalidThreshold(), config.getInvalidWindowSeconds(),
                config.getInvalidBanSeconds(), clock);
    }

    // ------------------------------ 准入 ------------------------------

    /**
     * 提交一笔交易
     * @param sourcePeer 来源节点，本地或 RPC 提交为 null
     * @throws ChainException 被拒绝，reason 为类型化的拒绝原因
     */
    public AdmissionResult submit(Transaction tx, MempoolContext context, String sourcePeer) {
        lock.writeLock().lock();
        try {
            expireLocked();
            return admit(tx, context, sourcePeer, clock.millis(), true);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private AdmissionResult admit(Transaction tx, MempoolContext context, String sourcePeer, long receivedAt, boolean external) {
        try {
            validator.validateStateless(tx);
        } catch (ValidationException e) {
            if (external) {
                recordInvalid(senderOf(tx), sourcePeer, tx.getTxIdHex(), e.getReason());
            }
            throw e;
        }
        String txId = tx.getTxIdHex();
        if (entries.containsKey(txId) || orphans.containsKey(txId) || isQueuedFuture(tx)) {
            throw new ValidationException(RejectReason.DUPLICATE, "交易已在交易池中: " + txId);
        }
        if (context.getConfirmedTransaction().test(tx.getTxId())) {
            throw new ValidationException(RejectReason.ALREADY_CONFIRMED, "交易已在主链上: " + txId);
        }
        String sender = tx.getSenderAddress();
        if (external && banTracker.isBanned(sender)) {
            throw new ResourceExhaustedException(RejectReason.SENDER_BANNED, "发送者 " + sender + " 处于冷却期");
        }

        Set<String> conflicts = findConflicts(tx, sender);
        if (!conflicts.isEmpty()) {
            checkReplaceable(tx, conflicts, sourcePeer, external);
        }

        long height = context.getNextHeight();
        PoolView view = new PoolView(context.getChainView(), height, conflicts);
        TxValidationResult result = validator.validateStateful(tx, view, height);
        if (result.isFutureNonce()) {
            queueFuture(tx, sender, sourcePeer, receivedAt);
            log.debug("交易 {} nonce超前，进入等待队列: {}", txId, result.getMessage());
            return AdmissionResult.FUTURE_NONCE;
        }
        if (!result.isValid()) {
            if (result.getReason() == RejectReason.MISSING_OUTPOINT && isUnknownParent(result.getMissingOutpoint(), context)) {
                queueOrphan(tx, sourcePeer, receivedAt, result.getMissingOutpoint());
                return AdmissionResult.ORPHAN;
            }
            if (external) {
                recordInvalid(sender, sourcePeer, txId, result.getReason());
            }
            throw result.toException();
        }

        long fee = result.getFee();
        int size = tx.calculateSize();
        if (MempoolEntry.compareFeeRate(fee, size, config.getMinFeeRate(), 1) < 0) {
            throw new ValidationException(RejectReason.FEE_TOO_LOW,
                    "手续费 " + fee + " / " + size + " 字节低于最低费率 " + config.getMinFeeRate());
        }
        checkSenderLimit(sender, conflicts);
        if (!conflicts.isEmpty()) {
            checkReplacementFee(fee, size, conflicts);
        }

        MempoolEntry entry = new MempoolEntry(tx, txId, sender, fee, size, receivedAt, sequence++,
                context.getStateVersion(), context.getTipHash(), sourcePeer);
        if (conflicts.isEmpty()) {
            checkCapacity(entry);
        } else {
            for (String conflict : conflicts) {
                removeEntry(conflict);
            }
            replacedTotal += conflicts.size();
            log.info("交易 {} 替换了 {} 笔冲突交易", txId, conflicts.size());
        }
        insert(entry);
        evictOverflow(entry);
        log.debug("交易 {} 进入交易池，手续费 {}，大小 {}", txId, fee, size);

        promoteDependents(tx, sender, context);
        return conflicts.isEmpty() ? AdmissionResult.ACCEPTED : AdmissionResult.REPLACED;
    }

    /**
     * 与池内交易冲突：花费同一输出，或同一账户发送者的同一 nonce
     */
    private Set<String> findConflicts(Transaction tx, String sender) {
        Set<String> conflicts = new LinkedHashSet<>();
        for (TXInput input : tx.getInputs()) {
            String spender = spentInputs.get(input.toOutpoint().toKeyHex());
            if (spender != null) {
                conflicts.add(spender);
            }
        }
        if (tx.getKind() == TransactionKind.ACCOUNT) {
            NavigableMap<Long, String> nonces = accountNonces.get(sender);
            if (nonces != null && nonces.containsKey(tx.getNonce())) {
                conflicts.add(nonces.get(tx.getNonce()));
            }
        }
        return conflicts;
    }

    /**
     * 冲突交易必须都声明可替换且没有池内后代，否则按双花处理
     */
    private void checkReplaceable(Transaction tx, Set<String> conflicts, String sourcePeer, boolean external) {
        for (String conflict : conflicts) {
            MempoolEntry existing = entries.get(conflict);
            if (config.isRbfEnabled() && existing.getTransaction().isReplaceable() && !hasDescendants(existing)) {
                continue;
            }
            Outpoint outpoint = firstSharedOutpoint(tx, existing.getTransaction());
            ChainException rejection = outpoint != null
                    ? new MissingOutpointException(outpoint)
                    : new ConsensusViolationException(RejectReason.NONCE_REUSED,
                    "nonce " + tx.getNonce() + " 已被池内交易 " + conflict + " 使用");
            if (external) {
                recordInvalid(tx.getSenderAddress(), sourcePeer, tx.getTxIdHex(), rejection.getReason());
            }
            throw rejection;
        }
    }

    private void checkReplacementFee(long fee, int size, Set<String> conflicts) {
        long conflictFees = 0;
        for (String conflict : conflicts) {
            MempoolEntry existing = entries.get(conflict);
            conflictFees += existing.getFee();
            if (MempoolEntry.compareFeeRate(fee, size, existing.getFee(), existing.getSize()) <= 0) {
                throw new ValidationException(RejectReason.INSUFFICIENT_REPLACEMENT_FEE,
                        "替换交易的费率必须高于被替换交易 " + conflict);
            }
        }
        if (fee <= conflictFees) {
            throw new ValidationException(RejectReason.INSUFFICIENT_REPLACEMENT_FEE,
                    "替换交易手续费 " + fee + " 必须高于被替换交易合计 " + conflictFees);
        }
    }

    private void checkSenderLimit(String sender, Set<String> conflicts) {
        if (pendingCount(sender, conflicts) >= config.getMaxPerSender()) {
            throw new ResourceExhaustedException(RejectReason.SENDER_LIMIT,
                    "发送者 " + sender + " 待处理交易已达上限 " + config.getMaxPerSender());
        }
    }

    private int pendingCount(String sender, Set<String> excluded) {
        int count = 0;
        Set<String> pooled = bySender.get(sender);
        if (pooled != null) {
            for (String txId : pooled) {
                if (!excluded.contains(txId)) {
                    count++;
                }
            }
        }
        NavigableMap<Long, PendingTransaction> future = futureBySender.get(sender);
        if (future != null) {
            count += future.size();
        }
        return count;
    }

    /**
     * 池满时新交易的费率必须高于当前最低的交易
     */
    private void checkCapacity(MempoolEntry entry) {
        if (entry.getSize() > config.getMaxBytes()) {
            throw new ResourceExhaustedException(RejectReason.MEMPOOL_FULL, "交易大小超过交易池容量");
        }
        boolean full = entries.size() + 1 > config.getMaxTransactions()
                || totalBytes + entry.getSize() > config.getMaxBytes();
        if (full && !byPriority.isEmpty() && entry.compareFeeRate(byPriority.last()) <= 0) {
            throw new ResourceExhaustedException(RejectReason.MEMPOOL_FULL,
                    "交易池已满，交易费率不高于池内最低费率");
        }
    }

    /**
     * 超出容量时从费率最低的交易开始淘汰，连同依赖它的交易
     */
    private void evictOverflow(MempoolEntry added) {
        while (!byPriority.isEmpty()
                && (entries.size() > config.getMaxTransactions() || totalBytes > config.getMaxBytes())) {
            MempoolEntry lowest = byPriority.last();
            int removed = removeWithDependents(lowest.getTxId());
            evictedTotal += removed;
            log.info("交易池超出容量，淘汰交易 {}（费率 {}）及依赖交易，共 {} 笔", lowest.getTxId(),
                    String.format("%.2f", lowest.getFeeRate()), removed);
        }
        if (!entries.containsKey(added.getTxId())) {
            throw new ResourceExhaustedException(RejectReason.MEMPOOL_FULL, "交易池已满，交易被淘汰");
        }
    }

    private boolean isUnknownParent(Outpoint outpoint, MempoolContext context) {
        if (outpoint == null) {
            return false;
        }
        return !entries.containsKey(CryptoUtil.bytesToHex(outpoint.getTxId()))
                && !context.getConfirmedTransaction().test(outpoint.getTxId());
    }

    private void recordInvalid(String sender, String sourcePeer, String txId, RejectReason reason) {
        banTracker.recordInvalid(sender);
        if (sourcePeer != null) {
            reputationReporter.reportInvalidTransaction(sourcePeer, txId, reason);
        }
    }

    // ------------------------------ 等待队列 ------------------------------

    private boolean isQueuedFuture(Transaction tx) {
        if (tx.getKind() != TransactionKind.ACCOUNT) {
            return false;
        }
        NavigableMap<Long, PendingTransaction> queue = futureBySender.get(tx.getSenderAddress());
        if (queue == null) {
            return false;
        }
        PendingTransaction queued = queue.get(tx.getNonce());
        return queued != null && queued.getTransaction().getTxIdHex().equals(tx.getTxIdHex());
    }

    private void queueFuture(Transaction tx, String sender, String sourcePeer, long receivedAt) {
        if (futureCount >= config.getMaxFutureTransactions()) {
            throw new ResourceExhaustedException(RejectReason.MEMPOOL_FULL, "nonce等待队列已满");
        }
        if (pendingCount(sender, Collections.emptySet()) >= config.getMaxPerSender()) {
            throw new ResourceExhaustedException(RejectReason.SENDER_LIMIT,
                    "发送者 " + sender + " 待处理交易已达上限 " + config.getMaxPerSender());
        }
        NavigableMap<Long, PendingTransaction> queue = futureBySender.computeIfAbsent(sender, k -> new TreeMap<>());
        if (queue.containsKey(tx.getNonce())) {
            throw new ValidationException(RejectReason.DUPLICATE, "nonce " + tx.getNonce() + " 已有等待中的交易");
        }
        queue.put(tx.getNonce(), new PendingTransaction(tx, sourcePeer, receivedAt, null));
        futureCount++;
    }

    private void queueOrphan(Transaction tx, String sourcePeer, long receivedAt, Outpoint missing) {
        if (orphans.size() >= config.getMaxOrphanTransactions()) {
            Iterator<String> oldest = orphans.keySet().iterator();
            String dropped = oldest.next();
            removeOrphan(dropped);
            log.debug("孤儿交易已满，丢弃最早的 {}", dropped);
        }
        String parent = CryptoUtil.bytesToHex(missing.getTxId());
        orphans.put(tx.getTxIdHex(), new PendingTransaction(tx, sourcePeer, receivedAt, parent));
        orphansByParent.computeIfAbsent(parent, k -> new LinkedHashSet<>()).add(tx.getTxIdHex());
        log.debug("交易 {} 引用未知交易 {}，暂存为孤儿交易", tx.getTxIdHex(), parent);
    }

    private PendingTransaction removeOrphan(String txId) {
        PendingTransaction orphan = orphans.remove(txId);
        if (orphan != null) {
            Set<String> waiting = orphansByParent.get(orphan.getWaitingFor());
            if (waiting != null) {
                waiting.remove(txId);
                if (waiting.isEmpty()) {
                    orphansByParent.remove(orphan.getWaitingFor());
                }
            }
        }
        return orphan;
    }

    /**
     * 新交易进池后，重试等待它的孤儿交易和同一发送者的下一个 nonce
     */
    private void promoteDependents(Transaction tx, String sender, MempoolContext context) {
        if (tx.getKind() == TransactionKind.ACCOUNT) {
            promoteFuture(sender, context);
        }
        Set<String> waiting = orphansByParent.remove(tx.getTxIdHex());
        if (waiting == null) {
            return;
        }
        for (String orphanId : new ArrayList<>(waiting)) {
            PendingTransaction orphan = orphans.remove(orphanId);
            if (orphan != null) {
                retry(orphan, context);
            }
        }
    }

    private void promoteFuture(String sender, MempoolContext context) {
        NavigableMap<Long, PendingTransaction> queue = futureBySender.get(sender);
        if (queue == null) {
            return;
        }
        long next = new PoolView(context.getChainView(), context.getNextHeight(), Collections.emptySet()).getNonce(sender);
        while (!queue.isEmpty() && queue.firstKey() < next) {
            queue.pollFirstEntry();
            futureCount--;
        }
        PendingTransaction ready = queue.remove(next);
        if (ready != null) {
            futureCount--;
        }
        if (queue.isEmpty()) {
            futureBySender.remove(sender);
        }
        if (ready != null) {
            log.debug("发送者 {} 的 nonce {} 已连续，提升等待中的交易", sender, next);
            retry(ready, context);
        }
    }

    private void retry(PendingTransaction pending, MempoolContext context) {
        try {
            admit(pending.getTransaction(), context, pending.getSourcePeer(), pending.getReceivedAt(), false);
        } catch (ChainException e) {
            log.debug("等待中的交易 {} 重新准入失败: {}", pending.getTransaction().getTxIdHex(), e.getMessage());
        }
    }

    // ------------------------------ 链状态变化 ------------------------------

    /**
     * 主链变化后：移除已确认交易，把被断开区块中的交易放回，受影响的交易按新状态重新验证
     * 主链只是延长时增量处理，发生重组时整个交易池重建
     * @param connected 新连接到主链的区块
     * @param disconnected 被断开区块中的非CoinBase交易，按原链顺序
     * @param reorg 是否有区块被断开
     * @return 被断开的交易中重新进入交易池的数量
     */
    public int onChainUpdated(List<Block> connected, List<Transaction> disconnected, boolean reorg, MempoolContext context) {
        lock.writeLock().lock();
        try {
            if (!reorg && disconnected.isEmpty()) {
                applyExtension(connected, context);
                return 0;
            }
            return rebuild(connected, disconnected, context);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 主链延长：只重新验证与新区块有关的交易，其余条目的状态不受影响
     */
    private void applyExtension(List<Block> connected, MempoolContext context) {
        Set<String> confirmed = new HashSet<>();
        Set<String> spentByBlocks = new HashSet<>();
        Set<String> touchedSenders = new LinkedHashSet<>();
        for (Block block : connected) {
            for (Transaction tx : block.getTransactions()) {
                confirmed.add(tx.getTxIdHex());
                if (tx.isCoinBase()) {
                    continue;
                }
                for (TXInput input : tx.getInputs()) {
                    spentByBlocks.add(input.toOutpoint().toKeyHex());
                }
                if (tx.getKind() == TransactionKind.ACCOUNT) {
                    touchedSenders.add(tx.getSenderAddress());
                }
            }
        }

        // 已确认的交易离开交易池，花费它输出的交易现在花费的是链上输出
        for (String txId : confirmed) {
            removeEntry(txId);
            removeOrphan(txId);
        }
        int dropped = 0;
        for (String outpoint : spentByBlocks) {
            String spender = spentInputs.get(outpoint);
            if (spender != null) {
                dropped += removeWithDependents(spender);
            }
        }

        // nonce 前进的账户发送者：取出其交易及依赖交易，按原顺序重新准入
        Set<String> recheckIds = new LinkedHashSet<>();
        for (String sender : touchedSenders) {
            Set<String> pooled = bySender.get(sender);
            if (pooled != null) {
                for (String txId : new ArrayList<>(pooled)) {
                    recheckIds.addAll(collectDependents(txId));
                }
            }
        }
        List<MempoolEntry> recheck = new ArrayList<>();
        for (String txId : recheckIds) {
            MempoolEntry entry = entries.get(txId);
            if (entry != null) {
                recheck.add(entry);
            }
        }
        recheck.sort(Comparator.comparingLong(MempoolEntry::getSequence));
        for (MempoolEntry entry : recheck) {
            removeEntry(entry.getTxId());
        }
        for (MempoolEntry entry : recheck) {
            try {
                admit(entry.getTransaction(), context, entry.getSourcePeer(), entry.getInsertedAt(), false);
            } catch (ChainException e) {
                dropped++;
                log.debug("交易 {} 在新链尖上失效: {}", entry.getTxId(), e.getMessage());
            }
        }

        for (String sender : touchedSenders) {
            promoteFuture(sender, context);
        }
        for (String txId : confirmed) {
            Set<String> waiting = orphansByParent.remove(txId);
            if (waiting == null) {
                continue;
            }
            for (String orphanId : new ArrayList<>(waiting)) {
                PendingTransaction orphan = orphans.remove(orphanId);
                if (orphan != null) {
                    retry(orphan, context);
                }
            }
        }
        expireLocked();
        log.info("交易池按链尖 {} 更新: 池内 {} 笔，重新验证 {} 笔，丢弃 {} 笔",
                context.getTipHash(), entries.size(), recheck.size(), dropped);
    }

    private int rebuild(List<Block> connected, List<Transaction> disconnected, MempoolContext context) {
        Set<String> confirmed = new HashSet<>();
        for (Block block : connected) {
            for (Transaction tx : block.getTransactions()) {
                confirmed.add(tx.getTxIdHex());
            }
        }
        long now = clock.millis();
        List<PendingTransaction> resubmit = new ArrayList<>();
        for (Transaction tx : disconnected) {
            if (!confirmed.contains(tx.getTxIdHex())) {
                resubmit.add(new PendingTransaction(tx, null, now, null));
            }
        }
        int reinjectCount = resubmit.size();
        List<MempoolEntry> existing = new ArrayList<>(entries.values());
        existing.sort(Comparator.comparingLong(MempoolEntry::getSequence));
        for (MempoolEntry entry : existing) {
            if (!confirmed.contains(entry.getTxId())) {
                resubmit.add(new PendingTransaction(entry.getTransaction(), entry.getSourcePeer(), entry.getInsertedAt(), null));
            }
        }
        for (NavigableMap<Long, PendingTransaction> queue : futureBySender.values()) {
            resubmit.addAll(queue.values());
        }
        for (PendingTransaction orphan : orphans.values()) {
            if (!confirmed.contains(orphan.getTransaction().getTxIdHex())) {
                resubmit.add(orphan);
            }
        }

        clearLocked();
        int reinjected = 0;
        int dropped = 0;
        for (int i = 0; i < resubmit.size(); i++) {
            PendingTransaction pending = resubmit.get(i);
            try {
                admit(pending.getTransaction(), context, pending.getSourcePeer(), pending.getReceivedAt(), false);
                if (i < reinjectCount) {
                    reinjected++;
                }
            } catch (ChainException e) {
                dropped++;
                log.debug("交易 {} 在新链尖上失效: {}", pending.getTransaction().getTxIdHex(), e.getMessage());
            }
        }
        expireLocked();
        log.info("交易池按链尖 {} 重新验证: 池内 {} 笔，放回被断开交易 {} 笔，丢弃 {} 笔",
                context.getTipHash(), entries.size(), reinjected, dropped);
        return reinjected;
    }

    private void clearLocked() {
        entries.clear();
        byPriority.clear();
        spentInputs.clear();
        accountNonces.clear();
        bySender.clear();
        totalBytes = 0;
        futureBySender.clear();
        futureCount = 0;
        orphans.clear();
        orphansByParent.clear();
    }

    /**
     * 清理超过最长存活时间的交易
     */
    public void expire() {
        lock.writeLock().lock();
        try {
            expireLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void expireLocked() {
        long deadline = clock.millis() - TimeUnit.SECONDS.toMillis(config.getMaxAgeSeconds());
        List<String> stale = new ArrayList<>();
        for (MempoolEntry entry : entries.values()) {
            if (entry.getInsertedAt() <= deadline) {
                stale.add(entry.getTxId());
            }
        }
        int removed = 0;
        for (String txId : stale) {
            if (entries.containsKey(txId)) {
                removed += removeWithDependents(txId);
            }
        }
        Iterator<NavigableMap<Long, PendingTransaction>> queues = futureBySender.values().iterator();
        while (queues.hasNext()) {
            NavigableMap<Long, PendingTransaction> queue = queues.next();
            Iterator<PendingTransaction> it = queue.values().iterator();
            while (it.hasNext()) {
                if (it.next().getReceivedAt() <= deadline) {
                    it.remove();
                    futureCount--;
                    removed++;
                }
            }
            if (queue.isEmpty()) {
                queues.remove();
            }
        }
        List<String> staleOrphans = new ArrayList<>();
        for (PendingTransaction orphan : orphans.values()) {
            if (orphan.getReceivedAt() <= deadline) {
                staleOrphans.add(orphan.getTransaction().getTxIdHex());
            }
        }
        for (String txId : staleOrphans) {
            removeOrphan(txId);
            removed++;
        }
        if (removed > 0) {
            expiredTotal += removed;
            log.info("交易池清理过期交易 {} 笔", removed);
        }
    }

    // ------------------------------ 索引维护 ------------------------------

    private void insert(MempoolEntry entry) {
        Transaction tx = entry.getTransaction();
        entries.put(entry.getTxId(), entry);
        byPriority.add(entry);
        for (TXInput input : tx.getInputs()) {
            spentInputs.put(input.toOutpoint().toKeyHex(), entry.getTxId());
        }
        if (entry.isAccount()) {
            accountNonces.computeIfAbsent(entry.getSender(), k -> new TreeMap<>()).put(entry.getNonce(), entry.getTxId());
        }
        bySender.computeIfAbsent(entry.getSender(), k -> new LinkedHashSet<>()).add(entry.getTxId());
        totalBytes += entry.getSize();
    }

    private MempoolEntry removeEntry(String txId) {
        MempoolEntry entry = entries.remove(txId);
        if (entry == null) {
            return null;
        }
        byPriority.remove(entry);
        for (TXInput input : entry.getTransaction().getInputs()) {
            spentInputs.remove(input.toOutpoint().toKeyHex(), txId);
        }
        if (entry.isAccount()) {
            NavigableMap<Long, String> nonces = accountNonces.get(entry.getSender());
            if (nonces != null) {
                nonces.remove(entry.getNonce(), txId);
                if (nonces.isEmpty()) {
                    accountNonces.remove(entry.getSender());
                }
            }
        }
        Set<String> senderTxs = bySender.get(entry.getSender());
        if (senderTxs != null) {
            senderTxs.remove(txId);
            if (senderTxs.isEmpty()) {
                bySender.remove(entry.getSender());
            }
        }
        totalBytes -= entry.getSize();
        return entry;
    }

    /**
     * 移除交易及依赖它的交易：花费它输出的交易，同一账户发送者更高 nonce 的交易
     * @return 移除的数量
     */
    private int removeWithDependents(String txId) {
        Set<String> closure = collectDependents(txId);
        for (String id : closure) {
            removeEntry(id);
        }
        return closure.size();
    }

    /**
     * 交易本身及依赖它的池内交易
     */
    private Set<String> collectDependents(String txId) {
        Set<String> closure = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(txId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            MempoolEntry entry = entries.get(current);
            if (entry == null || !closure.add(current)) {
                continue;
            }
            Transaction tx = entry.getTransaction();
            for (int vout = 0; vout < tx.getOutputs().size(); vout++) {
                String spender = spentInputs.get(new Outpoint(tx.getTxId(), vout).toKeyHex());
                if (spender != null) {
                    queue.add(spender);
                }
            }
            if (entry.isAccount()) {
                NavigableMap<Long, String> nonces = accountNonces.get(entry.getSender());
                if (nonces != null) {
                    queue.addAll(nonces.tailMap(entry.getNonce(), false).values());
                }
            }
        }
        return closure;
    }

    private boolean hasDescendants(MempoolEntry entry) {
        Transaction tx = entry.getTransaction();
        for (int vout = 0; vout < tx.getOutputs().size(); vout++) {
            if (spentInputs.containsKey(new Outpoint(tx.getTxId(), vout).toKeyHex())) {
                return true;
            }
        }
        return false;
    }

    private static Outpoint firstSharedOutpoint(Transaction tx, Transaction other) {
        Set<String> keys = new HashSet<>();
        for (TXInput input : other.getInputs()) {
            keys.add(input.toOutpoint().toKeyHex());
        }
        for (TXInput input : tx.getInputs()) {
            if (keys.contains(input.toOutpoint().toKeyHex())) {
                return input.toOutpoint();
            }
        }
        return null;
    }

    private static String senderOf(Transaction tx) {
        if (tx == null || tx.getInputs() == null || tx.getKind() == null) {
            return null;
        }
        return tx.getSenderAddress();
    }

    // ------------------------------ 打包与查询 ------------------------------

    /**
     * 为区块模板挑选交易：按优先级顺序，在主链状态的叠加层上逐笔验证并应用
     * 依赖尚未选中交易的交易推迟到下一轮
     */
    public List<MempoolEntry> selectForBlock(LedgerView chainView, long height, long maxBytes, int maxCount) {
        List<MempoolEntry> pending;
        lock.readLock().lock();
        try {
            pending = new ArrayList<>(byPriority);
        } finally {
            lock.readLock().unlock();
        }
        OverlayLedgerView overlay = new OverlayLedgerView(chainView);
        List<MempoolEntry> selected = new ArrayList<>();
        long bytes = 0;
        boolean progress = true;
        while (progress && !pending.isEmpty() && selected.size() < maxCount) {
            progress = false;
            List<MempoolEntry> deferred = new ArrayList<>();
            for (MempoolEntry entry : pending) {
                if (selected.size() >= maxCount) {
                    break;
                }
                if (bytes + entry.getSize() > maxBytes) {
                    continue;
                }
                Transaction tx = entry.getTransaction();
                TxValidationResult result = validator.validateStateful(tx, overlay, height);
                if (result.isValid()) {
                    overlay.applyTransaction(tx, height);
                    selected.add(entry);
                    bytes += entry.getSize();
                    progress = true;
                } else if (result.isFutureNonce() || result.getReason() == RejectReason.MISSING_OUTPOINT) {
                    deferred.add(entry);
                } else {
                    log.debug("打包时跳过交易 {}: {}", entry.getTxId(), result);
                }
            }
            pending = deferred;
        }
        return selected;
    }

    public MempoolStats getStats() {
        lock.readLock().lock();
        try {
            MempoolStats stats = new MempoolStats();
            stats.setTransactionCount(entries.size());
            stats.setTotalBytes(totalBytes);
            stats.setFutureNonceCount(futureCount);
            stats.setOrphanCount(orphans.size());
            stats.setSenderCount(bySender.size());
            stats.setBannedSenderCount((int) banTracker.bannedCount());
            if (!byPriority.isEmpty()) {
                stats.setMaxFeeRate(byPriority.first().getFeeRate());
                stats.setMinFeeRate(byPriority.last().getFeeRate());
            }
            long fees = 0;
            for (MempoolEntry entry : entries.values()) {
                fees += entry.getFee();
            }
            stats.setTotalFees(fees);
            stats.setEvictedTotal(evictedTotal);
            stats.setExpiredTotal(expiredTotal);
            stats.setReplacedTotal(replacedTotal);
            return stats;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 按打包优先级排列的池内交易
     */
    public List<MempoolEntry> getEntries() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(byPriority);
        } finally {
            lock.readLock().unlock();
        }
    }

    public MempoolEntry getEntry(String txId) {
        lock.readLock().lock();
        try {
            return entries.get(txId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String txId) {
        return getEntry(txId) != null;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isBanned(String sender) {
        lock.readLock().lock();
        try {
            return banTracker.isBanned(sender);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 主链状态叠加池内交易的视图：池内交易的输出可被花费，账户 nonce 顺延到池内连续的最后一个
     */
    private class PoolView implements LedgerView {

        private final LedgerView chainView;
        private final long height;
        // 验证替换交易时忽略的冲突交易
        private final Set<String> excluded;

        PoolView(LedgerView chainView, long height, Set<String> excluded) {
            this.chainView = chainView;
            this.height = height;
            this.excluded = excluded;
        }

        @Override
        public UTXO getUtxo(Outpoint outpoint) {
            String producer = CryptoUtil.bytesToHex(outpoint.getTxId());
            MempoolEntry parent = entries.get(producer);
            if (parent != null && !excluded.contains(producer)) {
                List<TXOutput> outputs = parent.getTransaction().getOutputs();
                if (outpoint.getVout() < 0 || outpoint.getVout() >= outputs.size()) {
                    return null;
                }
                TXOutput output = outputs.get(outpoint.getVout());
                return new UTXO(outpoint.getTxId(), outpoint.getVout(), output.getAddress(), output.getValue(), height, false);
            }
            return chainView.getUtxo(outpoint);
        }

        @Override
        public long getNonce(String address) {
            long next = chainView.getNonce(address);
            NavigableMap<Long, String> pending = accountNonces.get(address);
            if (pending == null) {
                return next;
            }
            while (true) {
                String txId = pending.get(next);
                if (txId == null || excluded.contains(txId)) {
                    return next;
                }
                next++;
            }
        }
    }

    @Getter
    @AllArgsConstructor
    private static class PendingTransaction {
        private final Transaction transaction;
        private final String sourcePeer;
        private final long receivedAt;
        // 孤儿交易等待的父交易
        private final String waitingFor;
    }
}
