package com.xai.xaichain.service.blockChain;

import com.xai.xaichain.config.SystemConfig;
import com.xai.xaichain.consensus.checkpoint.CheckpointManager;
import com.xai.xaichain.consensus.fork.ChainIndex;
import com.xai.xaichain.consensus.fork.ForkChoiceManager;
import com.xai.xaichain.consensus.orphan.OrphanBlockPool;
import com.xai.xaichain.consensus.pow.DifficultyAdjuster;
import com.xai.xaichain.consensus.pow.MiningCancellationToken;
import com.xai.xaichain.consensus.pow.ProofOfWorkSolver;
import com.xai.xaichain.consensus.pow.RewardSchedule;
import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.BlockHeader;
import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.data.block.BlockStatus;
import com.xai.xaichain.data.block.BlockTemplate;
import com.xai.xaichain.data.block.ChainTip;
import com.xai.xaichain.data.block.MerkleProof;
import com.xai.xaichain.data.block.OrphanEntry;
import com.xai.xaichain.data.block.TipChange;
import com.xai.xaichain.data.block.TipChangeType;
import com.xai.xaichain.data.checkpoint.Checkpoint;
import com.xai.xaichain.data.mempool.AdmissionResult;
import com.xai.xaichain.data.mempool.MempoolEntry;
import com.xai.xaichain.data.mempool.MempoolStats;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.data.transaction.UTXO;
import com.xai.xaichain.data.vo.ChainStatus;
import com.xai.xaichain.event.ChainEventListener;
import com.xai.xaichain.event.RejectedTransactionEvent;
import com.xai.xaichain.event.ReorgEvent;
import com.xai.xaichain.exception.AmountOverflowException;
import com.xai.xaichain.exception.ChainException;
import com.xai.xaichain.exception.ConsensusViolationException;
import com.xai.xaichain.exception.ErrorCategory;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ReorgTooDeepException;
import com.xai.xaichain.exception.StorageFailureException;
import com.xai.xaichain.exception.UnsupportedChainException;
import com.xai.xaichain.exception.ValidationException;
import com.xai.xaichain.ledger.UtxoLedger;
import com.xai.xaichain.network.PeerReputationReporter;
import com.xai.xaichain.service.mempool.MempoolContext;
import com.xai.xaichain.service.mempool.TransactionPool;
import com.xai.xaichain.storage.ChainStore;
import com.xai.xaichain.util.CryptoUtil;
import com.xai.xaichain.util.DifficultyUtils;
import com.xai.xaichain.validation.BlockValidator;
import com.xai.xaichain.validation.TransactionValidator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static com.xai.xaichain.constant.BlockChainConstants.BLOCK_HEADER_SIZE;
import static com.xai.xaichain.constant.BlockChainConstants.BLOCK_VERSION_1;
import static com.xai.xaichain.constant.BlockChainConstants.GENESIS_PREV_BLOCK_HASH;
import static com.xai.xaichain.constant.BlockChainConstants.MAX_HEADERS_PER_REQUEST;

/**
 * 共识引擎：区块与交易的唯一入口
 * 所有链状态变更（区块索引、账本、分叉选择、孤块池）在链锁内串行执行；事件在释放链锁后派发
 * 锁顺序：链锁 -> 交易池锁
 */
@Slf4j
public class ConsensusEngine implements AutoCloseable {

    // 区块模板为区块头、交易数量前缀和CoinBase交易预留的字节数
    private static final int TEMPLATE_RESERVED_BYTES = BLOCK_HEADER_SIZE + 1024;

    private final SystemConfig config;
    private final ChainStore store;
    private final Clock clock;
    private final PeerReputationReporter reputationReporter;

    private final ChainIndex chainIndex;
    @Getter
    private final UtxoLedger ledger;
    private final BlockValidator blockValidator;
    private final RewardSchedule rewardSchedule;
    private final DifficultyAdjuster difficultyAdjuster;
    @Getter
    private final CheckpointManager checkpointManager;
    private final ForkChoiceManager forkChoice;
    private final OrphanBlockPool orphanPool;
    @Getter
    private final TransactionPool transactionPool;

    private final ReentrantLock chainLock = new ReentrantLock();
    private final List<ChainEventListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicReference<MiningCancellationToken> miningToken = new AtomicReference<>(new MiningCancellationToken());
    // 接受其他节点的区块后，本地矿工在此时间之前不开始新任务（毫秒）
    private volatile long miningCooldownUntil;

    private volatile boolean started;
    @Getter
    private volatile boolean halted;

    public ConsensusEngine(SystemConfig config, ChainStore store, Clock clock, PeerReputationReporter reputationReporter) {
        this.config = config;
        this.store = store;
        this.clock = clock;
        this.reputationReporter = reputationReporter;

        SystemConfig.Consensus consensus = config.getConsensus();
        byte[] powLimitBits = DifficultyUtils.hexToCompact(consensus.getPowLimitBits());
        TransactionValidator transactionValidator = new TransactionValidator(consensus.getMaxTransactionSize(),
                consensus.getCoinbaseMaturity(), consensus.getFutureNonceWindow());
        this.chainIndex = new ChainIndex(store);
        this.ledger = new UtxoLedger(store);
        this.blockValidator = new BlockValidator(transactionValidator, consensus.getMaxBlockSize(),
                consensus.getMaxTransactionsPerBlock(), consensus.getMaxFutureDriftSeconds(),
                DifficultyUtils.compactToTarget(powLimitBits));
        this.rewardSchedule = new RewardSchedule(consensus.getInitialReward(), consensus.getHalvingInterval());
        this.difficultyAdjuster = new DifficultyAdjuster(chainIndex, consensus.getRetargetInterval(),
                consensus.getTargetBlockTimeSeconds(), powLimitBits, consensus.getMinDifficultyGapSeconds());
        this.checkpointManager = new CheckpointManager(store, config.getCheckpoint().getInterval(),
                config.getCheckpoint().getKeep(), clock, CheckpointManager.parseTrusted(consensus.getTrustedCheckpoints()));
        this.forkChoice = new ForkChoiceManager(store, chainIndex, ledger, blockValidator, rewardSchedule,
                checkpointManager, consensus.getMaxReorgDepth());
        this.orphanPool = new OrphanBlockPool(config.getOrphan().getMaxBlocks(), config.getOrphan().getTtlSeconds(),
                config.getOrphan().getReportThreshold(), clock, reputationReporter);
        this.transactionPool = new TransactionPool(transactionValidator, config.getMempool(), clock, reputationReporter);
    }

    // ------------------------------ 启动 ------------------------------

    /**
     * 空库时写入创世区块；已有数据时校验创世区块与配置一致，并恢复链尖
     * @throws UnsupportedChainException 存储中的链与当前配置不兼容
     */
    public void start() throws UnsupportedChainException {
        chainLock.lock();
        try {
            Block genesis = buildGenesisBlock();
            if (store.isEmpty()) {
                writeGenesis(genesis);
            } else {
                byte[] storedGenesis = store.getMainBlockHash(0);
                if (storedGenesis == null || !Arrays.equals(storedGenesis, genesis.getHash())) {
                    throw new UnsupportedChainException("存储中的创世区块 " + CryptoUtil.bytesToHex(storedGenesis)
                            + " 与配置生成的 " + genesis.getHashHex() + " 不一致");
                }
            }
            forkChoice.rebuildTips();
            ChainTip tip = forkChoice.getMainTip();
            if (!checkpointManager.verifyLedgerConsistency(tip.getHeight(), tip.getHash())) {
                halted = true;
                throw new StorageFailureException("账本与最新检查点不一致，高度 " + tip.getHeight());
            }
            started = true;
            log.info("共识引擎启动完成，主链高度 {}，链尖 {}，发行总量 {}，UTXO {} 个", tip.getHeight(), tip.getHashHex(),
                    ledger.getTotalSupply(), ledger.getUtxoCount());
        } finally {
            chainLock.unlock();
        }
    }

    /**
     * 创世区块由配置确定性生成：从 nonce 0 开始求解
     */
    private Block buildGenesisBlock() throws UnsupportedChainException {
        SystemConfig.Genesis genesisConfig = config.getGenesis();
        long reward = rewardSchedule.rewardAt(0, 0);
        Transaction coinbase = Transaction.createCoinBaseTransaction(0, genesisConfig.getAddress(), reward, genesisConfig.getTime());
        List<Transaction> transactions = new ArrayList<>();
        transactions.add(coinbase);

        Block genesis = new Block();
        genesis.setHeight(0);
        genesis.setVersion(BLOCK_VERSION_1);
        genesis.setPreviousHash(GENESIS_PREV_BLOCK_HASH.clone());
        genesis.setTime(genesisConfig.getTime());
        genesis.setDifficultyTarget(difficultyAdjuster.getPowLimitBits().clone());
        genesis.setTransactions(transactions);
        genesis.calculateAndSetMerkleRoot();

        ProofOfWorkSolver.MiningResult result = new ProofOfWorkSolver(config.getMining().getCancelCheckInterval())
                .solve(genesis.extractHeader(), new MiningCancellationToken());
        if (!result.isFound()) {
            throw new UnsupportedChainException("创世区块在nonce空间内无解");
        }
        genesis.setNonce(result.getNonce());
        genesis.refreshHash();

        String expected = genesisConfig.getExpectedHash();
        if (expected != null && !expected.isBlank() && !expected.equalsIgnoreCase(genesis.getHashHex())) {
            throw new UnsupportedChainException("创世区块哈希 " + genesis.getHashHex() + " 与期望的 " + expected + " 不一致");
        }
        return genesis;
    }

    private void writeGenesis(Block genesis) {
        BlockIndexEntry entry = new BlockIndexEntry(genesis.getHash(), genesis.getPreviousHash(), 0, genesis.getTime(),
                genesis.getDifficultyTarget(), DifficultyUtils.blockWork(genesis.getDifficultyTarget()), BlockStatus.VALID, null);
        store.newBatch().putBlock(genesis).putIndexEntry(entry).commit();
        ledger.applyBlock(genesis, 0, batch -> {
            batch.putMainBlockHash(0, genesis.getHash()).putTipHash(genesis.getHash());
            for (Transaction tx : genesis.getTransactions()) {
                batch.putTransactionIndex(tx.getTxId(), genesis.getHash());
            }
        });
        log.info("写入创世区块 {}，奖励地址 {}", genesis.getHashHex(), config.getGenesis().getAddress());
    }

    // ------------------------------ 区块入口 ------------------------------

    /**
     * 网络层收到的区块
     * @throws ChainException 区块被拒绝
     */
    public TipChange applyExternalBlock(@NotNull Block block, @Nullable String sourcePeer) {
        return processBlock(block, sourcePeer, false);
    }

    /**
     * 本地矿工挖出的区块，走与外部区块相同的验证流程
     */
    public TipChange submitMinedBlock(@NotNull Block block) {
        return processBlock(block, null, true);
    }

    /**
     * 网络层收到的原始区块字节
     */
    public TipChange onBlockReceived(byte[] bytes, String sourcePeer) {
        Block block;
        try {
            block = Block.deserialize(bytes, config.getConsensus().getMaxTransactionsPerBlock());
        } catch (ValidationException e) {
            if (sourcePeer != null) {
                reputationReporter.reportInvalidBlock(sourcePeer, null, e.getReason());
            }
            throw e;
        }
        return applyExternalBlock(block, sourcePeer);
    }

    private TipChange processBlock(Block block, String sourcePeer, boolean local) {
        TipChange change;
        ReorgEvent reorgEvent = null;
        chainLock.lock();
        try {
            ensureRunning();
            runMaintenanceLocked();
            change = connectNewBlock(block, sourcePeer);
            if (change.isTipChanged()) {
                int reinjected = transactionPool.onChainUpdated(change.getConnectedBlocks(),
                        change.getDisconnectedTransactions(), change.getType() == TipChangeType.REORG, mempoolContext());
                if (change.getType() == TipChangeType.REORG) {
                    reorgEvent = toReorgEvent(change, reinjected);
                }
                miningToken.get().cancel("链尖变化: " + change.getNewTip().getHashHex());
                if (!local) {
                    miningCooldownUntil = clock.millis() + config.getMining().getCooldownMillis();
                }
            }
        } catch (StorageFailureException e) {
            halt(e);
            throw e;
        } finally {
            chainLock.unlock();
        }
        if (change.isTipChanged()) {
            fireNewTip(change);
        }
        if (reorgEvent != null) {
            fireReorg(reorgEvent);
        }
        return change;
    }

    private TipChange connectNewBlock(Block block, String sourcePeer) {
        ChainTip mainBefore = forkChoice.getMainTip();
        TipChangeType accepted;
        try {
            accepted = acceptBlock(block, sourcePeer);
        } catch (StorageFailureException e) {
            throw e;
        } catch (ChainException e) {
            log.warn("区块 {} 被拒绝: {} {}", block.getHashHex(), e.getReason(), e.getMessage());
            reportInvalidBlock(sourcePeer, block, e);
            throw e;
        }
        if (accepted != TipChangeType.COMPETING) {
            return TipChange.unchanged(accepted, mainBefore);
        }
        promoteOrphans(block);

        TipChange change = null;
        ChainException failure = null;
        // 每次连接失败都会把一段分支标记为无效，重试直到没有更优的链尖
        while (true) {
            try {
                change = forkChoice.activateBestChain();
                break;
            } catch (StorageFailureException | ReorgTooDeepException e) {
                throw e;
            } catch (ChainException e) {
                if (failure == null) {
                    failure = e;
                }
            }
        }
        if (failure != null) {
            reportInvalidBlock(sourcePeer, block, failure);
            if (change == null) {
                throw failure;
            }
            log.warn("部分分支连接失败: {}", failure.getMessage());
        }
        if (change == null) {
            log.info("区块 {} 保存在侧链上，主链链尖不变 {}", block.getHashHex(), mainBefore.getHashHex());
            return TipChange.unchanged(TipChangeType.COMPETING, mainBefore);
        }
        return change;
    }

    /**
     * 区块的独立校验和上下文校验，通过后写入区块与索引并成为候选链尖
     * @return DUPLICATE、ORPHANED，或 COMPETING 表示已作为候选保存
     */
    private TipChangeType acceptBlock(Block block, String sourcePeer) {
        checkHeaderFields(block);
        byte[] hash = block.computeHash();
        if (block.getHash() != null && !Arrays.equals(block.getHash(), hash)) {
            throw new ConsensusViolationException(RejectReason.BAD_HASH,
                    "区块头哈希不匹配，计算出的哈希：" + CryptoUtil.bytesToHex(hash));
        }
        block.setHash(hash);

        BlockIndexEntry known = chainIndex.getEntry(hash);
        if (known != null) {
            if (!known.isValid()) {
                throw new ConsensusViolationException(RejectReason.KNOWN_INVALID, "区块此前已被判定无效: " + known.getHashHex());
            }
            log.debug("区块 {} 已存在", block.getHashHex());
            return TipChangeType.DUPLICATE;
        }
        if (orphanPool.contains(hash)) {
            return TipChangeType.DUPLICATE;
        }

        // 区块体与区块头不匹配时只拒绝这份数据，不记录哈希状态，正确的区块体仍可再次提交
        blockValidator.validateStructure(block);
        blockValidator.validateProofOfWork(block);
        blockValidator.validateMerkleRoot(block);
        blockValidator.validateFutureDrift(block, nowSeconds());

        BlockIndexEntry parent = chainIndex.getEntry(block.getPreviousHash());
        if (parent == null) {
            orphanPool.add(block, sourcePeer);
            return TipChangeType.ORPHANED;
        }
        if (!parent.isValid()) {
            storeInvalid(block, parent, sourcePeer);
            throw new ConsensusViolationException(RejectReason.INVALID_PARENT,
                    "区块 " + block.getHashHex() + " 的父区块 " + parent.getHashHex() + " 无效");
        }

        long height = parent.getHeight() + 1;
        block.setHeight(height);
        try {
            blockValidator.validateContext(block, height, chainIndex.medianTimePast(parent),
                    difficultyAdjuster.nextBits(parent, block.getTime()), checkpointManager.trustedHashAt(height));
        } catch (ConsensusViolationException e) {
            storeInvalid(block, parent, sourcePeer);
            throw e;
        }

        long finalized = checkpointManager.finalizedHeight(forkChoice.getMainTip().getHeight());
        if (height <= finalized) {
            byte[] mainHash = store.getMainBlockHash(height);
            if (mainHash != null && !Arrays.equals(mainHash, hash)) {
                throw new ReorgTooDeepException(RejectReason.REORG_BELOW_CHECKPOINT,
                        "区块高度 " + height + " 不高于检查点高度 " + finalized);
            }
        }

        BigInteger chainWork = parent.getChainWork().add(DifficultyUtils.blockWork(block.getDifficultyTarget()));
        BlockIndexEntry entry = new BlockIndexEntry(hash, block.getPreviousHash(), height, block.getTime(),
                block.getDifficultyTarget(), chainWork, BlockStatus.VALID, sourcePeer);
        store.newBatch().putBlock(block).putIndexEntry(entry).commit();
        forkChoice.addCandidate(entry);
        log.info("区块 {} 高度 {} 已保存，累计工作量 {}", entry.getHashHex(), height, chainWork);
        return TipChangeType.COMPETING;
    }

    private static void checkHeaderFields(Block block) {
        if (block.getPreviousHash() == null || block.getPreviousHash().length != 32
                || block.getMerkleRoot() == null || block.getMerkleRoot().length != 32
                || block.getDifficultyTarget() == null || block.getDifficultyTarget().length != 4) {
            throw new ValidationException(RejectReason.MALFORMED, "区块头字段缺失或长度错误");
        }
    }

    /**
     * 记录无效区块，之后再收到它或它的子区块直接拒绝
     */
    private void storeInvalid(Block block, BlockIndexEntry parent, String sourcePeer) {
        BigInteger chainWork = parent.getChainWork().add(DifficultyUtils.blockWork(block.getDifficultyTarget()));
        BlockIndexEntry entry = new BlockIndexEntry(block.getHash(), block.getPreviousHash(), parent.getHeight() + 1,
                block.getTime(), block.getDifficultyTarget(), chainWork, BlockStatus.INVALID, sourcePeer);
        store.newBatch().putIndexEntry(entry).commit();
    }

    /**
     * 父区块到达后，按广度优先把等待它的孤块依次接入
     */
    private void promoteOrphans(Block parent) {
        Deque<byte[]> parents = new ArrayDeque<>();
        parents.add(parent.getHash());
        while (!parents.isEmpty()) {
            byte[] parentHash = parents.poll();
            for (OrphanEntry orphan : orphanPool.removeChildrenOf(parentHash)) {
                Block child = orphan.getBlock();
                try {
                    if (acceptBlock(child, orphan.getSourcePeer()) == TipChangeType.COMPETING) {
                        log.info("孤儿区块 {} 找到父区块，高度 {}", child.getHashHex(), child.getHeight());
                        parents.add(child.getHash());
                    }
                } catch (StorageFailureException e) {
                    throw e;
                } catch (ChainException e) {
                    log.warn("孤儿区块 {} 接入失败: {} {}", child.getHashHex(), e.getReason(), e.getMessage());
                    reportInvalidBlock(orphan.getSourcePeer(), child, e);
                }
            }
        }
    }

    private void reportInvalidBlock(String sourcePeer, Block block, ChainException e) {
        if (sourcePeer == null) {
            return;
        }
        ErrorCategory category = e.getCategory();
        if (category == ErrorCategory.CONSENSUS || category == ErrorCategory.VALIDATION) {
            reputationReporter.reportInvalidBlock(sourcePeer, block.getHashHex(), e.getReason());
        }
    }

    private ReorgEvent toReorgEvent(TipChange change, int reinjected) {
        int depth = change.getDisconnectedBlocks().size();
        int connected = change.getConnectedBlocks().size();
        long ancestorHeight = change.getNewTip().getHeight() - connected;
        return new ReorgEvent(change.getOldTip(), change.getNewTip(), ancestorHeight, depth, connected,
                change.getDisconnectedTransactions(), reinjected);
    }

    // ------------------------------ 交易入口 ------------------------------

    /**
     * 本地或 RPC 提交的交易
     * @throws ChainException 被拒绝
     */
    public AdmissionResult submitTransaction(@NotNull Transaction tx) {
        return processTransaction(tx, null);
    }

    /**
     * 网络层收到的原始交易字节
     */
    public AdmissionResult onTransactionReceived(byte[] bytes, String sourcePeer) {
        Transaction tx;
        try {
            tx = Transaction.deserialize(bytes);
        } catch (ValidationException e) {
            if (sourcePeer != null) {
                reputationReporter.reportInvalidTransaction(sourcePeer, null, e.getReason());
            }
            fireRejected(new RejectedTransactionEvent(null, e.getReason(), e.getMessage(), sourcePeer));
            throw e;
        }
        return processTransaction(tx, sourcePeer);
    }

    private AdmissionResult processTransaction(Transaction tx, String sourcePeer) {
        ChainException rejected;
        chainLock.lock();
        try {
            ensureRunning();
            return transactionPool.submit(tx, mempoolContext(), sourcePeer);
        } catch (StorageFailureException e) {
            halt(e);
            rejected = e;
        } catch (ChainException e) {
            log.debug("交易 {} 被拒绝: {} {}", tx.getTxIdHex(), e.getReason(), e.getMessage());
            rejected = e;
        } finally {
            chainLock.unlock();
        }
        fireRejected(new RejectedTransactionEvent(tx.getTxIdHex(), rejected.getReason(), rejected.getMessage(), sourcePeer));
        throw rejected;
    }

    private MempoolContext mempoolContext() {
        ChainTip tip = forkChoice.getMainTip();
        return new MempoolContext(ledger, tip.getHeight() + 1, tip.getHashHex(), ledger.getStateVersion(),
                txId -> store.getTransactionBlockHash(txId) != null);
    }

    // ------------------------------ 挖矿 ------------------------------

    /**
     * 在当前主链链尖上生成挖矿模板
     */
    public BlockTemplate getBlockTemplate(String minerAddress) {
        if (!CryptoUtil.isValidAddress(minerAddress)) {
            throw new ValidationException(RejectReason.BAD_ADDRESS, "矿工地址格式错误: " + minerAddress);
        }
        chainLock.lock();
        try {
            ensureRunning();
            ChainTip tip = forkChoice.getMainTip();
            BlockIndexEntry parent = chainIndex.getEntry(tip.getHash());
            long height = parent.getHeight() + 1;
            long time = Math.max(nowSeconds(), chainIndex.medianTimePast(parent) + 1);
            byte[] bits = difficultyAdjuster.nextBits(parent, time);
            long reward = rewardSchedule.rewardAt(height, ledger.getTotalSupply());

            SystemConfig.Consensus consensus = config.getConsensus();
            List<MempoolEntry> selected = transactionPool.selectForBlock(ledger, height,
                    consensus.getMaxBlockSize() - TEMPLATE_RESERVED_BYTES, consensus.getMaxTransactionsPerBlock() - 1);
            long fees = 0;
            try {
                for (MempoolEntry entry : selected) {
                    fees = Math.addExact(fees, entry.getFee());
                }
            } catch (ArithmeticException e) {
                throw new AmountOverflowException("模板手续费累加溢出", e);
            }

            List<Transaction> transactions = new ArrayList<>(selected.size() + 1);
            transactions.add(Transaction.createCoinBaseTransaction(height, minerAddress, reward + fees, time));
            for (MempoolEntry entry : selected) {
                transactions.add(entry.getTransaction());
            }
            log.info("生成区块模板 高度:{} 交易:{} 手续费:{} 奖励:{} 难度:{}", height, selected.size(), fees, reward,
                    CryptoUtil.bytesToHex(bits));
            return new BlockTemplate(height, tip.getHash(), bits, time, fees, reward, transactions);
        } finally {
            chainLock.unlock();
        }
    }

    /**
     * 为新的挖矿任务创建取消标记，上一个任务的标记同时被取消
     */
    public MiningCancellationToken newMiningToken() {
        MiningCancellationToken token = new MiningCancellationToken();
        miningToken.getAndSet(token).cancel("新的挖矿任务");
        return token;
    }

    public long miningCooldownRemainingMillis() {
        return Math.max(0, miningCooldownUntil - clock.millis());
    }

    // ------------------------------ 查询 ------------------------------

    public Block getBlock(byte[] hash) {
        return store.getBlock(hash);
    }

    public Block getBlockByHeight(long height) {
        byte[] hash = store.getMainBlockHash(height);
        return hash == null ? null : store.getBlock(hash);
    }

    public BlockIndexEntry getIndexEntry(byte[] hash) {
        return chainIndex.getEntry(hash);
    }

    /**
     * 主链区块头，从 fromHeight 开始，最多 2000 个
     */
    public List<BlockHeader> getHeaders(long fromHeight, int count) {
        int limit = Math.min(Math.max(count, 0), MAX_HEADERS_PER_REQUEST);
        List<BlockHeader> headers = new ArrayList<>(limit);
        chainLock.lock();
        try {
            for (long height = Math.max(fromHeight, 0); headers.size() < limit; height++) {
                Block block = getBlockByHeight(height);
                if (block == null) {
                    break;
                }
                headers.add(block.extractHeader());
            }
        } finally {
            chainLock.unlock();
        }
        return headers;
    }

    /**
     * 主链交易的默克尔证明，交易不在主链上返回 null
     */
    public MerkleProof getMerkleProof(byte[] txId) {
        chainLock.lock();
        try {
            return checkpointManager.buildMerkleProof(txId);
        } finally {
            chainLock.unlock();
        }
    }

    public ChainTip getMainTip() {
        return forkChoice.getMainTip();
    }

    public List<ChainTip> getTips() {
        return forkChoice.getTips();
    }

    public long getBalance(String address) {
        return ledger.getBalance(address);
    }

    public List<UTXO> getUtxos(String address) {
        return ledger.getUtxos(address);
    }

    public long getNonce(String address) {
        return ledger.getNonce(address);
    }

    public MempoolStats getMempoolStats() {
        return transactionPool.getStats();
    }

    public List<MempoolEntry> getMempoolEntries() {
        return transactionPool.getEntries();
    }

    public ChainStatus getChainStatus() {
        chainLock.lock();
        try {
            ChainTip tip = forkChoice.getMainTip();
            BlockIndexEntry entry = chainIndex.getEntry(tip.getHash());
            Checkpoint latest = checkpointManager.latestCheckpoint();
            return new ChainStatus(tip.getHeight(), tip.getHashHex(), tip.getChainWork(),
                    CryptoUtil.bytesToHex(entry.getDifficultyTarget()), chainIndex.medianTimePast(entry),
                    ledger.getTotalSupply(), ledger.getUtxoCount(), ledger.getStateVersion(),
                    transactionPool.size(), (int) orphanPool.size(), forkChoice.getTipCount(),
                    latest == null ? -1 : latest.getHeight(), halted);
        } finally {
            chainLock.unlock();
        }
    }

    /**
     * 导出检查点供轻客户端使用，不存在返回 null
     */
    public String exportCheckpoint(long height) {
        Checkpoint checkpoint = checkpointManager.getCheckpoint(height);
        return checkpoint == null ? null : checkpointManager.exportJson(checkpoint);
    }

    // ------------------------------ 维护与事件 ------------------------------

    public void addListener(@NotNull ChainEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@NotNull ChainEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * 清理过期孤块与过期交易
     */
    public void runMaintenance() {
        chainLock.lock();
        try {
            runMaintenanceLocked();
        } finally {
            chainLock.unlock();
        }
    }

    private void runMaintenanceLocked() {
        orphanPool.cleanUp();
        transactionPool.expire();
    }

    private void ensureRunning() {
        if (halted) {
            throw new StorageFailureException(RejectReason.ENGINE_HALTED, "共识引擎因存储故障已停止，需要人工处理");
        }
        if (!started) {
            throw new IllegalStateException("共识引擎尚未启动");
        }
    }

    private void halt(StorageFailureException e) {
        if (!halted) {
            halted = true;
            miningToken.get().cancel("存储故障");
            log.error("存储故障，共识引擎停止处理区块与交易", e);
        }
    }

    private long nowSeconds() {
        return clock.millis() / 1000;
    }

    private void fireNewTip(TipChange change) {
        for (ChainEventListener listener : listeners) {
            try {
                listener.onNewTip(change);
            } catch (RuntimeException e) {
                log.error("链尖事件处理失败", e);
            }
        }
    }

    private void fireReorg(ReorgEvent event) {
        for (ChainEventListener listener : listeners) {
            try {
                listener.onReorg(event);
            } catch (RuntimeException e) {
                log.error("重组事件处理失败", e);
            }
        }
    }

    private void fireRejected(RejectedTransactionEvent event) {
        for (ChainEventListener listener : listeners) {
            try {
                listener.onTransactionRejected(event);
            } catch (RuntimeException e) {
                log.error("交易拒绝事件处理失败", e);
            }
        }
    }

    @Override
    public void close() {
        miningToken.get().cancel("共识引擎关闭");
        started = false;
        log.info("共识引擎已关闭");
    }
}
