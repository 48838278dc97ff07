package com.xai.xaichain.service.blockChain;

import com.xai.xaichain.ChainFixture;
import com.xai.xaichain.config.SystemConfig;
import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.BlockHeader;
import com.xai.xaichain.data.block.BlockTemplate;
import com.xai.xaichain.data.block.MerkleProof;
import com.xai.xaichain.data.block.TipChange;
import com.xai.xaichain.data.block.TipChangeType;
import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.data.mempool.AdmissionResult;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.event.ChainEventListener;
import com.xai.xaichain.event.RejectedTransactionEvent;
import com.xai.xaichain.event.ReorgEvent;
import com.xai.xaichain.exception.ChainException;
import com.xai.xaichain.exception.ConsensusViolationException;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ReorgTooDeepException;
import com.xai.xaichain.exception.StorageFailureException;
import com.xai.xaichain.exception.UnsupportedChainException;
import com.xai.xaichain.exception.ValidationException;
import com.xai.xaichain.storage.MemoryChainStore;
import com.xai.xaichain.util.ByteUtils;
import com.xai.xaichain.util.DifficultyUtils;
import lombok.SneakyThrows;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.xai.xaichain.ChainFixture.PEER;
import static com.xai.xaichain.ChainFixture.REWARD;
import static com.xai.xaichain.constant.BlockChainConstants.BLOCK_VERSION_1;

public class ConsensusEngineTest {

    private ChainFixture fixture;
    private ConsensusEngine engine;
    private ChainFixture.Wallet miner;
    private ChainFixture.Wallet other;
    private RecordingListener listener;

    @SneakyThrows
    @BeforeEach
    public void setUp() {
        fixture = new ChainFixture();
        engine = fixture.getEngine();
        miner = ChainFixture.newWallet();
        other = ChainFixture.newWallet();
        listener = new RecordingListener();
        engine.addListener(listener);
    }

    @AfterEach
    public void tearDown() {
        fixture.close();
    }

    @SneakyThrows
    @Test
    public void genesisIsDeterministic() {
        try (ChainFixture second = new ChainFixture()) {
            Assertions.assertArrayEquals(fixture.genesis().getHash(), second.genesis().getHash());
        }
        Assertions.assertEquals(0, engine.getMainTip().getHeight());
        Assertions.assertEquals(REWARD, engine.getLedger().getTotalSupply());
        Assertions.assertEquals(-1, engine.getChainStatus().getLatestCheckpointHeight());
    }

    @Test
    public void blockOnTipExtendsMainChain() {
        Block block = ChainFixture.buildBlock(fixture.genesis(), miner.getAddress(), Collections.emptyList());

        TipChange change = engine.applyExternalBlock(block, PEER);

        Assertions.assertEquals(TipChangeType.EXTENDED, change.getType());
        Assertions.assertEquals(1, change.getNewTip().getHeight());
        Assertions.assertArrayEquals(block.getHash(), engine.getBlockByHeight(1).getHash());
        Assertions.assertEquals(REWARD, engine.getBalance(miner.getAddress()));
        Assertions.assertEquals(1, listener.newTips.size());
        Assertions.assertTrue(listener.reorgs.isEmpty());
    }

    @Test
    public void knownBlockIsDuplicate() {
        Block block = fixture.mineOnTip(miner.getAddress());

        TipChange change = engine.applyExternalBlock(block, PEER);

        Assertions.assertEquals(TipChangeType.DUPLICATE, change.getType());
        Assertions.assertArrayEquals(block.getHash(), engine.getMainTip().getHash());
    }

    @Test
    public void orphanConnectsWhenParentArrives() {
        List<Block> branch = ChainFixture.buildBranch(fixture.genesis(), 2, miner.getAddress(), 0);

        Assertions.assertEquals(TipChangeType.ORPHANED, engine.applyExternalBlock(branch.get(1), PEER).getType());
        Assertions.assertEquals(1, engine.getChainStatus().getOrphanBlockCount());
        Assertions.assertEquals(TipChangeType.DUPLICATE, engine.applyExternalBlock(branch.get(1), PEER).getType());

        TipChange change = engine.applyExternalBlock(branch.get(0), PEER);

        Assertions.assertEquals(TipChangeType.EXTENDED, change.getType());
        Assertions.assertEquals(2, change.getConnectedBlocks().size());
        Assertions.assertEquals(2, engine.getMainTip().getHeight());
        Assertions.assertEquals(0, engine.getChainStatus().getOrphanBlockCount());
    }

    @Test
    public void equalWorkTieGoesToLowerHash() {
        Block first = ChainFixture.buildBlock(fixture.genesis(), miner.getAddress(), Collections.emptyList(), 0);
        Block second = ChainFixture.buildBlock(fixture.genesis(), other.getAddress(), Collections.emptyList(), 1);
        engine.applyExternalBlock(first, PEER);

        TipChange change = engine.applyExternalBlock(second, PEER);

        boolean secondWins = ByteUtils.compareUnsigned(second.getHash(), first.getHash()) < 0;
        Assertions.assertEquals(secondWins ? TipChangeType.REORG : TipChangeType.COMPETING, change.getType());
        Assertions.assertArrayEquals(secondWins ? second.getHash() : first.getHash(), engine.getMainTip().getHash());
        Assertions.assertEquals(2, engine.getTips().size());
    }

    @Test
    public void heavierBranchReorgsAndReinjectsTransactions() {
        Block a1 = fixture.mineOnTip(miner.getAddress());
        Transaction payment = ChainFixture.pay(miner, ChainFixture.coinbaseUtxo(a1), other.getAddress(), 100_000_000L, 5_000);
        Block a2 = fixture.mineOnTip(miner.getAddress(), payment);
        Assertions.assertEquals(100_000_000L, engine.getBalance(other.getAddress()));

        String sideMiner = ChainFixture.newWallet().getAddress();
        List<Block> side = ChainFixture.buildBranch(a1, 2, sideMiner, 1);
        Assertions.assertEquals(TipChangeType.ORPHANED, engine.applyExternalBlock(side.get(1), PEER).getType());

        TipChange change = engine.applyExternalBlock(side.get(0), PEER);

        Assertions.assertEquals(TipChangeType.REORG, change.getType());
        Assertions.assertArrayEquals(side.get(1).getHash(), engine.getMainTip().getHash());
        Assertions.assertEquals(1, change.getDisconnectedBlocks().size());
        Assertions.assertArrayEquals(a2.getHash(), change.getDisconnectedBlocks().get(0).getHash());
        Assertions.assertEquals(0, engine.getBalance(other.getAddress()));
        Assertions.assertTrue(engine.getTransactionPool().contains(payment.getTxIdHex()));

        Assertions.assertEquals(1, listener.reorgs.size());
        ReorgEvent event = listener.reorgs.get(0);
        Assertions.assertEquals(1, event.getDepth());
        Assertions.assertEquals(2, event.getConnectedCount());
        Assertions.assertEquals(1, event.getCommonAncestorHeight());
        Assertions.assertEquals(1, event.getReinjectedCount());
    }

    @SneakyThrows
    @Test
    public void reorgDeeperThanLimitIsRefused() {
        SystemConfig config = ChainFixture.testConfig();
        config.getConsensus().setMaxReorgDepth(2);
        try (ChainFixture shallow = new ChainFixture(config)) {
            ConsensusEngine limited = shallow.getEngine();
            List<Block> main = shallow.extendMain(3, miner.getAddress());
            List<Block> side = ChainFixture.buildBranch(shallow.genesis(), 5, other.getAddress(), 1);
            for (int i = side.size() - 1; i > 0; i--) {
                limited.applyExternalBlock(side.get(i), PEER);
            }

            ReorgTooDeepException e = Assertions.assertThrows(ReorgTooDeepException.class,
                    () -> limited.applyExternalBlock(side.get(0), PEER));

            Assertions.assertEquals(RejectReason.REORG_TOO_DEEP, e.getReason());
            Assertions.assertArrayEquals(main.get(2).getHash(), limited.getMainTip().getHash());
            Assertions.assertEquals(3 * REWARD, limited.getBalance(miner.getAddress()));
        }
    }

    @Test
    public void invalidTransactionInBranchRestoresMainChain() {
        List<Block> main = fixture.extendMain(2, miner.getAddress());
        ChainFixture.Wallet thief = ChainFixture.newWallet();
        Transaction bogus = ChainFixture.pay(thief, ChainFixture.fundingUtxo(thief.getAddress(), 1_000_000),
                other.getAddress(), 500_000, 1_000);

        Block b1 = ChainFixture.buildBlock(fixture.genesis(), other.getAddress(), Collections.emptyList(), 1);
        Block b2 = ChainFixture.buildBlock(b1, other.getAddress(), Collections.singletonList(bogus), 1);
        Block b3 = ChainFixture.buildBlock(b2, other.getAddress(), Collections.emptyList(), 1);
        engine.applyExternalBlock(b3, PEER);
        engine.applyExternalBlock(b2, PEER);

        ChainException e = Assertions.assertThrows(ChainException.class, () -> engine.applyExternalBlock(b1, PEER));

        Assertions.assertEquals(RejectReason.MISSING_OUTPOINT, e.getReason());
        Assertions.assertArrayEquals(main.get(1).getHash(), engine.getMainTip().getHash());
        Assertions.assertEquals(2 * REWARD, engine.getBalance(miner.getAddress()));
        Assertions.assertEquals(0, engine.getBalance(other.getAddress()));
        Assertions.assertFalse(engine.getIndexEntry(b2.getHash()).isValid());
        Assertions.assertFalse(engine.getIndexEntry(b3.getHash()).isValid());
        Assertions.assertTrue(engine.getIndexEntry(b1.getHash()).isValid());
        Assertions.assertTrue(fixture.getReporter().getInvalidBlocks().contains(RejectReason.MISSING_OUTPOINT));

        ConsensusViolationException known = Assertions.assertThrows(ConsensusViolationException.class,
                () -> engine.applyExternalBlock(b3, PEER));
        Assertions.assertEquals(RejectReason.KNOWN_INVALID, known.getReason());

        Block child = ChainFixture.buildBlock(b3, other.getAddress(), Collections.emptyList(), 1);
        ConsensusViolationException orphanOfInvalid = Assertions.assertThrows(ConsensusViolationException.class,
                () -> engine.applyExternalBlock(child, PEER));
        Assertions.assertEquals(RejectReason.INVALID_PARENT, orphanOfInvalid.getReason());
    }

    @Test
    public void blockTooFarInFutureIsNotKeptAsOrphan() {
        byte[] unknownParent = new byte[32];
        new SecureRandom().nextBytes(unknownParent);
        Block parent = new Block();
        parent.setHash(unknownParent);
        parent.setHeight(5);
        parent.setTime(fixture.getClock().millis() / 1000 + 7200);
        parent.setDifficultyTarget(DifficultyUtils.hexToCompact(ChainFixture.EASY_BITS));
        Block future = ChainFixture.buildBlock(parent, miner.getAddress(), Collections.emptyList());

        ConsensusViolationException e = Assertions.assertThrows(ConsensusViolationException.class,
                () -> engine.applyExternalBlock(future, PEER));

        Assertions.assertEquals(RejectReason.TIME_TOO_NEW, e.getReason());
        Assertions.assertEquals(0, engine.getChainStatus().getOrphanBlockCount());
    }

    @Test
    public void insufficientWorkIsRejected() {
        Block block = ChainFixture.buildBlock(fixture.genesis(), miner.getAddress(), Collections.emptyList());
        block.setDifficultyTarget(DifficultyUtils.hexToCompact("1d00ffff"));
        block.setHash(null);

        ConsensusViolationException e = Assertions.assertThrows(ConsensusViolationException.class,
                () -> engine.applyExternalBlock(block, PEER));

        Assertions.assertEquals(RejectReason.BAD_POW, e.getReason());
        Assertions.assertNull(engine.getIndexEntry(block.computeHash()));
    }

    @Test
    public void mismatchedBodyDoesNotBlockGenuineBlock() {
        Block a1 = fixture.mineOnTip(miner.getAddress());
        Transaction payment = ChainFixture.pay(miner, ChainFixture.coinbaseUtxo(a1), other.getAddress(), 100_000_000L, 5_000);
        Block genuine = ChainFixture.buildBlock(a1, miner.getAddress(), Collections.singletonList(payment));
        // 同一区块头配上少一笔交易的区块体
        Block swapped = Block.deserialize(genuine.serialize(), 100);
        swapped.getTransactions().remove(1);
        Assertions.assertArrayEquals(genuine.getHash(), swapped.computeHash());

        ConsensusViolationException e = Assertions.assertThrows(ConsensusViolationException.class,
                () -> engine.applyExternalBlock(swapped, PEER));

        Assertions.assertEquals(RejectReason.BAD_MERKLE_ROOT, e.getReason());
        Assertions.assertNull(engine.getIndexEntry(genuine.getHash()));
        Assertions.assertTrue(fixture.getReporter().getInvalidBlocks().contains(RejectReason.BAD_MERKLE_ROOT));

        Assertions.assertEquals(TipChangeType.EXTENDED, engine.applyExternalBlock(genuine, PEER).getType());
        Assertions.assertEquals(100_000_000L, engine.getBalance(other.getAddress()));
    }

    @Test
    public void tamperedSignatureChangesBlockCommitment() {
        Block a1 = fixture.mineOnTip(miner.getAddress());
        Transaction payment = ChainFixture.pay(miner, ChainFixture.coinbaseUtxo(a1), other.getAddress(), 100_000_000L, 5_000);
        Block genuine = ChainFixture.buildBlock(a1, miner.getAddress(), Collections.singletonList(payment));

        Block forged = Block.deserialize(genuine.serialize(), 100);
        Transaction forgedPayment = forged.getTransactions().get(1);
        byte[] signature = forgedPayment.getInputs().get(0).getSignature();
        signature[signature.length - 1] ^= 1;
        forgedPayment.refreshTxId();
        Assertions.assertNotEquals(payment.getTxIdHex(), forgedPayment.getTxIdHex());
        Assertions.assertArrayEquals(genuine.getHash(), forged.computeHash());

        ConsensusViolationException e = Assertions.assertThrows(ConsensusViolationException.class,
                () -> engine.applyExternalBlock(forged, PEER));

        Assertions.assertEquals(RejectReason.BAD_MERKLE_ROOT, e.getReason());
        Assertions.assertNull(engine.getIndexEntry(genuine.getHash()));
        TipChange change = engine.applyExternalBlock(genuine, PEER);
        Assertions.assertEquals(TipChangeType.EXTENDED, change.getType());
        Assertions.assertEquals(2, engine.getMainTip().getHeight());
    }

    @Test
    public void mismatchedBodyIsNotKeptAsOrphan() {
        Block a1 = ChainFixture.buildBlock(fixture.genesis(), miner.getAddress(), Collections.emptyList());
        Transaction payment = ChainFixture.pay(miner, ChainFixture.coinbaseUtxo(a1), other.getAddress(), 100_000_000L, 5_000);
        Block a2 = ChainFixture.buildBlock(a1, miner.getAddress(), Collections.singletonList(payment));
        Block swapped = Block.deserialize(a2.serialize(), 100);
        swapped.getTransactions().remove(1);

        ConsensusViolationException e = Assertions.assertThrows(ConsensusViolationException.class,
                () -> engine.applyExternalBlock(swapped, PEER));
        Assertions.assertEquals(RejectReason.BAD_MERKLE_ROOT, e.getReason());
        Assertions.assertEquals(0, engine.getChainStatus().getOrphanBlockCount());

        Assertions.assertEquals(TipChangeType.ORPHANED, engine.applyExternalBlock(a2, PEER).getType());
        Assertions.assertEquals(TipChangeType.EXTENDED, engine.applyExternalBlock(a1, PEER).getType());
        Assertions.assertArrayEquals(a2.getHash(), engine.getMainTip().getHash());
    }

    @SneakyThrows
    @Test
    public void failedReorgLeavesNoCheckpointOnAbandonedBlocks() {
        SystemConfig config = ChainFixture.testConfig();
        config.getCheckpoint().setInterval(2);
        try (ChainFixture checkpointed = new ChainFixture(config)) {
            ConsensusEngine chain = checkpointed.getEngine();
            checkpointed.mineOnTip(miner.getAddress());

            ChainFixture.Wallet thief = ChainFixture.newWallet();
            Transaction bogus = ChainFixture.pay(thief, ChainFixture.fundingUtxo(thief.getAddress(), 1_000_000),
                    other.getAddress(), 500_000, 1_000);
            Block b1 = ChainFixture.buildBlock(checkpointed.genesis(), other.getAddress(), Collections.emptyList(), 1);
            Block b2 = ChainFixture.buildBlock(b1, other.getAddress(), Collections.emptyList(), 1);
            Block b3 = ChainFixture.buildBlock(b2, other.getAddress(), Collections.singletonList(bogus), 1);
            chain.applyExternalBlock(b3, PEER);
            chain.applyExternalBlock(b2, PEER);

            // 切到 b3 失败后回退，再切到更重的有效分支 b1-b2
            TipChange change = chain.applyExternalBlock(b1, PEER);

            Assertions.assertEquals(TipChangeType.REORG, change.getType());
            Assertions.assertArrayEquals(b2.getHash(), chain.getMainTip().getHash());
            Assertions.assertFalse(chain.getIndexEntry(b3.getHash()).isValid());
            Assertions.assertEquals(2, chain.getChainStatus().getLatestCheckpointHeight());
            Assertions.assertEquals(2 * REWARD, chain.getBalance(other.getAddress()));
            Assertions.assertTrue(checkpointed.getReporter().getInvalidBlocks().contains(RejectReason.MISSING_OUTPOINT));
        }
    }

    @Test
    public void malformedBytesAreReportedToPeer() {
        ValidationException e = Assertions.assertThrows(ValidationException.class,
                () -> engine.onBlockReceived(new byte[]{1, 2, 3}, PEER));

        Assertions.assertEquals(RejectReason.MALFORMED, e.getReason());
        Assertions.assertEquals(Collections.singletonList(RejectReason.MALFORMED), fixture.getReporter().getInvalidBlocks());
    }

    @Test
    public void receivedBytesAreDecodedAndApplied() {
        Block block = ChainFixture.buildBlock(fixture.genesis(), miner.getAddress(), Collections.emptyList());

        TipChange change = engine.onBlockReceived(block.serialize(), PEER);

        Assertions.assertEquals(TipChangeType.EXTENDED, change.getType());
        Assertions.assertArrayEquals(block.getHash(), engine.getMainTip().getHash());
    }

    @Test
    public void templateIncludesMempoolTransactionsAndFees() {
        Block funded = fixture.mineOnTip(miner.getAddress());
        Transaction payment = ChainFixture.pay(miner, ChainFixture.coinbaseUtxo(funded), other.getAddress(), 1_000_000, 20_000);
        Assertions.assertEquals(AdmissionResult.ACCEPTED, engine.submitTransaction(payment));

        BlockTemplate template = engine.getBlockTemplate(miner.getAddress());
        Assertions.assertEquals(2, template.getHeight());
        Assertions.assertEquals(20_000, template.getTotalFees());
        Assertions.assertEquals(2, template.getTransactions().size());

        Block block = ChainFixture.solve(template.toBlock(BLOCK_VERSION_1));
        TipChange change = engine.submitMinedBlock(block);

        Assertions.assertEquals(TipChangeType.EXTENDED, change.getType());
        Assertions.assertEquals(0, engine.getMempoolStats().getTransactionCount());
        Assertions.assertEquals(1_000_000, engine.getBalance(other.getAddress()));
        Assertions.assertEquals(2 * REWARD - 1_000_000, engine.getBalance(miner.getAddress()));

        MerkleProof proof = engine.getMerkleProof(payment.getTxId());
        Assertions.assertNotNull(proof);
        Assertions.assertEquals(2, proof.getHeight());
        Assertions.assertTrue(proof.verify(block.extractHeader()));
    }

    @Test
    public void templateRejectsBadMinerAddress() {
        ValidationException e = Assertions.assertThrows(ValidationException.class,
                () -> engine.getBlockTemplate("not-an-address"));
        Assertions.assertEquals(RejectReason.BAD_ADDRESS, e.getReason());
    }

    @Test
    public void rejectedTransactionFiresEvent() {
        Transaction unfunded = ChainFixture.pay(miner, ChainFixture.fundingUtxo(miner.getAddress(), 1_000_000),
                other.getAddress(), 10_000, 10_000);
        Transaction coinbase = Transaction.createCoinBaseTransaction(9, miner.getAddress(), REWARD, 0);

        ChainException e = Assertions.assertThrows(ChainException.class, () -> engine.submitTransaction(coinbase));

        Assertions.assertEquals(RejectReason.COINBASE_NOT_ALLOWED, e.getReason());
        Assertions.assertEquals(AdmissionResult.ORPHAN, engine.submitTransaction(unfunded));
        Assertions.assertEquals(1, listener.rejected.size());
        Assertions.assertEquals(coinbase.getTxIdHex(), listener.rejected.get(0).getTxId());
    }

    @Test
    public void headersFollowMainChain() {
        List<Block> blocks = fixture.extendMain(3, miner.getAddress());

        List<BlockHeader> headers = engine.getHeaders(1, 10);

        Assertions.assertEquals(3, headers.size());
        for (int i = 0; i < blocks.size(); i++) {
            Assertions.assertArrayEquals(blocks.get(i).getHash(), headers.get(i).computeHash());
        }
        Assertions.assertTrue(engine.getHeaders(10, 5).isEmpty());
    }

    @SneakyThrows
    @Test
    public void restartResumesFromStore() {
        List<Block> blocks = fixture.extendMain(3, miner.getAddress());
        engine.close();

        try (ChainFixture restarted = new ChainFixture(fixture.getConfig(), fixture.getStore())) {
            ConsensusEngine resumed = restarted.getEngine();
            Assertions.assertArrayEquals(blocks.get(2).getHash(), resumed.getMainTip().getHash());
            Assertions.assertEquals(3 * REWARD, resumed.getBalance(miner.getAddress()));
            Assertions.assertEquals(4 * REWARD, resumed.getLedger().getTotalSupply());
        }
    }

    @SneakyThrows
    @Test
    public void storeFromDifferentGenesisIsUnsupported() {
        SystemConfig config = ChainFixture.testConfig();
        config.getGenesis().setAddress(miner.getAddress());

        Assertions.assertThrows(UnsupportedChainException.class, () -> new ChainFixture(config, fixture.getStore()));
    }

    @SneakyThrows
    @Test
    public void storageFailureHaltsEngine() {
        FailingStore store = new FailingStore();
        try (ChainFixture failing = new ChainFixture(ChainFixture.testConfig(), store)) {
            ConsensusEngine halting = failing.getEngine();
            Block block = ChainFixture.buildBlock(failing.genesis(), miner.getAddress(), Collections.emptyList());
            store.failing = true;

            Assertions.assertThrows(StorageFailureException.class, () -> halting.applyExternalBlock(block, PEER));
            Assertions.assertTrue(halting.isHalted());

            store.failing = false;
            StorageFailureException e = Assertions.assertThrows(StorageFailureException.class,
                    () -> halting.applyExternalBlock(block, PEER));
            Assertions.assertEquals(RejectReason.ENGINE_HALTED, e.getReason());
        }
    }

    private static class FailingStore extends MemoryChainStore {
        private volatile boolean failing;

        @Override
        public BlockIndexEntry getIndexEntry(byte[] hash) {
            if (failing) {
                throw new StorageFailureException("模拟磁盘故障");
            }
            return super.getIndexEntry(hash);
        }
    }

    private static class RecordingListener implements ChainEventListener {
        private final List<TipChange> newTips = new CopyOnWriteArrayList<>();
        private final List<ReorgEvent> reorgs = new CopyOnWriteArrayList<>();
        private final List<RejectedTransactionEvent> rejected = new CopyOnWriteArrayList<>();

        @Override
        public void onNewTip(@NotNull TipChange change) {
            newTips.add(change);
        }

        @Override
        public void onReorg(@NotNull ReorgEvent event) {
            reorgs.add(event);
        }

        @Override
        public void onTransactionRejected(@NotNull RejectedTransactionEvent event) {
            rejected.add(event);
        }
    }
}
