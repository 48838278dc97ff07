package com.xai.xaichain.consensus.checkpoint;

import com.xai.xaichain.ChainFixture;
import com.xai.xaichain.config.SystemConfig;
import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.MerkleProof;
import com.xai.xaichain.data.block.TipChange;
import com.xai.xaichain.data.block.TipChangeType;
import com.xai.xaichain.data.checkpoint.Checkpoint;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.exception.ConsensusViolationException;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ReorgTooDeepException;
import com.xai.xaichain.exception.StorageFailureException;
import com.xai.xaichain.exception.ValidationException;
import com.xai.xaichain.storage.ChainStore;
import com.xai.xaichain.storage.MemoryChainStore;
import com.xai.xaichain.util.CryptoUtil;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class CheckpointManagerTest {

    private ChainFixture fixture;
    private CheckpointManager manager;
    private String miner;

    @SneakyThrows
    @BeforeEach
    public void setUp() {
        fixture = new ChainFixture(checkpointConfig());
        manager = new CheckpointManager(fixture.getStore(), 2, 2, fixture.getClock(), Collections.emptyMap());
        miner = ChainFixture.newWallet().getAddress();
    }

    @AfterEach
    public void tearDown() {
        fixture.close();
    }

    private static SystemConfig checkpointConfig() {
        SystemConfig config = ChainFixture.testConfig();
        config.getCheckpoint().setInterval(2);
        config.getCheckpoint().setKeep(2);
        return config;
    }

    @Test
    public void checkpointsFollowIntervalAndKeepNewest() {
        Assertions.assertNull(manager.latestCheckpoint());
        Assertions.assertEquals(-1, manager.finalizedHeight(0));

        List<Block> blocks = fixture.extendMain(6, miner);
        List<Checkpoint> checkpoints = manager.listCheckpoints();
        Assertions.assertEquals(2, checkpoints.size());
        Assertions.assertEquals(4, checkpoints.get(0).getHeight());
        Assertions.assertEquals(6, checkpoints.get(1).getHeight());
        Assertions.assertNull(manager.getCheckpoint(2));

        Checkpoint latest = manager.latestCheckpoint();
        Assertions.assertEquals(blocks.get(5).getHashHex(), latest.getBlockHash());
        Assertions.assertEquals(7 * ChainFixture.REWARD, latest.getTotalSupply());
        Assertions.assertEquals(7, latest.getUtxoCount());
        Assertions.assertTrue(manager.verify(latest));
        Assertions.assertTrue(manager.verifyLedgerConsistency(6, blocks.get(5).getHash()));
        Assertions.assertEquals(6, manager.finalizedHeight(6));
        Assertions.assertEquals(6, fixture.getEngine().getChainStatus().getLatestCheckpointHeight());
    }

    @Test
    public void snapshotDependsOnLedgerOnly() {
        List<Block> blocks = fixture.extendMain(2, miner);
        Checkpoint first = manager.createSnapshot(2, blocks.get(1).getHash());
        fixture.getClock().advanceSeconds(30);
        Checkpoint second = manager.createSnapshot(2, blocks.get(1).getHash());
        Assertions.assertEquals(first.getUtxoDigest(), second.getUtxoDigest());
        Assertions.assertEquals(first.getUtxoMerkleRoot(), second.getUtxoMerkleRoot());
        Assertions.assertNotEquals(first.getIntegrityHash(), second.getIntegrityHash());

        fixture.mineOnTip(miner);
        Checkpoint third = manager.createSnapshot(3, fixture.tipBlock().getHash());
        Assertions.assertNotEquals(first.getUtxoDigest(), third.getUtxoDigest());
    }

    @Test
    public void checkpointOffMainChainFailsVerification() {
        fixture.extendMain(4, miner);
        Checkpoint checkpoint = manager.latestCheckpoint();
        Assertions.assertTrue(manager.verify(checkpoint));

        Checkpoint forged = CheckpointManager.importJson(manager.exportJson(checkpoint));
        forged.setBlockHash(CryptoUtil.bytesToHex(new byte[32]));
        forged.setIntegrityHash(forged.computeIntegrityHash());
        Assertions.assertFalse(manager.verify(forged));
        Assertions.assertFalse(manager.verify(null));
    }

    @Test
    public void exportedJsonImportsAndDetectsTampering() {
        fixture.extendMain(4, miner);
        String json = fixture.getEngine().exportCheckpoint(4);
        Assertions.assertNotNull(json);
        Assertions.assertNull(fixture.getEngine().exportCheckpoint(3));

        Checkpoint imported = CheckpointManager.importJson(json);
        Assertions.assertEquals(manager.getCheckpoint(4), imported);

        imported.setTotalSupply(imported.getTotalSupply() + 1);
        String tampered = manager.exportJson(imported);
        ValidationException e = Assertions.assertThrows(ValidationException.class,
                () -> CheckpointManager.importJson(tampered));
        Assertions.assertEquals(RejectReason.MALFORMED, e.getReason());

        ValidationException garbage = Assertions.assertThrows(ValidationException.class,
                () -> CheckpointManager.importJson("{\"height\": \"abc\""));
        Assertions.assertEquals(RejectReason.MALFORMED, garbage.getReason());
    }

    @Test
    public void forkBelowCheckpointIsRefused() {
        List<Block> blocks = fixture.extendMain(6, miner);
        Block fork = ChainFixture.buildBlock(blocks.get(2), miner, Collections.emptyList(), 1);
        ReorgTooDeepException e = Assertions.assertThrows(ReorgTooDeepException.class,
                () -> fixture.getEngine().applyExternalBlock(fork, ChainFixture.PEER));
        Assertions.assertEquals(RejectReason.REORG_BELOW_CHECKPOINT, e.getReason());
        Assertions.assertEquals(blocks.get(5).getHashHex(), fixture.getEngine().getMainTip().getHashHex());

        // 检查点之上照常延长
        Block above = ChainFixture.buildBlock(blocks.get(5), miner, Collections.emptyList(), 1);
        TipChange change = fixture.getEngine().applyExternalBlock(above, ChainFixture.PEER);
        Assertions.assertEquals(TipChangeType.EXTENDED, change.getType());
    }

    @Test
    public void rolledBackSwitchCommitsOnlyMainChainCheckpoints() {
        List<Block> prefix = fixture.extendMain(2, miner);
        fixture.mineOnTip(miner);

        ChainFixture.Wallet thief = ChainFixture.newWallet();
        Transaction bogus = ChainFixture.pay(thief, ChainFixture.fundingUtxo(thief.getAddress(), 1_000_000),
                miner, 500_000, 1_000);
        Block s3 = ChainFixture.buildBlock(prefix.get(1), miner, Collections.emptyList(), 1);
        Block s4 = ChainFixture.buildBlock(s3, miner, Collections.emptyList(), 1);
        Block s5 = ChainFixture.buildBlock(s4, miner, Collections.singletonList(bogus), 1);
        Assertions.assertEquals(TipChangeType.ORPHANED, fixture.getEngine().applyExternalBlock(s5, ChainFixture.PEER).getType());
        Assertions.assertEquals(TipChangeType.ORPHANED, fixture.getEngine().applyExternalBlock(s4, ChainFixture.PEER).getType());

        // s5 连接失败，s3-s4 仍比原主链更重
        TipChange change = fixture.getEngine().applyExternalBlock(s3, ChainFixture.PEER);

        Assertions.assertEquals(TipChangeType.REORG, change.getType());
        Assertions.assertEquals(s4.getHashHex(), fixture.getEngine().getMainTip().getHashHex());
        Checkpoint latest = manager.latestCheckpoint();
        Assertions.assertEquals(4, latest.getHeight());
        Assertions.assertEquals(s4.getHashHex(), latest.getBlockHash());
        for (Checkpoint checkpoint : manager.listCheckpoints()) {
            Assertions.assertTrue(manager.verify(checkpoint));
        }
        Assertions.assertTrue(manager.verifyLedgerConsistency(4, s4.getHash()));
    }

    @Test
    public void pendingCheckpointsRespectRetention() {
        List<Block> blocks = fixture.extendMain(2, miner);
        Checkpoint second = manager.getCheckpoint(2);
        Assertions.assertNotNull(second);
        // 该高度已有检查点时不再快照
        Assertions.assertNull(manager.snapshotIfDue(2, blocks.get(1).getHash()));
        Assertions.assertNull(manager.snapshotIfDue(3, blocks.get(1).getHash()));

        Checkpoint fourth = manager.createSnapshot(4, blocks.get(1).getHash());
        Checkpoint sixth = manager.createSnapshot(6, blocks.get(1).getHash());
        manager.commit(Arrays.asList(fourth, sixth));

        List<Checkpoint> kept = manager.listCheckpoints();
        Assertions.assertEquals(2, kept.size());
        Assertions.assertEquals(4, kept.get(0).getHeight());
        Assertions.assertEquals(6, kept.get(1).getHeight());
        Assertions.assertNull(manager.getCheckpoint(2));
    }

    @SneakyThrows
    @Test
    public void trustedCheckpointPinsBlockHash() {
        Block genesis = fixture.genesis();
        Block pinned = ChainFixture.buildBlock(genesis, miner, Collections.emptyList());
        Block other = ChainFixture.buildBlock(genesis, miner, Collections.emptyList(), 5);

        SystemConfig config = ChainFixture.testConfig();
        config.getConsensus().setTrustedCheckpoints(Collections.singletonList("1:" + pinned.getHashHex()));
        try (ChainFixture trusted = new ChainFixture(config)) {
            ConsensusViolationException e = Assertions.assertThrows(ConsensusViolationException.class,
                    () -> trusted.getEngine().applyExternalBlock(other, ChainFixture.PEER));
            Assertions.assertEquals(RejectReason.CHECKPOINT_MISMATCH, e.getReason());

            TipChange change = trusted.getEngine().applyExternalBlock(pinned, ChainFixture.PEER);
            Assertions.assertEquals(TipChangeType.EXTENDED, change.getType());
        }
    }

    @Test
    public void trustedEntriesAreParsed() {
        String hash = CryptoUtil.bytesToHex(new byte[32]);
        Map<Long, byte[]> trusted = CheckpointManager.parseTrusted(Arrays.asList("10:" + hash, " 5 : " + hash));
        Assertions.assertEquals(2, trusted.size());
        Assertions.assertTrue(trusted.containsKey(5L));
        Assertions.assertTrue(CheckpointManager.parseTrusted(null).isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class, () -> CheckpointManager.parseTrusted(
                Collections.singletonList("10")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CheckpointManager.parseTrusted(
                Collections.singletonList("10:abcd")));

        CheckpointManager withTrusted = new CheckpointManager(fixture.getStore(), 2, 2, fixture.getClock(), trusted);
        Assertions.assertEquals(5, withTrusted.finalizedHeight(7));
        Assertions.assertEquals(10, withTrusted.finalizedHeight(10));
        Assertions.assertEquals(-1, withTrusted.finalizedHeight(4));
    }

    @Test
    public void merkleProofCoversMainChainTransactions() {
        Block block = fixture.mineOnTip(miner);
        byte[] txId = block.getTransactions().get(0).getTxId();
        MerkleProof proof = manager.buildMerkleProof(txId);
        Assertions.assertNotNull(proof);
        Assertions.assertEquals(1, proof.getHeight());
        Assertions.assertArrayEquals(block.getMerkleRoot(), proof.getMerkleRoot());
        Assertions.assertNull(manager.buildMerkleProof(new byte[32]));
    }

    @SneakyThrows
    @Test
    public void restartDetectsLedgerDivergingFromCheckpoint() {
        ChainStore store = new MemoryChainStore();
        SystemConfig config = checkpointConfig();
        ChainFixture first = new ChainFixture(config, store);
        first.extendMain(2, miner);
        first.getEngine().close();

        // 正常重启通过一致性校验
        ChainFixture second = new ChainFixture(config, store);
        Assertions.assertEquals(2, second.getEngine().getMainTip().getHeight());
        second.getEngine().close();

        Checkpoint checkpoint = store.getCheckpoint(2);
        checkpoint.setTotalSupply(checkpoint.getTotalSupply() + 1);
        checkpoint.setIntegrityHash(checkpoint.computeIntegrityHash());
        store.newBatch().putCheckpoint(checkpoint).commit();

        Assertions.assertThrows(StorageFailureException.class, () -> new ChainFixture(config, store));
    }
}
