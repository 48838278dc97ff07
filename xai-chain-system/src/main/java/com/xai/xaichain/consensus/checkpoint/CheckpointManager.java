package com.xai.xaichain.consensus.checkpoint;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.MerklePath;
import com.xai.xaichain.data.block.MerkleProof;
import com.xai.xaichain.data.checkpoint.Checkpoint;
import com.xai.xaichain.data.transaction.UTXO;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.StorageFailureException;
import com.xai.xaichain.exception.ValidationException;
import com.xai.xaichain.storage.ChainStore;
import com.xai.xaichain.storage.StoreBatch;
import com.xai.xaichain.util.CodecUtils;
import com.xai.xaichain.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 检查点：每 interval 个区块对 UTXO 集合做一次快照摘要
 * 检查点高度及以下不允许重组；同时为轻客户端提供默克尔证明
 */
@Slf4j
public class CheckpointManager {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final ChainStore store;
    private final int interval;
    private final int keep;
    private final Clock clock;

    // 配置中的受信任检查点：高度 -> 区块哈希
    private final NavigableMap<Long, byte[]> trustedCheckpoints;

    public CheckpointManager(ChainStore store, int interval, int keep, Clock clock, Map<Long, byte[]> trustedCheckpoints) {
        if (interval <= 0 || keep <= 0) {
            throw new IllegalArgumentException("检查点参数非法");
        }
        this.store = store;
        this.interval = interval;
        this.keep = keep;
        this.clock = clock;
        this.trustedCheckpoints = Collections.unmodifiableNavigableMap(new TreeMap<>(trustedCheckpoints));
    }

    /**
     * 解析 "高度:区块哈希" 形式的配置
     */
    public static Map<Long, byte[]> parseTrusted(List<String> entries) {
        Map<Long, byte[]> result = new TreeMap<>();
        if (entries == null) {
            return result;
        }
        for (String entry : entries) {
            String[] parts = entry.trim().split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("受信任检查点格式应为 高度:哈希 ，实际: " + entry);
            }
            byte[] hash = CryptoUtil.hexToBytes(parts[1].trim());
            if (hash.length != 32) {
                throw new IllegalArgumentException("受信任检查点哈希必须为32字节: " + entry);
            }
            result.put(Long.parseLong(parts[0].trim()), hash);
        }
        return result;
    }

    public byte[] trustedHashAt(long height) {
        return trustedCheckpoints.get(height);
    }

    /**
     * 不允许重组越过的高度：最新检查点与不高于链尖的最高受信任检查点中较高者，没有返回 -1
     */
    public long finalizedHeight(long tipHeight) {
        long finalized = -1;
        Checkpoint latest = latestCheckpoint();
        if (latest != null) {
            finalized = latest.getHeight();
        }
        Map.Entry<Long, byte[]> trusted = trustedCheckpoints.floorEntry(tipHeight);
        if (trusted != null) {
            finalized = Math.max(finalized, trusted.getKey());
        }
        return finalized;
    }

    /**
     * 区块连接到主链后调用，到达间隔高度时对当前 UTXO 集合做快照，此时还不保存
     * @return 待保存的检查点，未到间隔或该高度已有检查点返回 null
     */
    public Checkpoint snapshotIfDue(long height, byte[] blockHash) {
        if (height == 0 || height % interval != 0) {
            return null;
        }
        if (store.getCheckpoint(height) != null) {
            return null;
        }
        return createSnapshot(height, blockHash);
    }

    /**
     * 主链切换全部成功后保存检查点，只保留最新的 keep 个
     */
    public void commit(List<Checkpoint> checkpoints) {
        if (checkpoints.isEmpty()) {
            return;
        }
        NavigableMap<Long, Checkpoint> all = new TreeMap<>();
        for (Checkpoint existing : store.listCheckpoints()) {
            all.put(existing.getHeight(), existing);
        }
        for (Checkpoint checkpoint : checkpoints) {
            all.put(checkpoint.getHeight(), checkpoint);
        }
        StoreBatch batch = store.newBatch();
        while (all.size() > keep) {
            Checkpoint expired = all.pollFirstEntry().getValue();
            if (!checkpoints.contains(expired)) {
                batch.deleteCheckpoint(expired.getHeight());
                log.info("删除过期检查点，高度 {}", expired.getHeight());
            }
        }
        for (Checkpoint checkpoint : checkpoints) {
            if (all.containsKey(checkpoint.getHeight())) {
                batch.putCheckpoint(checkpoint);
                log.info("创建检查点 高度:{} 区块:{} UTXO数:{} 发行总量:{}", checkpoint.getHeight(),
                        checkpoint.getBlockHash(), checkpoint.getUtxoCount(), checkpoint.getTotalSupply());
            }
        }
        batch.commit();
    }

    /**
     * 对当前 UTXO 集合做快照摘要
     */
    public Checkpoint createSnapshot(long height, byte[] blockHash) {
        MessageDigest digest = DigestUtils.getSha256Digest();
        List<byte[]> leaves = new ArrayList<>();
        long[] count = new long[1];
        store.forEachUtxo(utxo -> {
            byte[] encoded = encodeUtxo(utxo);
            digest.update(encoded);
            leaves.add(CryptoUtil.doubleSHA256(encoded));
            count[0]++;
        });
        Checkpoint checkpoint = new Checkpoint();
        checkpoint.setHeight(height);
        checkpoint.setBlockHash(CryptoUtil.bytesToHex(blockHash));
        checkpoint.setUtxoDigest(CryptoUtil.bytesToHex(digest.digest()));
        checkpoint.setUtxoMerkleRoot(CryptoUtil.bytesToHex(Block.calculateMerkleRootFromHashes(leaves)));
        checkpoint.setUtxoCount(count[0]);
        checkpoint.setTotalSupply(store.getTotalSupply());
        checkpoint.setCreatedAt(clock.millis() / 1000);
        checkpoint.setIntegrityHash(checkpoint.computeIntegrityHash());
        return checkpoint;
    }

    /**
     * UTXO 规范编码：输出引用键 | 金额(8字节小端) | 地址 | 高度(8字节小端) | CoinBase 标记
     */
    private static byte[] encodeUtxo(UTXO utxo) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {
            dos.write(utxo.getOutpoint().toKey());
            CodecUtils.writeLongLE(dos, utxo.getValue());
            CodecUtils.writeString(dos, utxo.getAddress());
            CodecUtils.writeLongLE(dos, utxo.getHeight());
            dos.writeByte(utxo.isCoinbase() ? 1 : 0);
            dos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("UTXO编码失败", e);
        }
    }

    public Checkpoint latestCheckpoint() {
        List<Checkpoint> checkpoints = store.listCheckpoints();
        return checkpoints.isEmpty() ? null : checkpoints.get(checkpoints.size() - 1);
    }

    public Checkpoint getCheckpoint(long height) {
        return store.getCheckpoint(height);
    }

    public List<Checkpoint> listCheckpoints() {
        return store.listCheckpoints();
    }

    /**
     * 检查点完整性哈希正确，且与主链该高度的区块一致
     */
    public boolean verify(Checkpoint checkpoint) {
        if (checkpoint == null || !checkpoint.verifyIntegrity()) {
            return false;
        }
        byte[] mainHash = store.getMainBlockHash(checkpoint.getHeight());
        return mainHash != null && CryptoUtil.bytesToHex(mainHash).equals(checkpoint.getBlockHash());
    }

    /**
     * 链尖恰好位于最新检查点高度时，重新计算快照并与检查点比对
     * @return 不适用时返回 true
     */
    public boolean verifyLedgerConsistency(long tipHeight, byte[] tipHash) {
        Checkpoint latest = latestCheckpoint();
        if (latest == null || latest.getHeight() != tipHeight) {
            return true;
        }
        Checkpoint current = createSnapshot(tipHeight, tipHash);
        boolean consistent = latest.getBlockHash().equals(current.getBlockHash())
                && latest.getUtxoDigest().equals(current.getUtxoDigest())
                && latest.getUtxoCount() == current.getUtxoCount()
                && latest.getTotalSupply() == current.getTotalSupply();
        if (!consistent) {
            log.error("账本与检查点不一致，高度 {}", tipHeight);
        }
        return consistent;
    }

    public String exportJson(Checkpoint checkpoint) {
        return GSON.toJson(checkpoint);
    }

    /**
     * 解析轻客户端拿到的检查点，完整性哈希不符则拒绝
     */
    public static Checkpoint importJson(String json) {
        Checkpoint checkpoint;
        try {
            checkpoint = GSON.fromJson(json, Checkpoint.class);
        } catch (JsonParseException e) {
            throw new ValidationException(RejectReason.MALFORMED, "检查点JSON格式错误", e);
        }
        if (checkpoint == null || !checkpoint.verifyIntegrity()) {
            throw new ValidationException(RejectReason.MALFORMED, "检查点完整性校验失败");
        }
        return checkpoint;
    }

    /**
     * 主链交易的默克尔证明，交易不在主链上返回 null
     */
    public MerkleProof buildMerkleProof(byte[] txId) {
        byte[] blockHash = store.getTransactionBlockHash(txId);
        if (blockHash == null) {
            return null;
        }
        Block block = store.getBlock(blockHash);
        if (block == null) {
            throw new StorageFailureException("交易索引指向不存在的区块: " + CryptoUtil.bytesToHex(blockHash));
        }
        MerklePath path = block.generateMerklePath(txId);
        if (path == null) {
            throw new StorageFailureException("交易索引与区块内容不一致: " + CryptoUtil.bytesToHex(txId));
        }
        return new MerkleProof(Arrays.copyOf(txId, txId.length), block.getHash(), block.getHeight(), block.getMerkleRoot(), path);
    }
}
