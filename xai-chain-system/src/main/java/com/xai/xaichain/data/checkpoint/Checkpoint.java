package com.xai.xaichain.data.checkpoint;

import com.xai.xaichain.util.ByteUtils;
import com.xai.xaichain.util.CryptoUtil;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;

/**
 * 检查点：某高度的区块哈希与 UTXO 集合快照摘要，写入后不可变
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Checkpoint {

    private long height;

    private String blockHash;

    // 按输出引用排序后所有 UTXO 规范编码的 SHA-256
    private String utxoDigest;

    // UTXO 集合的默克尔根
    private String utxoMerkleRoot;

    private long utxoCount;

    private long totalSupply;

    // 创建时间（秒）
    private long createdAt;

    private String integrityHash;

    /**
     * 完整性哈希：对除自身外全部字段的规范拼接做 SHA-256
     */
    public String computeIntegrityHash() {
        String payload = height + "|" + blockHash + "|" + utxoDigest + "|" + utxoMerkleRoot + "|"
                + utxoCount + "|" + totalSupply + "|" + createdAt;
        return CryptoUtil.bytesToHex(CryptoUtil.applySHA256(payload.getBytes(StandardCharsets.UTF_8)));
    }

    public boolean verifyIntegrity() {
        return integrityHash != null && integrityHash.equals(computeIntegrityHash());
    }

    public byte[] storageKey() {
        return ByteUtils.toBytes(height);
    }
}
