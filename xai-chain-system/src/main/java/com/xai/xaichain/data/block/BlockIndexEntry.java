package com.xai.xaichain.data.block;

import com.xai.xaichain.util.CryptoUtil;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 区块索引：按哈希查找，父区块只以哈希引用
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class BlockIndexEntry {

    private byte[] hash;

    private byte[] previousHash;

    private long height;

    private long time;

    private byte[] difficultyTarget;

    // 从创世区块到该区块的累计工作量
    private BigInteger chainWork;

    private BlockStatus status;

    // 首次收到该区块的节点，本地挖出为 null
    private String sourcePeer;

    public String getHashHex() {
        return CryptoUtil.bytesToHex(hash);
    }

    public boolean isValid() {
        return status == BlockStatus.VALID;
    }

    public ChainTip toTip() {
        return new ChainTip(hash, chainWork, height);
    }
}
