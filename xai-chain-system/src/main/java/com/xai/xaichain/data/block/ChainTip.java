package com.xai.xaichain.data.block;

import com.xai.xaichain.util.ByteUtils;
import com.xai.xaichain.util.CryptoUtil;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 链尖：区块哈希、累计工作量、高度
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ChainTip {

    private byte[] hash;

    private BigInteger chainWork;

    private long height;

    public String getHashHex() {
        return CryptoUtil.bytesToHex(hash);
    }

    /**
     * 是否优于另一个链尖：累计工作量更大；相等时哈希（无符号字节序）更小者胜出
     */
    public boolean isBetterThan(ChainTip other) {
        if (other == null) {
            return true;
        }
        int workCompare = chainWork.compareTo(other.chainWork);
        if (workCompare != 0) {
            return workCompare > 0;
        }
        return ByteUtils.compareUnsigned(hash, other.hash) < 0;
    }

    @Override
    public String toString() {
        return "ChainTip{height=" + height + ", hash=" + getHashHex() + ", chainWork=" + chainWork + "}";
    }
}
