package com.xai.xaichain.data.transaction;

import com.xai.xaichain.util.ByteUtils;
import com.xai.xaichain.util.CryptoUtil;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 输出引用：(交易ID, 输出索引)，可花费输出的不可变身份
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Outpoint {

    private byte[] txId;

    private int vout;

    /**
     * 存储键：txId(32字节) + vout(4字节大端)，按字节序即按 (txId, vout) 排序
     */
    public byte[] toKey() {
        return ByteUtils.concat(txId, ByteUtils.intToBytes(vout));
    }

    /**
     * 十六进制形式的键，内存结构里用作 Map 键，字典序与 {@link #toKey()} 一致
     */
    public String toKeyHex() {
        return CryptoUtil.bytesToHex(toKey());
    }

    public static Outpoint fromKey(byte[] key) {
        byte[] txId = new byte[32];
        System.arraycopy(key, 0, txId, 0, 32);
        byte[] vout = new byte[4];
        System.arraycopy(key, 32, vout, 0, 4);
        return new Outpoint(txId, ByteUtils.bytesToInt(vout));
    }

    @Override
    public String toString() {
        return CryptoUtil.bytesToHex(txId) + ":" + vout;
    }
}
