package com.xai.xaichain.data.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * description：交易输入
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class TXInput {

    // 最终序列号，小于 RBF_SEQUENCE_THRESHOLD 表示允许被替换
    public static final long FINAL_SEQUENCE = 0xFFFFFFFFL;
    public static final long RBF_SEQUENCE_THRESHOLD = 0xFFFFFFFEL;

    /**
     * 前序交易的ID
     */
    private byte[] txId;

    /**
     * 前序交易的输出索引
     */
    private int vout;

    /** 序列号（默认0xFFFFFFFF） */
    private long sequence = FINAL_SEQUENCE;

    /**
     * X.509 编码的公钥，哈希后必须等于被花费输出的地址
     */
    private byte[] publicKey;

    /**
     * 对交易签名载荷的 ECDSA 签名
     */
    private byte[] signature;

    public TXInput(byte[] txId, int vout) {
        this.txId = txId;
        this.vout = vout;
    }

    public Outpoint toOutpoint() {
        return new Outpoint(txId, vout);
    }
}
