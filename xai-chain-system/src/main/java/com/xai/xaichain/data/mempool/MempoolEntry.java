package com.xai.xaichain.data.mempool;

import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.data.transaction.TransactionKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 交易池条目
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class MempoolEntry {

    private Transaction transaction;

    private String txId;

    private String sender;

    private long fee;

    private int size;

    // 进入交易池的时间（毫秒）
    private long insertedAt;

    // 插入序号，同费率时先进先出
    private long sequence;

    // 验证时的账本状态版本与链尖
    private long validatedAtVersion;

    private String validatedAtTip;

    private String sourcePeer;

    /**
     * 手续费率（每字节），仅用于展示
     */
    public double getFeeRate() {
        return size == 0 ? 0 : (double) fee / size;
    }

    public boolean isAccount() {
        return transaction.getKind() == TransactionKind.ACCOUNT;
    }

    public long getNonce() {
        return transaction.getNonce();
    }

    /**
     * 精确比较手续费率：fee1/size1 与 fee2/size2 交叉相乘
     */
    public int compareFeeRate(MempoolEntry other) {
        return compareFeeRate(fee, size, other.fee, other.size);
    }

    public static int compareFeeRate(long fee1, int size1, long fee2, int size2) {
        return BigInteger.valueOf(fee1).multiply(BigInteger.valueOf(size2))
                .compareTo(BigInteger.valueOf(fee2).multiply(BigInteger.valueOf(size1)));
    }
}
