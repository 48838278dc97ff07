package com.xai.xaichain.data.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class UTXO {

    /**
     * 交易Id的hash值
     */
    private byte[] txId;

    /**
     * 引用交易输出索引
     */
    private int vout;

    /**
     * 接收者 地址
     */
    private String address;

    /**
     * 数值 最小单位
     */
    private long value;

    /**
     * 创建该输出的区块高度
     */
    private long height;

    /**
     * 是否来自CoinBase交易（需要满足成熟度才能花费）
     */
    private boolean coinbase;

    public Outpoint getOutpoint() {
        return new Outpoint(txId, vout);
    }
}
