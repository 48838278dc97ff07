package com.xai.xaichain.storage;

import com.xai.xaichain.data.transaction.Outpoint;
import com.xai.xaichain.data.transaction.UTXO;

import java.util.List;
import java.util.function.Consumer;

/**
 * UTXO 存储：按输出引用保存，附带地址索引与账户 nonce
 */
public interface UtxoStore {

    UTXO getUtxo(Outpoint outpoint);

    List<UTXO> getUtxosByAddress(String address);

    /**
     * 发送者下一个期望的 nonce，从未发送过为 0
     */
    long getNonce(String address);

    long getTotalSupply();

    long getUtxoCount();

    /**
     * 按输出引用键的字节序遍历全部 UTXO
     */
    void forEachUtxo(Consumer<UTXO> consumer);
}
