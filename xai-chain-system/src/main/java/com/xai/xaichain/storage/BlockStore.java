package com.xai.xaichain.storage;

import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.data.ledger.BlockUndo;

import java.util.function.Consumer;

/**
 * 区块存储：按哈希保存完整区块与索引，按高度保存主链
 */
public interface BlockStore {

    /**
     * 按哈希读取区块，height 取自索引
     */
    Block getBlock(byte[] hash);

    BlockIndexEntry getIndexEntry(byte[] hash);

    /**
     * 主链索引：高度 -> 区块哈希
     */
    byte[] getMainBlockHash(long height);

    /**
     * 交易索引：主链上的交易 -> 所在区块哈希
     */
    byte[] getTransactionBlockHash(byte[] txId);

    BlockUndo getUndo(byte[] blockHash);

    /**
     * 主链链尖哈希，空库返回 null
     */
    byte[] getTipHash();

    void forEachIndexEntry(Consumer<BlockIndexEntry> consumer);
}
