package com.xai.xaichain.storage;

import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.data.checkpoint.Checkpoint;
import com.xai.xaichain.data.ledger.BlockUndo;
import com.xai.xaichain.data.transaction.UTXO;

/**
 * 原子写批次：commit 之前的修改对读不可见，commit 要么全部生效要么全部不生效
 */
public interface StoreBatch {

    StoreBatch putBlock(Block block);

    StoreBatch putIndexEntry(BlockIndexEntry entry);

    StoreBatch putMainBlockHash(long height, byte[] hash);

    StoreBatch deleteMainBlockHash(long height);

    StoreBatch putTransactionIndex(byte[] txId, byte[] blockHash);

    StoreBatch deleteTransactionIndex(byte[] txId);

    StoreBatch putUndo(BlockUndo undo);

    StoreBatch deleteUndo(byte[] blockHash);

    StoreBatch putTipHash(byte[] hash);

    StoreBatch putUtxo(UTXO utxo);

    StoreBatch deleteUtxo(UTXO utxo);

    StoreBatch putNonce(String address, long nextNonce);

    StoreBatch putTotalSupply(long totalSupply);

    StoreBatch putUtxoCount(long utxoCount);

    StoreBatch putCheckpoint(Checkpoint checkpoint);

    StoreBatch deleteCheckpoint(long height);

    /**
     * 提交，失败抛出 StorageFailureException
     */
    void commit();
}
