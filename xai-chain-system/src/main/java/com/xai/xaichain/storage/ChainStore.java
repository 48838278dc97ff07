package com.xai.xaichain.storage;

/**
 * 共识核心使用的全部持久化状态
 */
public interface ChainStore extends BlockStore, UtxoStore, CheckpointStore, AutoCloseable {

    StoreBatch newBatch();

    /**
     * 尚未写入创世区块
     */
    default boolean isEmpty() {
        return getTipHash() == null;
    }

    @Override
    void close();
}
