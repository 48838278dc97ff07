package com.xai.xaichain.storage;

import com.xai.xaichain.data.checkpoint.Checkpoint;

import java.util.List;

/**
 * 检查点存储：按高度保存
 */
public interface CheckpointStore {

    Checkpoint getCheckpoint(long height);

    /**
     * 按高度升序
     */
    List<Checkpoint> listCheckpoints();
}
