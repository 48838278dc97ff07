package com.xai.xaichain.data.block;

/**
 * 接收一个区块后链尖的变化类型
 */
public enum TipChangeType {
    // 新区块（或一串区块）接在主链链尖之后
    EXTENDED,
    // 新区块延长了非主链分支，主链不变
    COMPETING,
    // 分支累计工作量超过主链，已完成重组
    REORG,
    // 父区块未知，已放入孤块池
    ORPHANED,
    // 已知区块，忽略
    DUPLICATE
}
