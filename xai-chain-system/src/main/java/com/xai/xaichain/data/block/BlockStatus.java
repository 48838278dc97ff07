package com.xai.xaichain.data.block;

/**
 * 区块索引状态
 */
public enum BlockStatus {
    // 区块头、结构与上下文已验证，交易在连接到主链时再完整验证
    VALID,
    // 连接时验证失败，永不再选为链尖
    INVALID
}
