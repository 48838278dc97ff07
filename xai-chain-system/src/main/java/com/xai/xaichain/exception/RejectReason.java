package com.xai.xaichain.exception;

import lombok.Getter;

/**
 * 区块/交易被拒绝的原因，RPC 调用方拿到的就是这里的 code
 */
@Getter
public enum RejectReason {
    // 结构与格式
    MALFORMED(ErrorCategory.VALIDATION, "数据格式错误"),
    EMPTY_INPUTS(ErrorCategory.VALIDATION, "交易输入为空"),
    EMPTY_OUTPUTS(ErrorCategory.VALIDATION, "交易输出为空"),
    DUPLICATE_INPUT(ErrorCategory.VALIDATION, "交易内存在重复输入"),
    OVERSIZED(ErrorCategory.VALIDATION, "大小超过上限"),
    BAD_SIGNATURE_FORMAT(ErrorCategory.VALIDATION, "签名或公钥格式错误"),
    BAD_ADDRESS(ErrorCategory.VALIDATION, "地址格式错误"),
    BAD_AMOUNT(ErrorCategory.VALIDATION, "金额非法"),
    BAD_TXID(ErrorCategory.VALIDATION, "交易ID与内容不匹配"),
    MIXED_SENDERS(ErrorCategory.VALIDATION, "账户交易的输入必须来自同一发送者"),
    BAD_NONCE_FIELD(ErrorCategory.VALIDATION, "nonce字段非法"),
    COINBASE_NOT_ALLOWED(ErrorCategory.VALIDATION, "CoinBase交易不能单独提交"),
    DUPLICATE(ErrorCategory.VALIDATION, "重复提交"),
    ALREADY_CONFIRMED(ErrorCategory.VALIDATION, "交易已被确认"),
    FEE_TOO_LOW(ErrorCategory.VALIDATION, "手续费率低于下限"),
    INSUFFICIENT_REPLACEMENT_FEE(ErrorCategory.VALIDATION, "替换交易手续费不足"),

    // 共识
    MISSING_OUTPOINT(ErrorCategory.CONSENSUS, "引用的输出不存在或已花费"),
    AMOUNT_OVERFLOW(ErrorCategory.CONSENSUS, "金额运算溢出"),
    INSUFFICIENT_FUNDS(ErrorCategory.CONSENSUS, "输入金额小于输出金额"),
    BAD_SIGNATURE(ErrorCategory.CONSENSUS, "签名验证失败"),
    OWNER_MISMATCH(ErrorCategory.CONSENSUS, "公钥与输出所有者不匹配"),
    IMMATURE_COINBASE(ErrorCategory.CONSENSUS, "CoinBase输出未成熟"),
    NONCE_REUSED(ErrorCategory.CONSENSUS, "nonce已被使用"),
    NONCE_TOO_FAR(ErrorCategory.CONSENSUS, "nonce超出允许的未来窗口"),
    FUTURE_NONCE_IN_BLOCK(ErrorCategory.CONSENSUS, "区块内交易nonce不连续"),
    BAD_POW(ErrorCategory.CONSENSUS, "工作量证明不满足难度目标"),
    BAD_HASH(ErrorCategory.CONSENSUS, "区块哈希与区块头不匹配"),
    BAD_DIFFICULTY(ErrorCategory.CONSENSUS, "难度目标与预期不符"),
    TIME_TOO_NEW(ErrorCategory.CONSENSUS, "区块时间超过允许的未来偏移"),
    TIME_TOO_OLD(ErrorCategory.CONSENSUS, "区块时间早于前11个区块的中位时间"),
    BAD_MERKLE_ROOT(ErrorCategory.CONSENSUS, "默克尔根不匹配"),
    BAD_COINBASE(ErrorCategory.CONSENSUS, "CoinBase交易不符合奖励规则"),
    DUPLICATE_TX_IN_BLOCK(ErrorCategory.CONSENSUS, "区块内存在重复交易"),
    INVALID_PARENT(ErrorCategory.CONSENSUS, "父区块无效"),
    KNOWN_INVALID(ErrorCategory.CONSENSUS, "区块此前已被判定无效"),
    CHECKPOINT_MISMATCH(ErrorCategory.CONSENSUS, "与检查点哈希不一致"),

    // 资源
    MEMPOOL_FULL(ErrorCategory.RESOURCE, "交易池已满"),
    SENDER_LIMIT(ErrorCategory.RESOURCE, "发送者待处理交易过多"),
    SENDER_BANNED(ErrorCategory.RESOURCE, "发送者处于冷却期"),
    ORPHAN_POOL_FULL(ErrorCategory.RESOURCE, "孤块池已满"),

    // 重组
    REORG_TOO_DEEP(ErrorCategory.REORG, "重组深度超过上限"),
    REORG_BELOW_CHECKPOINT(ErrorCategory.REORG, "重组越过检查点"),

    // 存储
    STORAGE_FAILURE(ErrorCategory.STORAGE, "持久化失败"),
    ENGINE_HALTED(ErrorCategory.STORAGE, "共识引擎因存储故障已停止");

    private final ErrorCategory category;
    private final String description;

    RejectReason(ErrorCategory category, String description) {
        this.category = category;
        this.description = description;
    }
}
