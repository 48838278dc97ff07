package com.xai.xaichain.data.transaction;

import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ValidationException;
import lombok.Getter;

/**
 * 交易种类：验证规则按种类分派
 */
@Getter
public enum TransactionKind {
    // 出块奖励，无输入，nonce 等于区块高度
    COINBASE(0),
    // 普通 UTXO 转账，nonce 固定为 0
    UTXO(1),
    // 账户式转账：输入属于同一发送者，携带该发送者的顺序 nonce
    ACCOUNT(2);

    private final int code;

    TransactionKind(int code) {
        this.code = code;
    }

    public static TransactionKind fromCode(int code) {
        for (TransactionKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new ValidationException(RejectReason.MALFORMED, "未知的交易种类: " + code);
    }
}
