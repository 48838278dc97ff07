package com.xai.xaichain.exception;

import lombok.Getter;

/**
 * 共识核心所有拒绝/失败的根异常，携带类型化的拒绝原因
 */
@Getter
public abstract class ChainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final RejectReason reason;

    protected ChainException(RejectReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected ChainException(RejectReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public ErrorCategory getCategory() {
        return reason.getCategory();
    }
}
