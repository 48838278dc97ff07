package com.xai.xaichain.exception;

/**
 * 格式错误的输入，直接拒绝，不产生任何副作用
 */
public class ValidationException extends ChainException {

    private static final long serialVersionUID = 1L;

    public ValidationException(RejectReason reason, String message) {
        super(reason, message);
    }

    public ValidationException(RejectReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
