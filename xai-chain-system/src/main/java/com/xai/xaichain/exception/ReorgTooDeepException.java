package com.xai.xaichain.exception;

/**
 * 重组深度超过上限或越过检查点，保持当前链并记录为可疑
 */
public class ReorgTooDeepException extends ChainException {

    private static final long serialVersionUID = 1L;

    public ReorgTooDeepException(RejectReason reason, String message) {
        super(reason, message);
    }

    public ReorgTooDeepException(RejectReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
