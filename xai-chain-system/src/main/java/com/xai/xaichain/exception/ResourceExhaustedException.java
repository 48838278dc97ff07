package com.xai.xaichain.exception;

/**
 * 资源耗尽（交易池、孤块池已满），拒绝最低优先级条目但不崩溃
 */
public class ResourceExhaustedException extends ChainException {

    private static final long serialVersionUID = 1L;

    public ResourceExhaustedException(RejectReason reason, String message) {
        super(reason, message);
    }

    public ResourceExhaustedException(RejectReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
