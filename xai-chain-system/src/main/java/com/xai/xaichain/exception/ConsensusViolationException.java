package com.xai.xaichain.exception;

/**
 * 违反共识规则（工作量、时间戳、双花等），拒绝并可对来源节点扣分
 */
public class ConsensusViolationException extends ChainException {

    private static final long serialVersionUID = 1L;

    public ConsensusViolationException(RejectReason reason, String message) {
        super(reason, message);
    }

    public ConsensusViolationException(RejectReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
