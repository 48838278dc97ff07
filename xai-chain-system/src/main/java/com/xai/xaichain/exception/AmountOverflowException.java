package com.xai.xaichain.exception;

/**
 * 金额累加溢出，宁可拒绝也不回绕
 */
public class AmountOverflowException extends ConsensusViolationException {

    private static final long serialVersionUID = 1L;

    public AmountOverflowException(String message, ArithmeticException cause) {
        super(RejectReason.AMOUNT_OVERFLOW, message, cause);
    }
}
