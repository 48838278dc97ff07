package com.xai.xaichain.validation;

import com.xai.xaichain.data.transaction.Outpoint;
import com.xai.xaichain.exception.ChainException;
import com.xai.xaichain.exception.ConsensusViolationException;
import com.xai.xaichain.exception.MissingOutpointException;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ResourceExhaustedException;
import com.xai.xaichain.exception.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 有状态校验的结果：有效（附手续费）、无效（附原因）、nonce 超前（以后可能有效）
 */
@Getter
@AllArgsConstructor
public class TxValidationResult {

    public enum Status {
        VALID,
        INVALID,
        FUTURE_NONCE
    }

    private final Status status;

    private final long fee;

    private final RejectReason reason;

    private final String message;

    // 原因为 MISSING_OUTPOINT 时指向缺失的输出
    private final Outpoint missingOutpoint;

    public static TxValidationResult valid(long fee) {
        return new TxValidationResult(Status.VALID, fee, null, null, null);
    }

    public static TxValidationResult invalid(RejectReason reason, String message) {
        return new TxValidationResult(Status.INVALID, 0, reason, message, null);
    }

    public static TxValidationResult missing(Outpoint outpoint) {
        return new TxValidationResult(Status.INVALID, 0, RejectReason.MISSING_OUTPOINT,
                "引用的输出不存在或已花费: " + outpoint, outpoint);
    }

    public static TxValidationResult futureNonce(long expected, long actual) {
        return new TxValidationResult(Status.FUTURE_NONCE, 0, null,
                "nonce超前，期望 " + expected + " 实际 " + actual, null);
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public boolean isFutureNonce() {
        return status == Status.FUTURE_NONCE;
    }

    /**
     * 无效结果转换为对应类别的异常
     */
    public ChainException toException() {
        if (reason == RejectReason.MISSING_OUTPOINT && missingOutpoint != null) {
            return new MissingOutpointException(missingOutpoint);
        }
        RejectReason r = reason != null ? reason : RejectReason.FUTURE_NONCE_IN_BLOCK;
        switch (r.getCategory()) {
            case VALIDATION:
                return new ValidationException(r, message);
            case RESOURCE:
                return new ResourceExhaustedException(r, message);
            default:
                return new ConsensusViolationException(r, message);
        }
    }

    @Override
    public String toString() {
        switch (status) {
            case VALID:
                return "VALID(fee=" + fee + ")";
            case FUTURE_NONCE:
                return "FUTURE_NONCE(" + message + ")";
            default:
                return "INVALID(" + reason + ": " + message + ")";
        }
    }
}
