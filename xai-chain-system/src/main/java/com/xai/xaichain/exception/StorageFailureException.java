package com.xai.xaichain.exception;

/**
 * 持久化读写失败，对进程是致命的；共识状态绝不能处于半写入状态
 */
public class StorageFailureException extends ChainException {

    private static final long serialVersionUID = 1L;

    public StorageFailureException(String message) {
        super(RejectReason.STORAGE_FAILURE, message);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(RejectReason.STORAGE_FAILURE, message, cause);
    }

    public StorageFailureException(RejectReason reason, String message) {
        super(reason, message);
    }
}
