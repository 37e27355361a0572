package com.slb.reward_ledger.common.exception;

public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // 账本错误类型
    private final LedgerErrorType errorType;

    public BizException(LedgerErrorType errorType) {
        super(errorType.getDefaultDetail());
        this.errorType = errorType;
    }

    public BizException(LedgerErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public BizException(LedgerErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public LedgerErrorType getErrorType() {
        return errorType;
    }

    public String getCode() {
        return errorType.getCode();
    }
}
