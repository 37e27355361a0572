package com.slb.reward_ledger.common.exception;

/**
 * Catalogue of ledger failure types. All of them are synchronous and non-retryable.
 */
public enum LedgerErrorType {
    INVALID_AMOUNT("LEDGER_INVALID_AMOUNT", "Amount must be greater than zero",
            "数量必须大于 0"),
    INSUFFICIENT_BALANCE("LEDGER_INSUFFICIENT_BALANCE", "Withdraw amount exceeds staked balance",
            "可提取的质押余额不足"),
    ZERO_RATE("LEDGER_ZERO_RATE", "Funding amount yields a zero reward rate",
            "奖励金额过小，无法产生有效的发放速率"),
    INSUFFICIENT_FUNDING("LEDGER_INSUFFICIENT_FUNDING", "Committed payout exceeds reward balance held",
            "奖励池余额不足以覆盖承诺发放量"),
    WINDOW_ACTIVE("LEDGER_WINDOW_ACTIVE", "Reward window is still active",
            "奖励发放周期尚未结束，暂不可修改"),
    NOT_AUTHORIZED("LEDGER_NOT_AUTHORIZED", "Caller is not the ledger administrator",
            "无管理员权限"),
    TRANSFER_FAILED("LEDGER_TRANSFER_FAILED", "Asset transfer did not succeed",
            "资产划转失败"),
    REENTRANT_CALL("LEDGER_REENTRANT_CALL", "Ledger mutation attempted from inside an asset transfer",
            "操作进行中，请勿重复提交");

    private final String code;
    private final String defaultDetail;
    private final String displayMessage;

    LedgerErrorType(String code, String defaultDetail, String displayMessage) {
        this.code = code;
        this.defaultDetail = defaultDetail;
        this.displayMessage = displayMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultDetail() {
        return defaultDetail;
    }

    public String getDisplayMessage() {
        return displayMessage;
    }
}
