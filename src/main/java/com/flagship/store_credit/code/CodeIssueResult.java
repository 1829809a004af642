package com.flagship.store_credit.code;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CodeIssueResult {

    public enum Status {
        CREATED,
        INVALID_AMOUNT,
        INSUFFICIENT_BALANCE
    }

    Status status;
    RedemptionCode code;
    /** Spendable balance when the code was requested. */
    BigDecimal available;

    public static CodeIssueResult created(RedemptionCode code, BigDecimal available) {
        return new CodeIssueResult(Status.CREATED, code, available);
    }

    public static CodeIssueResult rejected(Status status, BigDecimal available) {
        return new CodeIssueResult(status, null, available);
    }
}
