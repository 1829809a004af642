package com.flagship.store_credit.code;

import com.flagship.store_credit.ledger.LedgerOutcome;
import lombok.Value;

@Value
public class CodeRedemptionResult {

    public enum Status {
        REDEEMED,
        INVALID_CODE,
        EXPIRED,
        ALREADY_USED,
        INSUFFICIENT_BALANCE
    }

    Status status;
    RedemptionCode code;
    /** Ledger result, present only when the ledger was called. */
    LedgerOutcome ledgerOutcome;

    public static CodeRedemptionResult of(Status status, RedemptionCode code) {
        return new CodeRedemptionResult(status, code, null);
    }

    public static CodeRedemptionResult of(Status status, RedemptionCode code, LedgerOutcome ledgerOutcome) {
        return new CodeRedemptionResult(status, code, ledgerOutcome);
    }

    public boolean isRedeemed() {
        return status == Status.REDEEMED;
    }
}
