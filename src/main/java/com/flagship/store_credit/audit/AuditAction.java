package com.flagship.store_credit.audit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditAction {
    CREDIT_ISSUED("credit_issued"),
    CREDIT_REDEEMED("credit_redeemed"),
    CREDIT_EXPIRED("credit_expired"),
    TRANSACTION_REVERSED("transaction_reversed");

    private final String wireName;

    AuditAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
