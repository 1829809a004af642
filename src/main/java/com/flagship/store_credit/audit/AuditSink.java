package com.flagship.store_credit.audit;

/**
 * Receives a record of every committed wallet mutation.
 *
 * Implementations may throw; callers treat a failure as audit loss and never
 * roll back the ledger because of it.
 */
public interface AuditSink {

    void record(WalletAuditEvent event);
}
