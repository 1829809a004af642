package com.flagship.store_credit.ledger;

/**
 * The transaction store was unavailable, timed out, or refused a write.
 *
 * Mutations that fail with this exception have not been applied and are
 * safe to retry.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
