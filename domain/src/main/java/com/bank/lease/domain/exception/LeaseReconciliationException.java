package com.bank.lease.domain.exception;

/**
 * Base exception for reconciliation errors
 */
public class LeaseReconciliationException extends RuntimeException {

    public LeaseReconciliationException(String message) {
        super(message);
    }

    public LeaseReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
