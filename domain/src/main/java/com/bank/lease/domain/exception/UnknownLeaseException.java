package com.bank.lease.domain.exception;

import lombok.Getter;

/**
 * Raised when an amendment or lookup references a lease that has not been ingested
 */
@Getter
public class UnknownLeaseException extends LeaseReconciliationException {

    private final String leaseId;

    public UnknownLeaseException(String leaseId) {
        super("Unknown lease: " + leaseId);
        this.leaseId = leaseId;
    }
}
