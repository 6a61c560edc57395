package com.bank.lease.domain.exception;

import lombok.Getter;

@Getter
public class ConflictNotFoundException extends LeaseReconciliationException {

    private final String conflictId;

    public ConflictNotFoundException(String conflictId) {
        super("Conflict not found: " + conflictId);
        this.conflictId = conflictId;
    }
}
