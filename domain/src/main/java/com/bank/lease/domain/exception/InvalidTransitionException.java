package com.bank.lease.domain.exception;

import com.bank.lease.domain.enums.ConflictStatus;
import lombok.Getter;

/**
 * Illegal conflict status change. The conflict is left untouched.
 */
@Getter
public class InvalidTransitionException extends LeaseReconciliationException {

    private final String conflictId;
    private final ConflictStatus currentStatus;

    public InvalidTransitionException(String conflictId, ConflictStatus currentStatus, String message) {
        super(message);
        this.conflictId = conflictId;
        this.currentStatus = currentStatus;
    }
}
