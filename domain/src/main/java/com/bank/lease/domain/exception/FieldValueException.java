package com.bank.lease.domain.exception;

import lombok.Getter;

/**
 * A date or number inside a record could not be read as its declared type
 */
@Getter
public class FieldValueException extends LeaseReconciliationException {

    private final String fieldName;

    public FieldValueException(String fieldName, Object value, Throwable cause) {
        super(String.format("Malformed value for %s: %s", fieldName, value), cause);
        this.fieldName = fieldName;
    }
}
