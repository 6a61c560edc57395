package com.bank.lease.domain.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class CandidateValidationException extends LeaseReconciliationException {

    private final List<String> errors;

    public CandidateValidationException(List<String> errors) {
        super("Ingestion request rejected: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }
}
