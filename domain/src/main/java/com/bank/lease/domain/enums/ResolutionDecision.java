package com.bank.lease.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Reviewer decision applied to an open conflict
 */
public enum ResolutionDecision {
    RESOLVE,
    IGNORE;

    @JsonCreator
    public static ResolutionDecision fromValue(String value) {
        for (ResolutionDecision decision : values()) {
            if (decision.name().equalsIgnoreCase(value)) {
                return decision;
            }
        }
        throw new IllegalArgumentException("Unknown resolution decision: " + value);
    }
}
