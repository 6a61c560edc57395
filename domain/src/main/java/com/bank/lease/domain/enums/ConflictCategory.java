package com.bank.lease.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a detected contradiction. Each category carries a fixed severity.
 */
public enum ConflictCategory {
    TERM_CONFLICT("term_conflict", ConflictSeverity.HIGH),
    RENT_CONFLICT("rent_conflict", ConflictSeverity.CRITICAL),
    PARTY_CONFLICT("party_conflict", ConflictSeverity.MEDIUM),
    PROPERTY_CONFLICT("property_conflict", ConflictSeverity.HIGH),
    DATE_SEQUENCE("date_sequence", ConflictSeverity.HIGH),
    CALCULATION_ERROR("calculation_error", ConflictSeverity.MEDIUM);

    private final String code;
    private final ConflictSeverity severity;

    ConflictCategory(String code, ConflictSeverity severity) {
        this.code = code;
        this.severity = severity;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public ConflictSeverity getSeverity() {
        return severity;
    }

    @JsonCreator
    public static ConflictCategory fromCode(String code) {
        for (ConflictCategory category : values()) {
            if (category.code.equalsIgnoreCase(code) || category.name().equalsIgnoreCase(code)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown conflict category: " + code);
    }
}
