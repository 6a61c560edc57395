package com.bank.lease.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a conflict record
 */
public enum ConflictStatus {
    OPEN("open"),
    RESOLVED("resolved"),
    IGNORED("ignored");

    private final String code;

    ConflictStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != OPEN;
    }

    @JsonCreator
    public static ConflictStatus fromCode(String code) {
        for (ConflictStatus status : values()) {
            if (status.code.equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown conflict status: " + code);
    }
}
