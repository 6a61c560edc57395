package com.bank.lease.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared type of an ingested lease document
 */
public enum DocumentType {
    BASE_LEASE("base_lease"),
    AMENDMENT("amendment"),
    SUBLEASE("sublease"),
    ASSIGNMENT("assignment"),
    ESTOPPEL("estoppel"),
    SNDA("snda"),
    OTHER("other");

    private final String code;

    DocumentType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Documents that modify an existing lease and are routed into its amendment chain
     */
    public boolean isAmendmentLike() {
        return switch (this) {
            case AMENDMENT, SUBLEASE, ASSIGNMENT, ESTOPPEL, SNDA -> true;
            case BASE_LEASE, OTHER -> false;
        };
    }

    @JsonCreator
    public static DocumentType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (DocumentType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        return OTHER;
    }
}
