package com.bank.lease.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EscalationType {
    FIXED_PERCENTAGE("fixed_percentage"),
    FIXED_AMOUNT("fixed_amount"),
    CPI("cpi"),
    MARKET("market");

    private final String code;

    EscalationType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static EscalationType fromCode(String code) {
        for (EscalationType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown escalation type: " + code);
    }
}
