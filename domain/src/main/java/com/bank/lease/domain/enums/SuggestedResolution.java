package com.bank.lease.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SuggestedResolution {
    USE_LATER_EFFECTIVE_DATE("use_later_effective_date"),
    USE_HIGHER_CONFIDENCE("use_higher_confidence"),
    MANUAL_REVIEW("manual_review");

    private final String code;

    SuggestedResolution(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
