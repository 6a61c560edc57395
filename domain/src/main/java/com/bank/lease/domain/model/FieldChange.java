package com.bank.lease.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Change an amendment makes to one lease field.
 * A non-null new value is authoritative and is merged; a prior value alone is a
 * narrative restatement that is only ever compared.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FieldChange {
    Object priorValue;
    Object newValue;

    @JsonIgnore
    public boolean isAuthoritative() {
        return newValue != null;
    }

    @JsonIgnore
    public boolean hasPriorValue() {
        return priorValue != null;
    }

    public static FieldChange change(Object priorValue, Object newValue) {
        return new FieldChange(priorValue, newValue);
    }

    public static FieldChange restatement(Object priorValue) {
        return new FieldChange(priorValue, null);
    }
}
