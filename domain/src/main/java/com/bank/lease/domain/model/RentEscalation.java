package com.bank.lease.domain.model;

import com.bank.lease.domain.enums.EscalationType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One step of a rent escalation schedule
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RentEscalation {
    EscalationType escalationType;
    LocalDate effectiveDate;
    BigDecimal percentage; // 3.0 means 3%
    BigDecimal fixedAmount;
    String frequency; // annual, biennial, ...
}
