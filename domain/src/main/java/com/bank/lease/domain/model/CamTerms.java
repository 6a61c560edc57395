package com.bank.lease.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Common area maintenance / operating expense terms
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CamTerms {
    Integer baseYear;
    BigDecimal baseAmount;
    BigDecimal tenantSharePercentage;
    BigDecimal capPercentage;
}
