package com.bank.lease.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.Map;
import java.util.Set;

/**
 * Amendment-like document modifying a base lease from its effective date.
 * Immutable; the chain position is derived from (effectiveDate, ingestionSequence).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Amendment {
    String amendmentId;
    String targetLeaseId;
    String supersedesDocumentId;
    String amendmentNumber;
    LocalDate effectiveDate;
    LocalDate termsEndDate;

    // Parties and premises as named on the amendment itself
    String tenantName;
    String landlordName;
    PropertyAddress propertyReference;

    @Singular
    Map<String, FieldChange> changes;

    double confidenceScore;
    @Singular
    Set<String> missingFields;
    boolean extractionFailed;
    Long ingestionSequence;

    public static Amendment failedExtraction(String amendmentId, String targetLeaseId, Set<String> missingFields) {
        return Amendment.builder()
                .amendmentId(amendmentId)
                .targetLeaseId(targetLeaseId)
                .confidenceScore(0.0)
                .missingFields(missingFields)
                .extractionFailed(true)
                .build();
    }
}
