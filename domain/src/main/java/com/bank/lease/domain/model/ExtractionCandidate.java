package com.bank.lease.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Structured record produced by the external extractor.
 * Exactly one of lease/amendment is expected; the self-reported confidence is never used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractionCandidate {
    private Lease lease;
    private Amendment amendment;
    private List<String> missingFields;
    private boolean failed;
    private String failureReason;
    private Double oracleConfidence;
}
