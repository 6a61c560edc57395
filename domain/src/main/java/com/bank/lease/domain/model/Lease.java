package com.bank.lease.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured lease record.
 * As ingested it is the base lease; inside a lease group it is the merged state
 * obtained by folding every amendment onto the base record. Only the version graph
 * mutates a lease after ingestion, and it always works on a copy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Lease {
    private String documentId;
    private String leaseType; // gross, net, modified_gross, triple_net
    private LocalDate executionDate;

    private String tenant;
    private String landlord;
    private PropertyAddress propertyAddress;
    private BigDecimal rentableSquareFeet;
    private BigDecimal usableSquareFeet;

    private LocalDate commencementDate;
    private LocalDate expirationDate;
    private Integer termMonths;

    private BigDecimal baseRentMonthly;
    private BigDecimal baseRentAnnual;
    private BigDecimal rentPerSquareFoot;
    private List<RentEscalation> escalationSchedule;
    private BigDecimal securityDeposit;
    private CamTerms camTerms;

    private double confidenceScore;
    private Set<String> missingFields;
    private boolean extractionFailed;
    private boolean needsReview;

    /**
     * Independent copy. Address, CAM terms and escalation steps are immutable values;
     * the collections are copied.
     */
    public Lease copy() {
        return toBuilder()
                .escalationSchedule(escalationSchedule == null ? null : new ArrayList<>(escalationSchedule))
                .missingFields(missingFields == null ? null : new LinkedHashSet<>(missingFields))
                .build();
    }

    /**
     * Placeholder record for a document whose extraction failed
     */
    public static Lease failedExtraction(String documentId, Set<String> missingFields) {
        return Lease.builder()
                .documentId(documentId)
                .confidenceScore(0.0)
                .missingFields(missingFields)
                .extractionFailed(true)
                .build();
    }
}
