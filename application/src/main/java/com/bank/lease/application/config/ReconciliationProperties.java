package com.bank.lease.application.config;

import com.bank.lease.domain.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scoring field sets and comparison tolerances, bound from lease.reconciliation.*
 */
@Data
@ConfigurationProperties(prefix = "lease.reconciliation")
public class ReconciliationProperties {

    private List<String> leaseCriticalFields = new ArrayList<>(List.of(
            "tenant", "landlord", "property_address", "commencement_date",
            "expiration_date", "base_rent_monthly", "rentable_square_feet"));

    private List<String> leaseOptionalFields = new ArrayList<>(List.of(
            "security_deposit", "cam_terms", "escalation_schedule", "usable_square_feet"));

    private List<String> amendmentCriticalFields = new ArrayList<>(List.of(
            "target_lease_id", "effective_date", "changes"));

    private List<String> amendmentOptionalFields = new ArrayList<>(List.of(
            "amendment_number", "supersedes_document_id", "tenant_name", "landlord_name"));

    /** Below this a later-dated document is not trusted to win automatically */
    private double autoResolveConfidenceThreshold = 0.7;

    private BigDecimal squareFootageTolerance = new BigDecimal("1.0");

    /** Relative tolerance for derived amounts, 0.01 = 1% */
    private BigDecimal calculationTolerancePercent = new BigDecimal("0.01");

    private int termMonthsTolerance = 1;

    private Duration idempotencyTtl = Duration.ofHours(24);

    @PostConstruct
    public void validate() {
        if (leaseCriticalFields == null || leaseCriticalFields.isEmpty()) {
            throw new ConfigurationException("lease.reconciliation.lease-critical-fields must not be empty");
        }
        if (amendmentCriticalFields == null || amendmentCriticalFields.isEmpty()) {
            throw new ConfigurationException("lease.reconciliation.amendment-critical-fields must not be empty");
        }
        if (autoResolveConfidenceThreshold < 0.0 || autoResolveConfidenceThreshold > 1.0) {
            throw new ConfigurationException("lease.reconciliation.auto-resolve-confidence-threshold must be within [0, 1]");
        }
        if (squareFootageTolerance == null || squareFootageTolerance.signum() < 0
                || calculationTolerancePercent == null || calculationTolerancePercent.signum() < 0
                || termMonthsTolerance < 0) {
            throw new ConfigurationException("lease.reconciliation tolerances must be non-negative");
        }
    }
}
