package com.bank.lease.application.scoring;

import com.bank.lease.application.LeaseFixtures;
import com.bank.lease.application.config.JacksonConfig;
import com.bank.lease.application.config.ReconciliationProperties;
import com.bank.lease.domain.exception.ConfigurationException;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.CamTerms;
import com.bank.lease.domain.model.FieldChange;
import com.bank.lease.domain.model.Lease;
import com.bank.lease.domain.model.RentEscalation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceScorerTest {

    private ConfidenceScorer scorer;
    private ReconciliationProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ReconciliationProperties();
        scorer = new ConfidenceScorer(new JacksonConfig().objectMapper(), properties);
    }

    @Test
    void testAllCriticalPopulatedWithoutOptionalScoresOne() {
        Lease lease = LeaseFixtures.baseLease().toBuilder()
                .securityDeposit(null)
                .usableSquareFeet(null)
                .build();

        ConfidenceScorer.ScoreResult result = scorer.score(lease,
                properties.getLeaseCriticalFields(), properties.getLeaseOptionalFields());

        assertEquals(1.0, result.getConfidence(), 1e-9);
        assertTrue(result.getMissing().isEmpty());
    }

    @Test
    void testEmptyRecordScoresZero() {
        ConfidenceScorer.ScoreResult result = scorer.score(new Lease(),
                properties.getLeaseCriticalFields(), properties.getLeaseOptionalFields());

        assertEquals(0.0, result.getConfidence(), 1e-9);
        assertEquals(properties.getLeaseCriticalFields().size(), result.getMissing().size());
    }

    @Test
    void testPartialRecordWithOptionalBonus() {
        Lease lease = Lease.builder()
                .tenant("Acme Corp")
                .landlord("  ")
                .baseRentMonthly(new BigDecimal("10000"))
                .securityDeposit(new BigDecimal("20000"))
                .usableSquareFeet(new BigDecimal("4500"))
                .build();

        ConfidenceScorer.ScoreResult result = scorer.score(lease,
                properties.getLeaseCriticalFields(), properties.getLeaseOptionalFields());

        // 2 of 7 critical, 2 optional fields -> 0.1 bonus
        assertEquals(2.0 / 7 + 0.1, result.getConfidence(), 1e-9);
        assertTrue(result.getMissing().contains("landlord"), "blank strings count as missing");
        assertFalse(result.getMissing().contains("tenant"));
    }

    @Test
    void testOptionalBonusIsCappedAndConfidenceClamped() {
        ConfidenceScorer.ScoreResult result = scorer.score(LeaseFixtures.baseLease().toBuilder()
                        .camTerms(CamTerms.builder().baseYear(2024).build())
                        .escalationSchedule(List.of(RentEscalation.builder()
                                .percentage(new BigDecimal("3")).build()))
                        .build(),
                properties.getLeaseCriticalFields(), properties.getLeaseOptionalFields());

        assertEquals(1.0, result.getConfidence(), 1e-9);
    }

    @Test
    void testEmptyCollectionsCountAsMissing() {
        Amendment amendment = Amendment.builder()
                .amendmentId("AMD-1")
                .targetLeaseId("LEASE-001")
                .effectiveDate(LocalDate.of(2024, 6, 1))
                .build();

        ConfidenceScorer.ScoreResult result = scorer.score(amendment,
                properties.getAmendmentCriticalFields(), properties.getAmendmentOptionalFields());

        assertEquals(2.0 / 3, result.getConfidence(), 1e-9);
        assertEquals(Set.of("changes"), result.getMissing());
    }

    @Test
    void testEmptyCriticalFieldsIsConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> scorer.score(LeaseFixtures.baseLease(), List.of(), properties.getLeaseOptionalFields()));
    }

    @Test
    void testReportedMissingFieldsAreVerified() {
        Lease lease = LeaseFixtures.baseLease().toBuilder().landlord(null).build();

        Lease scored = scorer.scoreLease(lease, List.of("tenant", "security_deposit_terms"));

        assertFalse(scored.getMissingFields().contains("tenant"), "populated field reported missing is dropped");
        assertTrue(scored.getMissingFields().contains("security_deposit_terms"));
        assertTrue(scored.getMissingFields().contains("landlord"));
        assertEquals(6.0 / 7 + 0.1, scored.getConfidenceScore(), 1e-9);
    }

    @Test
    void testOracleConfidenceIsIgnored() {
        Amendment amendment = Amendment.builder()
                .amendmentId("AMD-1")
                .targetLeaseId("LEASE-001")
                .effectiveDate(LocalDate.of(2024, 6, 1))
                .change("base_rent_monthly", FieldChange.change(null, new BigDecimal("11000")))
                .confidenceScore(0.1)
                .build();

        Amendment scored = scorer.scoreAmendment(amendment, null);

        assertEquals(1.0, scored.getConfidenceScore(), 1e-9);
        assertTrue(scored.getMissingFields().isEmpty());
    }
}
