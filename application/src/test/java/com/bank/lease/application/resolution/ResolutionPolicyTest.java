package com.bank.lease.application.resolution;

import com.bank.lease.application.LeaseFixtures;
import com.bank.lease.application.statemachine.ConflictStateMachine;
import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.ConflictStatus;
import com.bank.lease.domain.enums.ResolutionDecision;
import com.bank.lease.domain.enums.SuggestedResolution;
import com.bank.lease.domain.exception.InvalidTransitionException;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionPolicyTest {

    private static final LocalDate SAME_DAY = LocalDate.of(2025, 1, 1);

    private ResolutionPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new ResolutionPolicy(new ConflictStateMachine(), LeaseFixtures.properties());
    }

    @Test
    void testLaterConfidentDocumentWins() {
        LeaseGroupSnapshot group = LeaseFixtures.group(LeaseFixtures.baseLease(),
                LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID).build());

        assertEquals(SuggestedResolution.USE_LATER_EFFECTIVE_DATE,
                policy.suggest(conflict(LeaseFixtures.LEASE_ID, "AMD-1"), group));
    }

    @Test
    void testLaterDocumentBelowThresholdNeedsReview() {
        LeaseGroupSnapshot group = LeaseFixtures.group(LeaseFixtures.baseLease(),
                LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                        .confidenceScore(0.5).build());

        assertEquals(SuggestedResolution.MANUAL_REVIEW,
                policy.suggest(conflict(LeaseFixtures.LEASE_ID, "AMD-1"), group));
    }

    @Test
    void testSameDateHigherConfidenceWins() {
        LeaseGroupSnapshot group = sameDayGroup(0.9, 0.6);

        assertEquals(SuggestedResolution.USE_HIGHER_CONFIDENCE, policy.suggest(conflict("AMD-1", "AMD-2"), group));
    }

    @Test
    void testSameDateEqualConfidenceNeedsReview() {
        LeaseGroupSnapshot group = sameDayGroup(0.8, 0.8);

        assertEquals(SuggestedResolution.MANUAL_REVIEW, policy.suggest(conflict("AMD-1", "AMD-2"), group));
    }

    @Test
    void testSameDateBothBelowThresholdNeedsReview() {
        LeaseGroupSnapshot group = sameDayGroup(0.5, 0.6);

        assertEquals(SuggestedResolution.MANUAL_REVIEW, policy.suggest(conflict("AMD-1", "AMD-2"), group));
    }

    @Test
    void testSingleDocumentConflictNeedsReview() {
        LeaseGroupSnapshot group = LeaseFixtures.group(LeaseFixtures.baseLease());

        assertEquals(SuggestedResolution.MANUAL_REVIEW,
                policy.suggest(conflict(LeaseFixtures.LEASE_ID, LeaseFixtures.LEASE_ID), group));
    }

    @Test
    void testResolveOpenConflict() {
        ConflictRecord open = conflict(LeaseFixtures.LEASE_ID, "AMD-1");

        ConflictRecord resolved = policy.applyTransition(open, ResolutionDecision.RESOLVE, "confirmed with landlord");

        assertEquals(ConflictStatus.RESOLVED, resolved.getStatus());
        assertEquals("confirmed with landlord", resolved.getResolutionNote());
        assertNotNull(resolved.getResolvedAt());
        assertEquals(open.getConflictId(), resolved.getConflictId());
    }

    @Test
    void testRepeatedDecisionReturnsSameRecord() {
        ConflictRecord ignored = policy.applyTransition(conflict(LeaseFixtures.LEASE_ID, "AMD-1"),
                ResolutionDecision.IGNORE, null);

        assertSame(ignored, policy.applyTransition(ignored, ResolutionDecision.IGNORE, "again"));
    }

    @Test
    void testOppositeDecisionIsRejected() {
        ConflictRecord resolved = policy.applyTransition(conflict(LeaseFixtures.LEASE_ID, "AMD-1"),
                ResolutionDecision.RESOLVE, null);

        InvalidTransitionException exception = assertThrows(InvalidTransitionException.class,
                () -> policy.applyTransition(resolved, ResolutionDecision.IGNORE, null));
        assertEquals(ConflictStatus.RESOLVED, exception.getCurrentStatus());
    }

    private static LeaseGroupSnapshot sameDayGroup(double firstConfidence, double secondConfidence) {
        Amendment first = LeaseFixtures.amendment("AMD-1", SAME_DAY, LeaseFixtures.LEASE_ID)
                .confidenceScore(firstConfidence).build();
        Amendment second = LeaseFixtures.amendment("AMD-2", SAME_DAY, "AMD-1")
                .confidenceScore(secondConfidence).build();
        return LeaseFixtures.group(LeaseFixtures.baseLease(), first, second);
    }

    private static ConflictRecord conflict(String sourceDocumentId, String conflictingDocumentId) {
        return ConflictRecord.builder()
                .conflictId("C-1")
                .leaseId(LeaseFixtures.LEASE_ID)
                .category(ConflictCategory.RENT_CONFLICT)
                .severity(ConflictCategory.RENT_CONFLICT.getSeverity())
                .fieldName("base_rent_monthly")
                .sourceDocumentId(sourceDocumentId)
                .conflictingDocumentId(conflictingDocumentId)
                .status(ConflictStatus.OPEN)
                .build();
    }
}
