package com.bank.lease.application.rules;

import com.bank.lease.application.LeaseFixtures;
import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.ConflictSeverity;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ConflictRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SupersessionRuleTest {

    private final SupersessionRule rule = new SupersessionRule();

    @Test
    void testCorrectChainHasNoFindings() {
        Amendment first = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID).build();
        Amendment second = LeaseFixtures.amendment("AMD-2", LocalDate.of(2025, 6, 1), "AMD-1").build();

        assertTrue(rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), second, first)).isEmpty());
    }

    @Test
    void testWrongReference() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), "AMD-9").build();

        List<ConflictRecord> findings = rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment));

        assertEquals(1, findings.size());
        ConflictRecord finding = findings.get(0);
        assertEquals(ConflictCategory.TERM_CONFLICT, finding.getCategory());
        assertEquals(ConflictSeverity.HIGH, finding.getSeverity());
        assertEquals(SupersessionRule.FIELD_NAME, finding.getFieldName());
        assertEquals(LeaseFixtures.LEASE_ID, finding.getSourceDocumentId());
        assertEquals(LeaseFixtures.LEASE_ID, finding.getSourceValue());
        assertEquals("AMD-1", finding.getConflictingDocumentId());
        assertEquals("AMD-9", finding.getConflictingValue());
    }

    @Test
    void testSecondAmendmentReferencingBaseLease() {
        Amendment first = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID).build();
        Amendment second = LeaseFixtures.amendment("AMD-2", LocalDate.of(2025, 6, 1), LeaseFixtures.LEASE_ID).build();

        List<ConflictRecord> findings = rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), first, second));

        assertEquals(1, findings.size());
        assertEquals("AMD-1", findings.get(0).getSourceDocumentId());
        assertEquals("AMD-2", findings.get(0).getConflictingDocumentId());
    }

    @Test
    void testMissingReferenceIsReported() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), null).build();

        List<ConflictRecord> findings = rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment));

        assertEquals(1, findings.size());
        assertNull(findings.get(0).getConflictingValue());
        assertTrue(findings.get(0).getDescription().contains("does not reference"));
    }
}
