package com.bank.lease.application.rules;

import com.bank.lease.application.LeaseFixtures;
import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.ConflictSeverity;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.FieldChange;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RentConsistencyRuleTest {

    private final RentConsistencyRule rule = new RentConsistencyRule();

    @Test
    void testRestatedRentDifferingFromBaseIsCritical() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .change("base_rent_monthly", FieldChange.restatement(new BigDecimal("10500")))
                .build();

        List<ConflictRecord> findings = rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment));

        assertEquals(1, findings.size());
        ConflictRecord finding = findings.get(0);
        assertEquals(ConflictCategory.RENT_CONFLICT, finding.getCategory());
        assertEquals(ConflictSeverity.CRITICAL, finding.getSeverity());
        assertEquals("base_rent_monthly", finding.getFieldName());
        assertEquals(LeaseFixtures.LEASE_ID, finding.getSourceDocumentId());
        assertEquals("10000.00", finding.getSourceValue());
        assertEquals("AMD-1", finding.getConflictingDocumentId());
        assertEquals("10500.00", finding.getConflictingValue());
    }

    @Test
    void testRestatementEqualToTheCentIsNotAConflict() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .change("base_rent_monthly", FieldChange.restatement("$10,000.004"))
                .build();

        assertTrue(rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment)).isEmpty());
    }

    @Test
    void testOneCentDifferenceIsAConflict() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .change("base_rent_monthly", FieldChange.restatement("10000.01"))
                .build();

        assertEquals(1, rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment)).size());
    }

    @Test
    void testRestatementComparedWithRentInForceAtThatPoint() {
        Amendment first = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .change("base_rent_monthly", FieldChange.change("10000", "10500"))
                .build();
        Amendment second = LeaseFixtures.amendment("AMD-2", LocalDate.of(2025, 6, 1), "AMD-1")
                .change("base_rent_monthly", FieldChange.change("10500", "11000"))
                .build();

        assertTrue(rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), first, second)).isEmpty());
    }

    @Test
    void testStaleRestatementNamesTheAmendmentThatSetTheRent() {
        Amendment first = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .change("base_rent_monthly", FieldChange.change(null, "10500"))
                .build();
        Amendment second = LeaseFixtures.amendment("AMD-2", LocalDate.of(2025, 6, 1), "AMD-1")
                .change("base_rent_monthly", FieldChange.change("10000", "11000"))
                .build();

        List<ConflictRecord> findings = rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), first, second));

        assertEquals(1, findings.size());
        assertEquals("AMD-1", findings.get(0).getSourceDocumentId());
        assertEquals("10500.00", findings.get(0).getSourceValue());
        assertEquals("AMD-2", findings.get(0).getConflictingDocumentId());
    }

    @Test
    void testUnparseableRestatementIsSkipped() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .change("base_rent_monthly", FieldChange.restatement("ten thousand"))
                .build();

        assertTrue(rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment)).isEmpty());
    }
}
