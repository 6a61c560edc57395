package com.bank.lease.application.rules;

import com.bank.lease.application.LeaseFixtures;
import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.ConflictSeverity;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.FieldChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PropertyConsistencyRuleTest {

    private PropertyConsistencyRule rule;

    @BeforeEach
    void setUp() {
        rule = new PropertyConsistencyRule(LeaseFixtures.properties());
    }

    @Test
    void testAbbreviatedAddressMatches() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .propertyReference(LeaseFixtures.address("100 Main St."))
                .build();

        assertTrue(rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment)).isEmpty());
    }

    @Test
    void testDifferentPremisesReferenced() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .propertyReference(LeaseFixtures.address("200 Oak Avenue"))
                .build();

        List<ConflictRecord> findings = rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment));

        assertEquals(1, findings.size());
        ConflictRecord finding = findings.get(0);
        assertEquals(ConflictCategory.PROPERTY_CONFLICT, finding.getCategory());
        assertEquals(ConflictSeverity.HIGH, finding.getSeverity());
        assertEquals("property_address", finding.getFieldName());
        assertEquals("200 Oak Avenue, Springfield, IL, 62701, USA", finding.getConflictingValue());
    }

    @Test
    void testRestatedFootageWithinTolerance() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .change("rentable_square_feet", FieldChange.restatement("5,000.5"))
                .build();

        assertTrue(rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment)).isEmpty());
    }

    @Test
    void testRestatedFootageOutsideTolerance() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .change("rentable_square_feet", FieldChange.restatement(5200))
                .build();

        List<ConflictRecord> findings = rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment));

        assertEquals(1, findings.size());
        assertEquals("5000.00", findings.get(0).getSourceValue());
        assertEquals("5200.00", findings.get(0).getConflictingValue());
    }

    @Test
    void testUsableAreaExceedingRentable() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), LeaseFixtures.LEASE_ID)
                .change("usable_square_feet", FieldChange.change(null, 5200))
                .build();

        List<ConflictRecord> findings = rule.evaluate(LeaseFixtures.group(LeaseFixtures.baseLease(), amendment));

        assertEquals(1, findings.size());
        ConflictRecord finding = findings.get(0);
        assertEquals("usable_square_feet", finding.getFieldName());
        assertEquals(LeaseFixtures.LEASE_ID, finding.getSourceDocumentId());
        assertEquals("AMD-1", finding.getConflictingDocumentId());
    }
}
