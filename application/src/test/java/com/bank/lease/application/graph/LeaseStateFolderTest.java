package com.bank.lease.application.graph;

import com.bank.lease.application.LeaseFixtures;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.FieldChange;
import com.bank.lease.domain.model.Lease;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LeaseStateFolderTest {

    private LeaseStateFolder folder;
    private Lease base;

    @BeforeEach
    void setUp() {
        folder = new LeaseStateFolder();
        base = LeaseFixtures.baseLease();
    }

    @Test
    void testAmendmentsAreAppliedInEffectiveOrder() {
        Amendment later = LeaseFixtures.amendment("AMD-2", LocalDate.of(2025, 1, 1), "AMD-1")
                .ingestionSequence(1L)
                .change("base_rent_monthly", FieldChange.change(null, new BigDecimal("11000")))
                .build();
        Amendment earlier = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), "LEASE-001")
                .ingestionSequence(2L)
                .change("base_rent_monthly", FieldChange.change(null, new BigDecimal("10500")))
                .build();

        LeaseStateFolder.FoldResult result = folder.fold(base, List.of(later, earlier));

        assertEquals(0, new BigDecimal("11000").compareTo(result.getCurrentState().getBaseRentMonthly()));
        assertEquals("AMD-2", result.getProvenance().get("base_rent_monthly"));
        assertEquals("AMD-1", result.getAmendments().get(0).getAmendmentId());
        assertEquals("LEASE-001", result.getChain().get(0).getPreviousDocumentId());
        assertEquals("AMD-1", result.getChain().get(1).getPreviousDocumentId());
    }

    @Test
    void testSameEffectiveDateOrderedByIngestionSequence() {
        LocalDate date = LocalDate.of(2024, 6, 1);
        Amendment first = LeaseFixtures.amendment("AMD-Z", date, "LEASE-001")
                .ingestionSequence(1L)
                .change("tenant", FieldChange.change(null, "First Tenant Inc"))
                .build();
        Amendment second = LeaseFixtures.amendment("AMD-A", date, "AMD-Z")
                .ingestionSequence(2L)
                .change("tenant", FieldChange.change(null, "Second Tenant Inc"))
                .build();

        LeaseStateFolder.FoldResult result = folder.fold(base, List.of(second, first));

        assertEquals("Second Tenant Inc", result.getCurrentState().getTenant());
        assertEquals("AMD-Z", result.getAmendments().get(0).getAmendmentId(), "not ordered by id");
    }

    @Test
    void testUndatedAmendmentsSortLast() {
        Amendment undated = LeaseFixtures.amendment("AMD-U", null, null).ingestionSequence(1L).build();
        Amendment dated = LeaseFixtures.amendment("AMD-D", LocalDate.of(2030, 1, 1), null).ingestionSequence(2L).build();

        List<Amendment> sorted = folder.sort(List.of(undated, dated));

        assertEquals("AMD-D", sorted.get(0).getAmendmentId());
        assertEquals("AMD-U", sorted.get(1).getAmendmentId());
    }

    @Test
    void testRestatementsAreNotMerged() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), "LEASE-001")
                .ingestionSequence(1L)
                .change("base_rent_monthly", FieldChange.restatement(new BigDecimal("10500")))
                .build();

        LeaseStateFolder.FoldResult result = folder.fold(base, List.of(amendment));

        assertEquals(0, new BigDecimal("10000").compareTo(result.getCurrentState().getBaseRentMonthly()));
        assertEquals("LEASE-001", result.getProvenance().get("base_rent_monthly"));
    }

    @Test
    void testFailedExtractionIsKeptButNotFolded() {
        Amendment failed = Amendment.failedExtraction("AMD-F", "LEASE-001", Set.of("effective_date"))
                .toBuilder().ingestionSequence(1L).build();

        LeaseStateFolder.FoldResult result = folder.fold(base, List.of(failed));

        assertEquals(1, result.getChain().size());
        assertFalse(result.getChain().get(0).isApplied());
        assertEquals(base.getTenant(), result.getCurrentState().getTenant());
    }

    @Test
    void testEarlyEffectiveDateMarksSuspectButStillApplies() {
        Amendment early = LeaseFixtures.amendment("AMD-1", LocalDate.of(2023, 12, 1), "LEASE-001")
                .ingestionSequence(1L)
                .change("security_deposit", FieldChange.change(null, "$25,000.00"))
                .build();

        LeaseStateFolder.FoldResult result = folder.fold(base, List.of(early));

        assertTrue(result.getSuspectAmendmentIds().contains("AMD-1"));
        assertEquals(0, new BigDecimal("25000").compareTo(result.getCurrentState().getSecurityDeposit()));
    }

    @Test
    void testMalformedAndUnknownChangesAreSkipped() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), "LEASE-001")
                .ingestionSequence(1L)
                .change("expiration_date", FieldChange.change(null, "not a date"))
                .change("parking_spaces", FieldChange.change(null, 12))
                .change("term_months", FieldChange.change(null, 72))
                .build();

        LeaseStateFolder.FoldResult result = folder.fold(base, List.of(amendment));

        assertEquals(LeaseFixtures.EXPIRATION, result.getCurrentState().getExpirationDate());
        assertEquals(72, result.getCurrentState().getTermMonths());
    }

    @Test
    void testExtensionWrittenInWordsIsMerged() {
        Amendment extension = LeaseFixtures.amendment("AMD-1", LocalDate.of(2026, 1, 1), "LEASE-001")
                .ingestionSequence(1L)
                .change("expiration_date", FieldChange.change("December 31, 2028", "December 31, 2030"))
                .build();

        LeaseStateFolder.FoldResult result = folder.fold(base, List.of(extension));

        assertEquals(LocalDate.of(2030, 12, 31), result.getCurrentState().getExpirationDate());
        assertEquals("AMD-1", result.getProvenance().get("expiration_date"));
    }

    @Test
    void testBaseRecordIsNotMutated() {
        Amendment amendment = LeaseFixtures.amendment("AMD-1", LocalDate.of(2024, 6, 1), "LEASE-001")
                .ingestionSequence(1L)
                .change("tenant", FieldChange.change("Acme Corp", "Beta LLC"))
                .build();

        folder.fold(base, List.of(amendment));

        assertEquals("Acme Corp", base.getTenant());
    }
}
