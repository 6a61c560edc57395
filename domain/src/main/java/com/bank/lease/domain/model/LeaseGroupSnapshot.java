package com.bank.lease.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of one lease group published after every mutation.
 * Readers hold on to a snapshot without locking.
 */
@Value
@Builder(toBuilder = true)
public class LeaseGroupSnapshot {
    String leaseId;
    long version;
    Lease baseRecord;
    Lease currentState;
    List<Amendment> amendments;
    List<ChainLink> chain;
    Map<String, String> provenance; // field name -> document that last set it
    Set<String> suspectAmendmentIds;
    List<ConflictRecord> conflicts;
    List<ConflictRecord> retiredConflicts;

    /**
     * Effective date used to order claims from a document of this group.
     * The base lease counts from its commencement date.
     */
    public LocalDate effectiveDateOf(String documentId) {
        if (documentId == null) {
            return null;
        }
        if (documentId.equals(leaseId)) {
            return baseRecord.getCommencementDate();
        }
        return findAmendment(documentId).map(Amendment::getEffectiveDate).orElse(null);
    }

    public Double confidenceOf(String documentId) {
        if (documentId == null) {
            return null;
        }
        if (documentId.equals(leaseId)) {
            return baseRecord.getConfidenceScore();
        }
        return findAmendment(documentId).map(Amendment::getConfidenceScore).orElse(null);
    }

    public Optional<Amendment> findAmendment(String amendmentId) {
        return amendments.stream()
                .filter(a -> a.getAmendmentId().equals(amendmentId))
                .findFirst();
    }
}
