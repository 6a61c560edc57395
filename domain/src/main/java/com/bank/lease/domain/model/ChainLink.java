package com.bank.lease.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Merged lease state immediately before and after one amendment of the sorted chain
 */
@Value
@Builder
public class ChainLink {
    Amendment amendment;
    Lease stateBefore;
    Lease stateAfter;
    Map<String, String> provenanceBefore;
    /** Previous document in the chain: the base lease for the first amendment */
    String previousDocumentId;
    boolean applied;

    /**
     * Document that set the given field in the state this amendment was applied to
     */
    public String sourceOf(String fieldName, String fallbackDocumentId) {
        return provenanceBefore.getOrDefault(fieldName, fallbackDocumentId);
    }
}
