package com.bank.lease.application.graph;

import com.bank.lease.domain.exception.FieldValueException;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ChainLink;
import com.bank.lease.domain.model.FieldChange;
import com.bank.lease.domain.model.Lease;
import com.bank.lease.domain.model.LeaseField;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recomputes the merged state of a lease from scratch by replaying its amendments
 * in (effective date, ingestion sequence) order onto the base record.
 * Only authoritative changes are merged; restatements and failed extractions are left for comparison.
 */
@Component
public class LeaseStateFolder {

    private static final Logger log = LoggerFactory.getLogger(LeaseStateFolder.class);

    /**
     * Chain order. Undated amendments sort after all dated ones.
     */
    public static final Comparator<Amendment> CHAIN_ORDER = Comparator
            .comparing(Amendment::getEffectiveDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(Amendment::getIngestionSequence, Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    @Value
    public static class FoldResult {
        Lease currentState;
        List<Amendment> amendments;
        List<ChainLink> chain;
        Map<String, String> provenance;
        Set<String> suspectAmendmentIds;
    }

    public List<Amendment> sort(Collection<Amendment> amendments) {
        return amendments.stream().sorted(CHAIN_ORDER).collect(Collectors.toList());
    }

    public FoldResult fold(Lease base, Collection<Amendment> amendments) {
        List<Amendment> sorted = sort(amendments);
        String leaseId = base.getDocumentId();

        Lease state = base.copy();
        Map<String, String> provenance = new LinkedHashMap<>();
        for (LeaseField field : LeaseField.values()) {
            if (field.read(state) != null) {
                provenance.put(field.getFieldName(), leaseId);
            }
        }

        List<ChainLink> chain = new ArrayList<>(sorted.size());
        Set<String> suspects = new LinkedHashSet<>();
        String previousDocumentId = leaseId;

        LocalDate commencement = base.getCommencementDate();
        for (Amendment amendment : sorted) {
            Lease before = state.copy();
            Map<String, String> provenanceBefore = Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
            boolean applied = !amendment.isExtractionFailed();

            if (applied) {
                LocalDate effective = amendment.getEffectiveDate();
                if (effective != null && commencement != null && effective.isBefore(commencement)) {
                    log.warn("Amendment {} effective {} precedes lease {} commencement {}; applied as suspect",
                            amendment.getAmendmentId(), effective, leaseId, commencement);
                    suspects.add(amendment.getAmendmentId());
                }
                applyChanges(state, amendment, provenance);
            } else {
                log.debug("Amendment {} has no usable extraction; kept in history only", amendment.getAmendmentId());
            }

            chain.add(ChainLink.builder()
                    .amendment(amendment)
                    .stateBefore(before)
                    .stateAfter(state.copy())
                    .provenanceBefore(provenanceBefore)
                    .previousDocumentId(previousDocumentId)
                    .applied(applied)
                    .build());
            previousDocumentId = amendment.getAmendmentId();
        }

        return new FoldResult(state,
                Collections.unmodifiableList(sorted),
                Collections.unmodifiableList(chain),
                Collections.unmodifiableMap(provenance),
                Collections.unmodifiableSet(suspects));
    }

    private void applyChanges(Lease state, Amendment amendment, Map<String, String> provenance) {
        for (Map.Entry<String, FieldChange> entry : amendment.getChanges().entrySet()) {
            FieldChange change = entry.getValue();
            if (change == null || !change.isAuthoritative()) {
                continue;
            }
            Optional<LeaseField> field = LeaseField.fromFieldName(entry.getKey());
            if (field.isEmpty()) {
                log.warn("Amendment {} changes unknown field '{}'; ignored", amendment.getAmendmentId(), entry.getKey());
                continue;
            }
            try {
                field.get().apply(state, change.getNewValue());
                provenance.put(field.get().getFieldName(), amendment.getAmendmentId());
            } catch (FieldValueException e) {
                log.warn("Amendment {} not merged for {}: {}", amendment.getAmendmentId(), entry.getKey(), e.getMessage());
            }
        }
    }
}
