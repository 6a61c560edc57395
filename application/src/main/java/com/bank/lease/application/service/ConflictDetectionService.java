package com.bank.lease.application.service;

import com.bank.lease.application.graph.GroupScanner;
import com.bank.lease.application.resolution.ResolutionPolicy;
import com.bank.lease.application.rules.ConflictRuleEngine;
import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.ConflictSeverity;
import com.bank.lease.domain.enums.ConflictStatus;
import com.bank.lease.domain.enums.SuggestedResolution;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.ConflictSummary;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reconciles fresh rule findings with a group's previous conflicts.
 *
 * Findings are matched to earlier records by fingerprint:
 * - an open record keeps its id and takes the fresh evidence
 * - a resolved or ignored record is kept while its evidence is unchanged
 * - a resolved or ignored record whose evidence changed is retired and reopened as a new record
 * - open records no longer detected are dropped; closed ones are kept
 */
@Service
public class ConflictDetectionService implements GroupScanner {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetectionService.class);

    private final ConflictRuleEngine ruleEngine;
    private final ResolutionPolicy resolutionPolicy;
    private final MetricsService metricsService;

    public ConflictDetectionService(ConflictRuleEngine ruleEngine, ResolutionPolicy resolutionPolicy,
                                    MetricsService metricsService) {
        this.ruleEngine = ruleEngine;
        this.resolutionPolicy = resolutionPolicy;
        this.metricsService = metricsService;
    }

    @Override
    public LeaseGroupSnapshot rescan(LeaseGroupSnapshot draft) {
        Timer.Sample sample = metricsService.startRescan();
        try {
            Map<String, ConflictRecord> previous = new LinkedHashMap<>();
            for (ConflictRecord record : draft.getConflicts()) {
                previous.put(record.getFingerprint(), record);
            }

            Map<String, ConflictRecord> findings = new LinkedHashMap<>();
            for (ConflictRecord finding : ruleEngine.scan(draft)) {
                findings.putIfAbsent(finding.getFingerprint(), finding);
            }

            List<ConflictRecord> conflicts = new ArrayList<>();
            List<ConflictRecord> retired = new ArrayList<>(draft.getRetiredConflicts());
            Instant now = Instant.now();

            for (Map.Entry<String, ConflictRecord> entry : findings.entrySet()) {
                ConflictRecord finding = entry.getValue();
                ConflictRecord prior = previous.remove(entry.getKey());
                SuggestedResolution suggestion = resolutionPolicy.suggest(finding, draft);

                if (prior == null) {
                    conflicts.add(open(finding, suggestion, now, null));
                } else if (prior.getStatus() == ConflictStatus.OPEN) {
                    conflicts.add(prior.toBuilder()
                            .sourceValue(finding.getSourceValue())
                            .conflictingValue(finding.getConflictingValue())
                            .description(finding.getDescription())
                            .suggestedResolution(suggestion)
                            .build());
                } else if (prior.hasSameEvidence(finding)) {
                    conflicts.add(prior);
                } else {
                    log.info("Conflict {} was {} but its evidence changed; reopening",
                            prior.getConflictId(), prior.getStatus().getCode());
                    retired.add(prior);
                    conflicts.add(open(finding, suggestion, now, prior.getConflictId()));
                }
            }

            for (ConflictRecord stale : previous.values()) {
                if (stale.getStatus().isTerminal()) {
                    conflicts.add(stale);
                } else {
                    log.debug("Conflict {} no longer detected in lease {}; dropped", stale.getConflictId(), draft.getLeaseId());
                }
            }

            return draft.toBuilder()
                    .conflicts(Collections.unmodifiableList(conflicts))
                    .retiredConflicts(Collections.unmodifiableList(retired))
                    .build();
        } finally {
            metricsService.recordRescan(sample);
        }
    }

    public ConflictSummary summarize(LeaseGroupSnapshot group) {
        Map<ConflictSeverity, Long> bySeverity = new EnumMap<>(ConflictSeverity.class);
        Map<ConflictCategory, Long> byCategory = new EnumMap<>(ConflictCategory.class);
        long unresolved = 0;
        for (ConflictRecord conflict : group.getConflicts()) {
            bySeverity.merge(conflict.getSeverity(), 1L, Long::sum);
            byCategory.merge(conflict.getCategory(), 1L, Long::sum);
            if (conflict.getStatus() == ConflictStatus.OPEN) {
                unresolved++;
            }
        }
        return ConflictSummary.builder()
                .leaseId(group.getLeaseId())
                .total(group.getConflicts().size())
                .bySeverity(bySeverity)
                .byCategory(byCategory)
                .unresolved(unresolved)
                .build();
    }

    private ConflictRecord open(ConflictRecord finding, SuggestedResolution suggestion, Instant now, String reopenedFrom) {
        ConflictRecord record = finding.toBuilder()
                .conflictId(UUID.randomUUID().toString())
                .status(ConflictStatus.OPEN)
                .suggestedResolution(suggestion)
                .detectedAt(now)
                .reopenedFromId(reopenedFrom)
                .build();
        metricsService.recordConflictDetected(record.getCategory());
        log.info("Detected {} ({}) on {} in lease {}: {}", record.getCategory().getCode(), record.getSeverity(),
                record.getFieldName(), record.getLeaseId(), record.getDescription());
        return record;
    }
}
