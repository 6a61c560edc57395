package com.bank.lease.application.scoring;

import com.bank.lease.application.config.ReconciliationProperties;
import com.bank.lease.domain.exception.ConfigurationException;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.Lease;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Deterministic completeness score for extracted records.
 *
 * confidence = populated critical / |critical| + min(0.2, 0.05 * populated optional), clamped to [0, 1].
 * Records are inspected through their JSON form so field names match the snake_case
 * names used in configuration and change-sets.
 */
@Component
public class ConfidenceScorer {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceScorer.class);

    private static final double OPTIONAL_BONUS_PER_FIELD = 0.05;
    private static final double OPTIONAL_BONUS_CAP = 0.2;

    private final ObjectMapper objectMapper;
    private final ReconciliationProperties properties;

    public ConfidenceScorer(ObjectMapper objectMapper, ReconciliationProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Value
    public static class ScoreResult {
        double confidence;
        Set<String> missing;
    }

    public ScoreResult score(Object record, Collection<String> criticalFields, Collection<String> optionalFields) {
        if (criticalFields == null || criticalFields.isEmpty()) {
            throw new ConfigurationException("Critical field set must not be empty");
        }
        JsonNode tree = record == null ? null : objectMapper.valueToTree(record);

        Set<String> missing = new LinkedHashSet<>();
        int populated = 0;
        for (String field : criticalFields) {
            if (isPresent(tree, field)) {
                populated++;
            } else {
                missing.add(field);
            }
        }
        long optionalPresent = optionalFields == null ? 0
                : optionalFields.stream().filter(field -> isPresent(tree, field)).count();

        double base = (double) populated / criticalFields.size();
        double bonus = Math.min(OPTIONAL_BONUS_CAP, OPTIONAL_BONUS_PER_FIELD * optionalPresent);
        double confidence = Math.max(0.0, Math.min(1.0, base + bonus));
        return new ScoreResult(confidence, Collections.unmodifiableSet(missing));
    }

    /**
     * Score a lease with the configured field sets, merging the extractor's own missing list
     */
    public Lease scoreLease(Lease lease, Collection<String> reportedMissing) {
        ScoreResult result = score(lease, properties.getLeaseCriticalFields(), properties.getLeaseOptionalFields());
        Set<String> missing = mergeMissing(lease, result, reportedMissing);
        log.debug("Scored lease {}: confidence={}, missing={}", lease.getDocumentId(), result.getConfidence(), missing);
        return lease.toBuilder()
                .confidenceScore(result.getConfidence())
                .missingFields(missing)
                .build();
    }

    public Amendment scoreAmendment(Amendment amendment, Collection<String> reportedMissing) {
        ScoreResult result = score(amendment, properties.getAmendmentCriticalFields(),
                properties.getAmendmentOptionalFields());
        Set<String> missing = mergeMissing(amendment, result, reportedMissing);
        log.debug("Scored amendment {}: confidence={}, missing={}",
                amendment.getAmendmentId(), result.getConfidence(), missing);
        return amendment.toBuilder()
                .confidenceScore(result.getConfidence())
                .clearMissingFields()
                .missingFields(missing)
                .build();
    }

    /**
     * Reported fields the record actually populates are dropped; computed gaps are always kept
     */
    private Set<String> mergeMissing(Object record, ScoreResult result, Collection<String> reportedMissing) {
        Set<String> missing = new LinkedHashSet<>(result.getMissing());
        if (reportedMissing != null && !reportedMissing.isEmpty()) {
            JsonNode tree = objectMapper.valueToTree(record);
            for (String field : reportedMissing) {
                if (!isPresent(tree, field)) {
                    missing.add(field);
                }
            }
        }
        return Collections.unmodifiableSet(missing);
    }

    private static boolean isPresent(JsonNode tree, String field) {
        if (tree == null) {
            return false;
        }
        JsonNode node = tree.get(field);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isBlank();
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }
}
