package com.bank.lease.application.resolution;

import com.bank.lease.application.config.ReconciliationProperties;
import com.bank.lease.application.statemachine.ConflictStateMachine;
import com.bank.lease.domain.enums.ResolutionDecision;
import com.bank.lease.domain.enums.SuggestedResolution;
import com.bank.lease.domain.exception.InvalidTransitionException;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Suggests how a conflict should be settled and applies reviewer decisions.
 *
 * The later-effective document wins when it is trustworthy enough; with no date to
 * separate the two, the more confident document wins; everything else goes to a reviewer.
 */
@Component
public class ResolutionPolicy {

    private static final Logger log = LoggerFactory.getLogger(ResolutionPolicy.class);

    private final ConflictStateMachine stateMachine;
    private final ReconciliationProperties properties;

    public ResolutionPolicy(ConflictStateMachine stateMachine, ReconciliationProperties properties) {
        this.stateMachine = stateMachine;
        this.properties = properties;
    }

    public SuggestedResolution suggest(ConflictRecord conflict, LeaseGroupSnapshot group) {
        String sourceId = conflict.getSourceDocumentId();
        String conflictingId = conflict.getConflictingDocumentId();
        if (sourceId == null || conflictingId == null || sourceId.equals(conflictingId)) {
            return SuggestedResolution.MANUAL_REVIEW;
        }
        double threshold = properties.getAutoResolveConfidenceThreshold();

        LocalDate sourceDate = group.effectiveDateOf(sourceId);
        LocalDate conflictingDate = group.effectiveDateOf(conflictingId);
        if (sourceDate != null && conflictingDate != null && !sourceDate.equals(conflictingDate)) {
            String later = conflictingDate.isAfter(sourceDate) ? conflictingId : sourceId;
            return confidenceOf(group, later) >= threshold
                    ? SuggestedResolution.USE_LATER_EFFECTIVE_DATE
                    : SuggestedResolution.MANUAL_REVIEW;
        }

        double sourceConfidence = confidenceOf(group, sourceId);
        double conflictingConfidence = confidenceOf(group, conflictingId);
        if (sourceConfidence == conflictingConfidence) {
            return SuggestedResolution.MANUAL_REVIEW;
        }
        return Math.max(sourceConfidence, conflictingConfidence) >= threshold
                ? SuggestedResolution.USE_HIGHER_CONFIDENCE
                : SuggestedResolution.MANUAL_REVIEW;
    }

    /**
     * Apply a reviewer decision.
     * @return the updated record, or the same instance when the decision was already applied
     * @throws InvalidTransitionException if the conflict is closed with the other decision
     */
    public ConflictRecord applyTransition(ConflictRecord conflict, ResolutionDecision decision, String note) {
        ConflictStateMachine.TransitionResult result =
                stateMachine.transition(conflict.getStatus(), stateMachine.fromDecision(decision));
        if (!result.isValid()) {
            log.warn("Rejected {} on conflict {}: {}", decision, conflict.getConflictId(), result.getErrorMessage());
            throw new InvalidTransitionException(conflict.getConflictId(), conflict.getStatus(), result.getErrorMessage());
        }
        if (!result.isStateChanged()) {
            log.debug("Conflict {} already {}", conflict.getConflictId(), conflict.getStatus());
            return conflict;
        }
        return conflict.toBuilder()
                .status(result.getNewState())
                .resolvedAt(Instant.now())
                .resolutionNote(note)
                .build();
    }

    private static double confidenceOf(LeaseGroupSnapshot group, String documentId) {
        Double confidence = group.confidenceOf(documentId);
        return confidence == null ? 0.0 : confidence;
    }
}
