package com.bank.lease.application.service;

import com.bank.lease.application.config.ReconciliationProperties;
import com.bank.lease.application.graph.GraphUpdate;
import com.bank.lease.application.graph.LeaseVersionGraph;
import com.bank.lease.application.resolution.ResolutionPolicy;
import com.bank.lease.application.scoring.ConfidenceScorer;
import com.bank.lease.application.validation.CandidateValidationService;
import com.bank.lease.domain.enums.ConflictStatus;
import com.bank.lease.domain.enums.DocumentType;
import com.bank.lease.domain.enums.ResolutionDecision;
import com.bank.lease.domain.exception.CandidateValidationException;
import com.bank.lease.domain.exception.UnknownLeaseException;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ClassificationResult;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.ConflictSummary;
import com.bank.lease.domain.model.Document;
import com.bank.lease.domain.model.ExtractionCandidate;
import com.bank.lease.domain.model.IngestionRequest;
import com.bank.lease.domain.model.Lease;
import com.bank.lease.domain.registry.DocumentRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Entry point for classified and extracted documents.
 *
 * Flow: validate -> deduplicate -> normalize classification -> score -> route into the
 * version graph, which rescans the affected lease group before publishing it.
 */
@Service
public class IngestionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);

    private final CandidateValidationService validationService;
    private final IdempotencyService idempotencyService;
    private final ConfidenceScorer confidenceScorer;
    private final LeaseVersionGraph versionGraph;
    private final ConflictDetectionService conflictDetectionService;
    private final ResolutionPolicy resolutionPolicy;
    private final DocumentRegistry documentRegistry;
    private final CorrelationIdService correlationIdService;
    private final MetricsService metricsService;
    private final ReconciliationProperties properties;

    public IngestionCoordinator(CandidateValidationService validationService,
                                IdempotencyService idempotencyService,
                                ConfidenceScorer confidenceScorer,
                                LeaseVersionGraph versionGraph,
                                ConflictDetectionService conflictDetectionService,
                                ResolutionPolicy resolutionPolicy,
                                DocumentRegistry documentRegistry,
                                CorrelationIdService correlationIdService,
                                MetricsService metricsService,
                                ReconciliationProperties properties) {
        this.validationService = validationService;
        this.idempotencyService = idempotencyService;
        this.confidenceScorer = confidenceScorer;
        this.versionGraph = versionGraph;
        this.conflictDetectionService = conflictDetectionService;
        this.resolutionPolicy = resolutionPolicy;
        this.documentRegistry = documentRegistry;
        this.correlationIdService = correlationIdService;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    /**
     * Ingest one document.
     * @return conflicts newly opened in the affected lease group; empty for duplicates
     * @throws CandidateValidationException if the request envelope is malformed
     * @throws UnknownLeaseException if an amendment targets a lease not yet ingested; the
     *         amendment is held and applied when that lease arrives
     */
    public List<ConflictRecord> ingest(IngestionRequest request) {
        boolean ownsCorrelationId = correlationIdService.getCurrentCorrelationId() == null;
        if (ownsCorrelationId) {
            correlationIdService.generateCorrelationId();
        }
        Timer.Sample sample = metricsService.startIngestion();
        try {
            List<String> errors = validationService.validate(request);
            if (!errors.isEmpty()) {
                metricsService.recordRejectedDocument();
                throw new CandidateValidationException(errors);
            }

            Document document = normalizeClassification(request.getDocument(), request.getClassification());
            correlationIdService.setDocumentContext(document.getDocumentId(), null);

            if (!idempotencyService.claim(document)) {
                log.info("Document {} (hash {}) already ingested; skipping", document.getDocumentId(),
                        document.getContentHash());
                metricsService.recordDuplicateDocument();
                return List.of();
            }

            try {
                documentRegistry.save(document);
                List<ConflictRecord> opened = route(document, request);
                idempotencyService.markAsProcessed(document);
                metricsService.recordDocumentIngested(document.getDeclaredType());
                return opened;
            } catch (UnknownLeaseException e) {
                // held by the graph until the lease arrives, so the content counts as ingested
                idempotencyService.markAsProcessed(document);
                metricsService.recordPendingAmendment();
                throw e;
            } catch (RuntimeException e) {
                idempotencyService.markAsFailed(document, e.getMessage());
                throw e;
            }
        } finally {
            metricsService.recordIngestion(sample);
            if (ownsCorrelationId) {
                correlationIdService.clear();
            } else {
                correlationIdService.clearDocumentContext();
            }
        }
    }

    public Lease currentState(String leaseId) {
        return versionGraph.currentState(leaseId);
    }

    public List<Amendment> history(String leaseId) {
        return versionGraph.history(leaseId);
    }

    public List<ConflictRecord> listConflicts(String leaseId, ConflictStatus status) {
        return versionGraph.listConflicts(leaseId, status);
    }

    public ConflictSummary summarize(String leaseId) {
        return conflictDetectionService.summarize(versionGraph.snapshot(leaseId));
    }

    public ConflictRecord getConflict(String conflictId) {
        return versionGraph.findConflict(conflictId);
    }

    /**
     * Apply a reviewer decision to a conflict. Repeating a decision is a no-op.
     */
    public ConflictRecord resolve(String conflictId, ResolutionDecision decision, String note) {
        ConflictRecord updated = versionGraph.updateConflict(conflictId,
                conflict -> resolutionPolicy.applyTransition(conflict, decision, note));
        metricsService.recordConflictTransition(decision);
        return updated;
    }

    public List<Amendment> pendingAmendments(String leaseId) {
        return versionGraph.pendingAmendments(leaseId);
    }

    public List<Document> unassignedDocuments() {
        return documentRegistry.findUnassigned();
    }

    private List<ConflictRecord> route(Document document, IngestionRequest request) {
        DocumentType type = document.getDeclaredType();
        ExtractionCandidate candidate = request.getCandidate();

        if (type == DocumentType.BASE_LEASE) {
            correlationIdService.setDocumentContext(document.getDocumentId(), document.getDocumentId());
            Lease lease = prepareLease(document, candidate);
            GraphUpdate update = versionGraph.addLease(lease);
            documentRegistry.clearUnassigned(document.getDocumentId());
            return update.getNewConflicts();
        }

        if (type.isAmendmentLike()) {
            String targetLeaseId = resolveTarget(request);
            if (targetLeaseId == null) {
                log.warn("{} document {} names no target lease; recorded as unassigned",
                        type.getCode(), document.getDocumentId());
                return unassigned(document);
            }
            correlationIdService.setDocumentContext(document.getDocumentId(), targetLeaseId);
            Amendment amendment = prepareAmendment(document, candidate, targetLeaseId);
            GraphUpdate update = versionGraph.addAmendment(amendment);
            return update.getNewConflicts();
        }

        log.info("Document {} classified as {}; recorded as unassigned", document.getDocumentId(), type.getCode());
        return unassigned(document);
    }

    private Lease prepareLease(Document document, ExtractionCandidate candidate) {
        if (extractionFailed(candidate) || candidate.getLease() == null) {
            log.warn("Extraction failed for lease {}: {}", document.getDocumentId(), failureReason(candidate));
            Lease failed = Lease.failedExtraction(document.getDocumentId(),
                    new LinkedHashSet<>(properties.getLeaseCriticalFields()));
            failed.setNeedsReview(true);
            return failed;
        }
        Lease lease = candidate.getLease().toBuilder()
                .documentId(document.getDocumentId())
                .extractionFailed(false)
                .needsReview(document.isNeedsReview())
                .build();
        return confidenceScorer.scoreLease(lease, candidate.getMissingFields());
    }

    private Amendment prepareAmendment(Document document, ExtractionCandidate candidate, String targetLeaseId) {
        if (extractionFailed(candidate) || candidate.getAmendment() == null) {
            log.warn("Extraction failed for amendment {}: {}", document.getDocumentId(), failureReason(candidate));
            return Amendment.failedExtraction(document.getDocumentId(), targetLeaseId,
                    new LinkedHashSet<>(properties.getAmendmentCriticalFields()));
        }
        Amendment amendment = candidate.getAmendment().toBuilder()
                .amendmentId(document.getDocumentId())
                .targetLeaseId(targetLeaseId)
                .extractionFailed(false)
                .ingestionSequence(null)
                .build();
        return confidenceScorer.scoreAmendment(amendment, candidate.getMissingFields());
    }

    private List<ConflictRecord> unassigned(Document document) {
        documentRegistry.markUnassigned(document.getDocumentId());
        metricsService.recordUnassignedDocument();
        return List.of();
    }

    private static String resolveTarget(IngestionRequest request) {
        if (request.getTargetLeaseId() != null && !request.getTargetLeaseId().isBlank()) {
            return request.getTargetLeaseId();
        }
        ExtractionCandidate candidate = request.getCandidate();
        if (candidate != null && candidate.getAmendment() != null) {
            String target = candidate.getAmendment().getTargetLeaseId();
            if (target != null && !target.isBlank()) {
                return target;
            }
        }
        return null;
    }

    /**
     * A failed or missing classification files the document as OTHER for review
     */
    private static Document normalizeClassification(Document document, ClassificationResult classification) {
        Document.DocumentBuilder builder = document.toBuilder();
        if (document.getIngestedAt() == null) {
            builder.ingestedAt(Instant.now());
        }
        if (classification != null && classification.isFailed()) {
            return builder.declaredType(DocumentType.OTHER).needsReview(true).build();
        }
        DocumentType type = document.getDeclaredType();
        if (type == null && classification != null) {
            type = classification.getDocumentType();
            builder.classificationConfidence(classification.getConfidence());
        }
        if (type == null) {
            return builder.declaredType(DocumentType.OTHER).needsReview(true).build();
        }
        boolean needsReview = document.isNeedsReview() || (classification != null && classification.isNeedsReview());
        return builder.declaredType(type).needsReview(needsReview).build();
    }

    private static boolean extractionFailed(ExtractionCandidate candidate) {
        return candidate == null || candidate.isFailed();
    }

    private static String failureReason(ExtractionCandidate candidate) {
        if (candidate == null) {
            return "no extraction result";
        }
        return candidate.getFailureReason() != null ? candidate.getFailureReason() : "no structured record";
    }
}
