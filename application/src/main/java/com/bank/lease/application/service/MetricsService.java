package com.bank.lease.application.service;

import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.DocumentType;
import com.bank.lease.domain.enums.ResolutionDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Service for recording reconciliation metrics
 */
@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter duplicateDocumentsCounter;
    private final Counter rejectedDocumentsCounter;
    private final Counter pendingAmendmentsCounter;
    private final Counter unassignedDocumentsCounter;

    private final Timer ingestionTimer;
    private final Timer rescanTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.duplicateDocumentsCounter = Counter.builder("documents.duplicate")
                .description("Documents skipped because their content hash was already ingested")
                .register(meterRegistry);

        this.rejectedDocumentsCounter = Counter.builder("documents.rejected")
                .description("Ingestion requests rejected by validation")
                .register(meterRegistry);

        this.pendingAmendmentsCounter = Counter.builder("amendments.pending")
                .description("Amendments held until their base lease arrives")
                .register(meterRegistry);

        this.unassignedDocumentsCounter = Counter.builder("documents.unassigned")
                .description("Documents that could not be attached to a lease group")
                .register(meterRegistry);

        this.ingestionTimer = Timer.builder("documents.ingestion.time")
                .description("Document ingestion time")
                .register(meterRegistry);

        this.rescanTimer = Timer.builder("lease.group.rescan.time")
                .description("Conflict rescan time for one lease group")
                .register(meterRegistry);
    }

    public void recordDocumentIngested(DocumentType type) {
        meterRegistry.counter("documents.ingested", "type", type.getCode()).increment();
    }

    public void recordDuplicateDocument() {
        duplicateDocumentsCounter.increment();
    }

    public void recordRejectedDocument() {
        rejectedDocumentsCounter.increment();
    }

    public void recordPendingAmendment() {
        pendingAmendmentsCounter.increment();
    }

    public void recordUnassignedDocument() {
        unassignedDocumentsCounter.increment();
    }

    public void recordConflictDetected(ConflictCategory category) {
        meterRegistry.counter("conflicts.detected", "category", category.getCode()).increment();
    }

    public void recordRuleFailure(String ruleName) {
        meterRegistry.counter("rules.failed", "rule", ruleName).increment();
    }

    public void recordConflictTransition(ResolutionDecision decision) {
        meterRegistry.counter("conflicts.transitions", "decision", decision.name().toLowerCase()).increment();
    }

    public Timer.Sample startIngestion() {
        return Timer.start(meterRegistry);
    }

    public void recordIngestion(Timer.Sample sample) {
        sample.stop(ingestionTimer);
    }

    public Timer.Sample startRescan() {
        return Timer.start(meterRegistry);
    }

    public void recordRescan(Timer.Sample sample) {
        sample.stop(rescanTimer);
    }
}
