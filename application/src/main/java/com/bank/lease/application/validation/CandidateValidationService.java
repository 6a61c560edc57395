package com.bank.lease.application.validation;

import com.bank.lease.domain.model.Document;
import com.bank.lease.domain.model.ExtractionCandidate;
import com.bank.lease.domain.model.IngestionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates ingestion envelopes before they reach the version graph.
 * Missing or failed extraction content is not an error; it is ingested as a zero-confidence record.
 */
@Service
public class CandidateValidationService {

    private static final Logger log = LoggerFactory.getLogger(CandidateValidationService.class);

    /**
     * @return Empty list if valid, list of error messages if invalid
     */
    public List<String> validate(IngestionRequest request) {
        List<String> errors = new ArrayList<>();
        if (request == null) {
            errors.add("Ingestion request is required");
            return errors;
        }

        Document document = request.getDocument();
        if (document == null) {
            errors.add("Document is required");
            return errors;
        }
        if (isBlank(document.getDocumentId())) {
            errors.add("Document ID is required");
        }
        if (isBlank(document.getContentHash())) {
            errors.add("Content hash is required");
        }
        if (document.getClassificationConfidence() < 0.0 || document.getClassificationConfidence() > 1.0) {
            errors.add("Classification confidence must be between 0 and 1");
        }
        if (request.getClassification() != null) {
            double confidence = request.getClassification().getConfidence();
            if (confidence < 0.0 || confidence > 1.0) {
                errors.add("Classifier confidence must be between 0 and 1");
            }
        }

        ExtractionCandidate candidate = request.getCandidate();
        if (candidate != null && !candidate.isFailed() && !isBlank(document.getDocumentId())) {
            if (candidate.getLease() != null && candidate.getLease().getDocumentId() != null
                    && !candidate.getLease().getDocumentId().equals(document.getDocumentId())) {
                errors.add(String.format("Lease document ID %s does not match document %s",
                        candidate.getLease().getDocumentId(), document.getDocumentId()));
            }
            if (candidate.getAmendment() != null && candidate.getAmendment().getAmendmentId() != null
                    && !candidate.getAmendment().getAmendmentId().equals(document.getDocumentId())) {
                errors.add(String.format("Amendment ID %s does not match document %s",
                        candidate.getAmendment().getAmendmentId(), document.getDocumentId()));
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Validation failed for document {}: {}", document.getDocumentId(), errors);
        }
        return errors;
    }

    public boolean isValid(IngestionRequest request) {
        return validate(request).isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
