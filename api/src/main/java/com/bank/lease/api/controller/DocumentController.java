package com.bank.lease.api.controller;

import com.bank.lease.api.dto.IngestionResponse;
import com.bank.lease.application.service.IngestionCoordinator;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.Document;
import com.bank.lease.domain.model.IngestionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for document ingestion
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private static final Logger log = LoggerFactory.getLogger(DocumentController.class);

    private final IngestionCoordinator ingestionCoordinator;

    public DocumentController(IngestionCoordinator ingestionCoordinator) {
        this.ingestionCoordinator = ingestionCoordinator;
    }

    /**
     * Ingest a classified and extracted document
     */
    @PostMapping
    public ResponseEntity<IngestionResponse> ingest(@RequestBody IngestionRequest request) {
        String documentId = request.getDocument() != null ? request.getDocument().getDocumentId() : null;
        log.info("Received document {}", documentId);
        List<ConflictRecord> conflicts = ingestionCoordinator.ingest(request);
        return ResponseEntity.ok(IngestionResponse.builder()
                .documentId(documentId)
                .newConflictCount(conflicts.size())
                .newConflicts(conflicts)
                .build());
    }

    /**
     * Documents that could not be attached to any lease
     */
    @GetMapping("/unassigned")
    public ResponseEntity<List<Document>> unassigned() {
        return ResponseEntity.ok(ingestionCoordinator.unassignedDocuments());
    }
}
