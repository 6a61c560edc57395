package com.bank.lease.api.controller;

import com.bank.lease.api.dto.ResolutionRequest;
import com.bank.lease.application.service.IngestionCoordinator;
import com.bank.lease.domain.model.ConflictRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for reviewer decisions on conflicts
 */
@RestController
@RequestMapping("/api/conflicts")
public class ConflictController {

    private static final Logger log = LoggerFactory.getLogger(ConflictController.class);

    private final IngestionCoordinator ingestionCoordinator;

    public ConflictController(IngestionCoordinator ingestionCoordinator) {
        this.ingestionCoordinator = ingestionCoordinator;
    }

    @GetMapping("/{conflictId}")
    public ResponseEntity<ConflictRecord> get(@PathVariable String conflictId) {
        return ResponseEntity.ok(ingestionCoordinator.getConflict(conflictId));
    }

    @PostMapping("/{conflictId}/resolution")
    public ResponseEntity<ConflictRecord> resolve(@PathVariable String conflictId,
                                                  @RequestBody ResolutionRequest request) {
        if (request.getDecision() == null) {
            throw new IllegalArgumentException("decision is required");
        }
        log.info("Applying {} to conflict {}", request.getDecision(), conflictId);
        return ResponseEntity.ok(ingestionCoordinator.resolve(conflictId, request.getDecision(), request.getNote()));
    }
}
