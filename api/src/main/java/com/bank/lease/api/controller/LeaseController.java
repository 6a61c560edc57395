package com.bank.lease.api.controller;

import com.bank.lease.application.service.IngestionCoordinator;
import com.bank.lease.domain.enums.ConflictStatus;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.ConflictSummary;
import com.bank.lease.domain.model.Lease;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for lease state and conflict queries
 */
@RestController
@RequestMapping("/api/leases")
public class LeaseController {

    private final IngestionCoordinator ingestionCoordinator;

    public LeaseController(IngestionCoordinator ingestionCoordinator) {
        this.ingestionCoordinator = ingestionCoordinator;
    }

    /**
     * Merged state of a lease after all known amendments
     */
    @GetMapping("/{leaseId}")
    public ResponseEntity<Lease> currentState(@PathVariable String leaseId) {
        return ResponseEntity.ok(ingestionCoordinator.currentState(leaseId));
    }

    @GetMapping("/{leaseId}/history")
    public ResponseEntity<List<Amendment>> history(@PathVariable String leaseId) {
        return ResponseEntity.ok(ingestionCoordinator.history(leaseId));
    }

    /**
     * Amendments received for this lease before it was ingested
     */
    @GetMapping("/{leaseId}/pending")
    public ResponseEntity<List<Amendment>> pending(@PathVariable String leaseId) {
        return ResponseEntity.ok(ingestionCoordinator.pendingAmendments(leaseId));
    }

    @GetMapping("/{leaseId}/conflicts")
    public ResponseEntity<List<ConflictRecord>> conflicts(@PathVariable String leaseId,
                                                          @RequestParam(required = false) String status) {
        ConflictStatus filter = status == null ? null : ConflictStatus.fromCode(status);
        return ResponseEntity.ok(ingestionCoordinator.listConflicts(leaseId, filter));
    }

    @GetMapping("/{leaseId}/conflicts/summary")
    public ResponseEntity<ConflictSummary> summary(@PathVariable String leaseId) {
        return ResponseEntity.ok(ingestionCoordinator.summarize(leaseId));
    }
}
