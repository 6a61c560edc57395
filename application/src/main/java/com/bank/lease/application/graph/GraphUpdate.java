package com.bank.lease.application.graph;

import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one graph mutation: the published snapshot and the conflicts it newly opened
 */
@Value
public class GraphUpdate {
    LeaseGroupSnapshot snapshot;
    List<ConflictRecord> newConflicts;
}
