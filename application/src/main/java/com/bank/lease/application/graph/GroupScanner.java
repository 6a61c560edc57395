package com.bank.lease.application.graph;

import com.bank.lease.domain.model.LeaseGroupSnapshot;

/**
 * Re-derives the conflict set of a lease group after a mutation.
 * The draft carries the group's previous conflicts; the returned snapshot carries the reconciled ones.
 */
public interface GroupScanner {

    LeaseGroupSnapshot rescan(LeaseGroupSnapshot draft);
}
