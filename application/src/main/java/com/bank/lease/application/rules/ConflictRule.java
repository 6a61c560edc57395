package com.bank.lease.application.rules;

import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.LeaseGroupSnapshot;

import java.util.List;

/**
 * One comparator run over a lease group after every mutation.
 * Returns raw findings; identity, status and suggestions are assigned by the caller.
 */
public interface ConflictRule {

    String name();

    List<ConflictRecord> evaluate(LeaseGroupSnapshot group);
}
