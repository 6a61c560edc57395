package com.bank.lease.application.graph;

import com.bank.lease.domain.enums.ConflictStatus;
import com.bank.lease.domain.exception.ConflictNotFoundException;
import com.bank.lease.domain.exception.UnknownLeaseException;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.Lease;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Amendment-aware document memory, one isolated group per lease.
 *
 * Mutations of a group run under that group's lock: validate, merge, rescan, publish.
 * Readers never lock; they see the last published immutable snapshot.
 * Amendments for a lease that has not arrived yet are held and applied when it does.
 */
@Component
public class LeaseVersionGraph {

    private static final Logger log = LoggerFactory.getLogger(LeaseVersionGraph.class);

    private final LeaseStateFolder folder;
    private final GroupScanner scanner;

    private final Map<String, LeaseGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Amendment>> pendingByLease = new ConcurrentHashMap<>();
    private final Map<String, String> leaseIdByConflictId = new ConcurrentHashMap<>();
    private final AtomicLong ingestionSequence = new AtomicLong();

    public LeaseVersionGraph(LeaseStateFolder folder, GroupScanner scanner) {
        this.folder = folder;
        this.scanner = scanner;
    }

    private static final class LeaseGroup {
        private final String leaseId;
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by lock
        private Lease base;
        private Map<String, Amendment> amendments = new LinkedHashMap<>();
        private volatile LeaseGroupSnapshot snapshot;

        private LeaseGroup(String leaseId) {
            this.leaseId = leaseId;
        }

        private boolean isPublished() {
            return snapshot != null;
        }
    }

    /**
     * Create a group for an unseen lease, or replace the base record of an existing one,
     * then apply any amendments that were waiting for it
     */
    public GraphUpdate addLease(Lease lease) {
        String leaseId = lease.getDocumentId();
        LeaseGroup group = groups.computeIfAbsent(leaseId, LeaseGroup::new);
        group.lock.lock();
        try {
            LeaseGroupSnapshot previous = group.snapshot;
            LeaseGroupSnapshot published = rebuild(group, lease.copy(), group.amendments);
            log.info("{} lease {} (version {})", previous == null ? "Added" : "Replaced", leaseId, published.getVersion());

            drainPending(group);
            return new GraphUpdate(group.snapshot, newlyOpened(previous, group.snapshot));
        } finally {
            group.lock.unlock();
        }
    }

    /**
     * Insert or replace an amendment in its lease's chain.
     * @throws UnknownLeaseException if the target lease has not been added; the amendment is held
     *         and applied automatically when the lease arrives
     */
    public GraphUpdate addAmendment(Amendment amendment) {
        String leaseId = amendment.getTargetLeaseId();
        Amendment sequenced = amendment.getIngestionSequence() != null
                ? amendment
                : amendment.toBuilder().ingestionSequence(ingestionSequence.incrementAndGet()).build();

        LeaseGroup group = groups.get(leaseId);
        if (group == null || !group.isPublished()) {
            pendingByLease.computeIfAbsent(leaseId, id -> new ConcurrentHashMap<>())
                    .put(sequenced.getAmendmentId(), sequenced);
            // the lease may have been published between the check and the hold
            group = groups.get(leaseId);
            if (group == null || !group.isPublished()) {
                log.warn("Amendment {} targets unknown lease {}; held until it arrives",
                        sequenced.getAmendmentId(), leaseId);
                throw new UnknownLeaseException(leaseId);
            }
            group.lock.lock();
            try {
                LeaseGroupSnapshot previous = group.snapshot;
                drainPending(group);
                return new GraphUpdate(group.snapshot, newlyOpened(previous, group.snapshot));
            } finally {
                group.lock.unlock();
            }
        }

        group.lock.lock();
        try {
            LeaseGroupSnapshot previous = group.snapshot;
            Map<String, Amendment> next = new LinkedHashMap<>(group.amendments);
            next.put(sequenced.getAmendmentId(), keepSequence(group.amendments, sequenced));
            LeaseGroupSnapshot published = rebuild(group, group.base, next);
            log.info("Applied amendment {} to lease {} (version {})",
                    sequenced.getAmendmentId(), leaseId, published.getVersion());
            return new GraphUpdate(published, newlyOpened(previous, published));
        } finally {
            group.lock.unlock();
        }
    }

    public LeaseGroupSnapshot snapshot(String leaseId) {
        LeaseGroup group = groups.get(leaseId);
        if (group == null || !group.isPublished()) {
            throw new UnknownLeaseException(leaseId);
        }
        return group.snapshot;
    }

    /**
     * Merged state of the lease; a copy the caller may modify freely
     */
    public Lease currentState(String leaseId) {
        return snapshot(leaseId).getCurrentState().copy();
    }

    /**
     * Amendments in chain order
     */
    public List<Amendment> history(String leaseId) {
        return snapshot(leaseId).getAmendments();
    }

    public List<ConflictRecord> listConflicts(String leaseId, ConflictStatus status) {
        return snapshot(leaseId).getConflicts().stream()
                .filter(c -> status == null || c.getStatus() == status)
                .collect(Collectors.toList());
    }

    public List<Amendment> pendingAmendments(String leaseId) {
        Map<String, Amendment> pending = pendingByLease.get(leaseId);
        return pending == null ? List.of() : List.copyOf(pending.values());
    }

    public Set<String> leaseIds() {
        return groups.values().stream()
                .filter(LeaseGroup::isPublished)
                .map(g -> g.leaseId)
                .collect(Collectors.toUnmodifiableSet());
    }

    public ConflictRecord findConflict(String conflictId) {
        String leaseId = leaseIdByConflictId.get(conflictId);
        if (leaseId == null) {
            throw new ConflictNotFoundException(conflictId);
        }
        return snapshot(leaseId).getConflicts().stream()
                .filter(c -> c.getConflictId().equals(conflictId))
                .findFirst()
                .orElseThrow(() -> new ConflictNotFoundException(conflictId));
    }

    /**
     * Apply a lifecycle transition to one conflict under its group's lock.
     * A transition returning the same instance is a no-op and publishes nothing.
     */
    public ConflictRecord updateConflict(String conflictId, UnaryOperator<ConflictRecord> transition) {
        String leaseId = leaseIdByConflictId.get(conflictId);
        if (leaseId == null) {
            throw new ConflictNotFoundException(conflictId);
        }
        LeaseGroup group = groups.get(leaseId);
        group.lock.lock();
        try {
            LeaseGroupSnapshot current = group.snapshot;
            List<ConflictRecord> conflicts = new ArrayList<>(current.getConflicts());
            for (int i = 0; i < conflicts.size(); i++) {
                ConflictRecord existing = conflicts.get(i);
                if (!existing.getConflictId().equals(conflictId)) {
                    continue;
                }
                ConflictRecord updated = transition.apply(existing);
                if (updated == existing) {
                    return existing;
                }
                conflicts.set(i, updated);
                group.snapshot = current.toBuilder()
                        .version(current.getVersion() + 1)
                        .conflicts(Collections.unmodifiableList(conflicts))
                        .build();
                log.info("Conflict {} on lease {} is now {}", conflictId, leaseId, updated.getStatus());
                return updated;
            }
            throw new ConflictNotFoundException(conflictId);
        } finally {
            group.lock.unlock();
        }
    }

    // Caller holds the group lock.
    private void drainPending(LeaseGroup group) {
        Map<String, Amendment> pending = pendingByLease.get(group.leaseId);
        if (pending == null || pending.isEmpty()) {
            return;
        }
        Map<String, Amendment> next = new LinkedHashMap<>(group.amendments);
        List<String> drained = new ArrayList<>();
        for (String amendmentId : new ArrayList<>(pending.keySet())) {
            Amendment amendment = pending.remove(amendmentId);
            if (amendment != null) {
                next.put(amendmentId, keepSequence(group.amendments, amendment));
                drained.add(amendmentId);
            }
        }
        if (drained.isEmpty()) {
            return;
        }
        LeaseGroupSnapshot published = rebuild(group, group.base, next);
        log.info("Applied held amendments {} to lease {} (version {})", drained, group.leaseId, published.getVersion());
    }

    private static Amendment keepSequence(Map<String, Amendment> existing, Amendment amendment) {
        Amendment previous = existing.get(amendment.getAmendmentId());
        if (previous == null || previous.getIngestionSequence().equals(amendment.getIngestionSequence())) {
            return amendment;
        }
        return amendment.toBuilder().ingestionSequence(previous.getIngestionSequence()).build();
    }

    // Caller holds the group lock. Commits to the group only once the rescan succeeded.
    private LeaseGroupSnapshot rebuild(LeaseGroup group, Lease base, Map<String, Amendment> amendments) {
        LeaseGroupSnapshot previous = group.snapshot;
        LeaseStateFolder.FoldResult fold = folder.fold(base, amendments.values());

        LeaseGroupSnapshot draft = LeaseGroupSnapshot.builder()
                .leaseId(group.leaseId)
                .version(previous == null ? 1 : previous.getVersion() + 1)
                .baseRecord(base)
                .currentState(fold.getCurrentState())
                .amendments(fold.getAmendments())
                .chain(fold.getChain())
                .provenance(fold.getProvenance())
                .suspectAmendmentIds(fold.getSuspectAmendmentIds())
                .conflicts(previous == null ? List.of() : previous.getConflicts())
                .retiredConflicts(previous == null ? List.of() : previous.getRetiredConflicts())
                .build();

        LeaseGroupSnapshot published = scanner.rescan(draft);

        group.base = base;
        group.amendments = amendments;
        group.snapshot = published;
        published.getConflicts().forEach(c -> leaseIdByConflictId.put(c.getConflictId(), group.leaseId));
        return published;
    }

    private static List<ConflictRecord> newlyOpened(LeaseGroupSnapshot previous, LeaseGroupSnapshot current) {
        Set<String> known = previous == null ? Set.of() : previous.getConflicts().stream()
                .map(ConflictRecord::getConflictId)
                .collect(Collectors.toSet());
        return current.getConflicts().stream()
                .filter(c -> c.getStatus() == ConflictStatus.OPEN)
                .filter(c -> !known.contains(c.getConflictId()))
                .collect(Collectors.toList());
    }
}
