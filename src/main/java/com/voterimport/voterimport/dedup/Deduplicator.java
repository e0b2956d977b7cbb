package com.voterimport.voterimport.dedup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scope-keyed index of voter ids already accepted. Indexes of different scopes never interact.
 */
public class Deduplicator {

    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    private final Map<DedupScope, Set<String>> index = new ConcurrentHashMap<>();

    /**
     * Registers ids already committed to the scope's destination, typically read back from storage.
     */
    public void seed(DedupScope scope, Collection<String> existingIds) {
        Objects.requireNonNull(scope, "scope");
        Set<String> ids = idsFor(scope);
        if (existingIds != null) {
            ids.addAll(existingIds);
        }
        log.debug("Seeded dedup index for {} with {} ids", scope, ids.size());
    }

    /**
     * Atomically records the id when it is new to the scope.
     */
    public DedupOutcome checkAndRecord(DedupScope scope, String voterId) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(voterId, "voterId");
        return idsFor(scope).add(voterId) ? DedupOutcome.ACCEPTED : DedupOutcome.DUPLICATE;
    }

    /**
     * Forgets an id recorded by a row whose write never committed.
     */
    public void forget(DedupScope scope, String voterId) {
        Set<String> ids = index.get(scope);
        if (ids != null) {
            ids.remove(voterId);
        }
    }

    boolean contains(DedupScope scope, String voterId) {
        Set<String> ids = index.get(scope);
        return ids != null && ids.contains(voterId);
    }

    int size(DedupScope scope) {
        Set<String> ids = index.get(scope);
        return ids == null ? 0 : ids.size();
    }

    /**
     * Discards the scope's index at run end; the next run re-seeds from storage.
     */
    public void release(DedupScope scope) {
        index.remove(scope);
    }

    private Set<String> idsFor(DedupScope scope) {
        return index.computeIfAbsent(scope, key -> ConcurrentHashMap.newKeySet());
    }
}
