package com.voterimport.voterimport.storage;

import com.voterimport.voterimport.dedup.DedupScope;
import com.voterimport.voterimport.ingest.CanonicalRecord;

import java.util.Collection;

/**
 * Destination for accepted voter records, partitioned by scope.
 * All operations throw {@link SinkException} on storage failure.
 */
public interface StorageSink {

    boolean exists(DedupScope scope);

    /**
     * Creates the scope's destination when it does not exist yet.
     */
    void ensureScope(DedupScope scope);

    void dropScope(DedupScope scope);

    Collection<String> existingVoterIds(DedupScope scope);

    /**
     * Commits one record. Returns {@link InsertResult#DUPLICATE} when the destination already holds the voter id.
     */
    InsertResult insert(DedupScope scope, CanonicalRecord record);
}
