package com.voterimport.voterimport.storage;

import com.voterimport.voterimport.VoterImportException;

/**
 * The storage destination failed. Transient failures (lock contention, busy database) may be retried.
 */
public class SinkException extends VoterImportException {

    private final boolean transientFailure;

    public SinkException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
