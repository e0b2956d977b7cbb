package com.voterimport.voterimport.dedup;

public enum DedupOutcome {
    ACCEPTED,
    DUPLICATE
}
