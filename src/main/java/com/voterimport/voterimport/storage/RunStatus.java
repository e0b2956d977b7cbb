package com.voterimport.voterimport.storage;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED
}
