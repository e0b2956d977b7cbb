package com.voterimport.voterimport.storage;

public enum InsertResult {
    INSERTED,
    DUPLICATE
}
