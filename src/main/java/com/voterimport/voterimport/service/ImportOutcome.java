package com.voterimport.voterimport.service;

import com.voterimport.voterimport.dedup.DedupScope;
import com.voterimport.voterimport.ingest.ImportSummary;

/**
 * Summary of one import together with its run ledger id and the number of voters the table holds afterwards.
 */
public record ImportOutcome(long runId, DedupScope scope, ImportSummary summary, long storedVoters) {
}
