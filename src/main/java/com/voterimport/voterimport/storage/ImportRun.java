package com.voterimport.voterimport.storage;

/**
 * One row of the run ledger.
 */
public record ImportRun(
        long runId,
        long runDatetime,
        String stateCode,
        String tableName,
        String fileName,
        int configVersion,
        RunStatus status,
        long rowsSeen,
        long inserted,
        long duplicates,
        long validationErrors,
        long normalizationErrors,
        long fieldWarnings,
        String message
) {
}
