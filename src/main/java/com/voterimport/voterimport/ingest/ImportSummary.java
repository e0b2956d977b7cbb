package com.voterimport.voterimport.ingest;

import java.util.List;

/**
 * Outcome of one import run. Counters are exact; {@code errors} may be truncated to the configured cap.
 * {@code fieldWarnings} counts optional values stored blank because they could not be normalized.
 */
public record ImportSummary(
        long rowsSeen,
        long inserted,
        long duplicates,
        long validationErrors,
        long normalizationErrors,
        long fieldWarnings,
        List<RowError> errors,
        boolean cancelled
) {

    public ImportSummary {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public ImportSummary(long rowsSeen, long inserted, long duplicates, long validationErrors,
                         long normalizationErrors, List<RowError> errors, boolean cancelled) {
        this(rowsSeen, inserted, duplicates, validationErrors, normalizationErrors, 0, errors, cancelled);
    }

    public long rejected() {
        return duplicates + validationErrors + normalizationErrors;
    }

    /**
     * Every recordable issue: rejected rows plus field warnings on stored rows.
     */
    public long issues() {
        return rejected() + fieldWarnings;
    }

    /**
     * True when more row errors occurred than were recorded.
     */
    public boolean errorsTruncated() {
        return issues() > errors.size();
    }
}
