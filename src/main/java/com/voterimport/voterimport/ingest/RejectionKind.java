package com.voterimport.voterimport.ingest;

/**
 * Kind of row issue recorded in an import summary. Rows with a {@link #FIELD_WARNING} are stored;
 * the other kinds reject the row.
 */
public enum RejectionKind {
    VALIDATION,
    NORMALIZATION,
    DUPLICATE,
    FIELD_WARNING
}
