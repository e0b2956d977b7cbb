package com.voterimport.voterimport.ingest;

import com.voterimport.voterimport.schema.CanonicalField;

/**
 * A single row could not be accepted. Always recovered inside the pipeline and counted in the summary.
 */
public abstract class RowRejectedException extends Exception {

    private final CanonicalField field;
    private final String value;

    protected RowRejectedException(String message, CanonicalField field, String value) {
        super(message);
        this.field = field;
        this.value = value;
    }

    public abstract RejectionKind kind();

    public CanonicalField getField() {
        return field;
    }

    /**
     * The offending value as it appeared in the source row.
     */
    public String getValue() {
        return value;
    }
}
