package com.voterimport.voterimport.ingest;

import com.voterimport.voterimport.schema.CanonicalField;

/**
 * A rejected row as recorded in the import summary. {@code field} is null when no single field is at fault.
 */
public record RowError(long rowNumber, RejectionKind kind, CanonicalField field, String value, String message) {

    public static RowError of(RawRow row, RowRejectedException ex) {
        return new RowError(row.rowNumber(), ex.kind(), ex.getField(), ex.getValue(), ex.getMessage());
    }
}
