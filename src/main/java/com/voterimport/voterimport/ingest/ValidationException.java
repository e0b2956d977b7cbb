package com.voterimport.voterimport.ingest;

import com.voterimport.voterimport.schema.CanonicalField;

/**
 * A required field is missing or blank in a row.
 */
public class ValidationException extends RowRejectedException {

    public ValidationException(CanonicalField field, String value) {
        super("Required field " + field.key() + " is missing or empty", field, value);
    }

    @Override
    public RejectionKind kind() {
        return RejectionKind.VALIDATION;
    }
}
