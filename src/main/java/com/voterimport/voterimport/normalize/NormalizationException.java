package com.voterimport.voterimport.normalize;

import com.voterimport.voterimport.ingest.RejectionKind;
import com.voterimport.voterimport.ingest.RowRejectedException;
import com.voterimport.voterimport.schema.CanonicalField;

/**
 * A value cannot be brought into its field's canonical form. Carries the original value.
 */
public class NormalizationException extends RowRejectedException {

    public NormalizationException(CanonicalField field, String value, String reason) {
        super("Cannot normalize " + field.key() + " value '" + value + "': " + reason, field, value);
    }

    @Override
    public RejectionKind kind() {
        return RejectionKind.NORMALIZATION;
    }
}
