package com.voterimport.voterimport.ingest;

import com.voterimport.voterimport.schema.CanonicalField;

/**
 * The row's voter id was already accepted in the destination scope.
 */
public class DuplicateVoterIdException extends RowRejectedException {

    public DuplicateVoterIdException(String voterId, String scope) {
        super("Voter id " + voterId + " already present in " + scope, CanonicalField.VOTER_ID, voterId);
    }

    @Override
    public RejectionKind kind() {
        return RejectionKind.DUPLICATE;
    }
}
