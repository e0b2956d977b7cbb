package com.voterimport.voterimport.dedup;

import com.voterimport.voterimport.config.VoterImportConstants;

import java.util.Locale;

/**
 * Destination partition within which voter ids must be unique: one state's table.
 */
public record DedupScope(String stateCode, String table) {

    public DedupScope {
        if (stateCode == null || !stateCode.matches(VoterImportConstants.VALID_STATE_CODE_REGEX)) {
            throw new IllegalArgumentException(VoterImportConstants.MSG_INVALID_STATE_CODE.formatted(stateCode));
        }
        if (table == null || !table.matches(VoterImportConstants.VALID_TABLE_NAME_REGEX)) {
            throw new IllegalArgumentException(VoterImportConstants.MSG_INVALID_TABLE.formatted(table));
        }
        stateCode = stateCode.toUpperCase(Locale.ROOT);
    }

    /**
     * Scope using the default {@code voters_<state>} table.
     */
    public static DedupScope forState(String stateCode) {
        String table = stateCode == null ? null : VoterImportConstants.DEFAULT_TABLE_PREFIX + stateCode.toLowerCase(Locale.ROOT);
        return new DedupScope(stateCode, table);
    }

    @Override
    public String toString() {
        return stateCode + "/" + table;
    }
}
