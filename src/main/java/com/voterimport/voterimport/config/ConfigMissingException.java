package com.voterimport.voterimport.config;

import com.voterimport.voterimport.VoterImportException;

/**
 * No state config exists for the requested state code.
 */
public class ConfigMissingException extends VoterImportException {

    private final String stateCode;

    public ConfigMissingException(String stateCode, String location) {
        super(VoterImportConstants.MSG_CONFIG_MISSING.formatted(stateCode, location));
        this.stateCode = stateCode;
    }

    public String getStateCode() {
        return stateCode;
    }
}
