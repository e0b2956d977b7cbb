package com.voterimport.voterimport.config;

import com.voterimport.voterimport.VoterImportException;
import com.voterimport.voterimport.schema.MappingRequirement;

import java.util.List;

/**
 * A state config lacks a mapping for a required canonical field.
 */
public class ConfigIncompleteException extends VoterImportException {

    private final List<MappingRequirement> unmapped;

    public ConfigIncompleteException(String stateCode, List<MappingRequirement> unmapped) {
        super(VoterImportConstants.MSG_CONFIG_INCOMPLETE.formatted(
                stateCode, unmapped.stream().map(MappingRequirement::description).toList()));
        this.unmapped = List.copyOf(unmapped);
    }

    public List<MappingRequirement> getUnmapped() {
        return unmapped;
    }
}
