package com.voterimport.voterimport.service;

import com.voterimport.voterimport.config.VoterImportProperties;
import com.voterimport.voterimport.schema.CanonicalField;

import java.nio.file.Path;
import java.util.Map;

/**
 * Per-run settings: bound properties overridden by command-line options.
 *
 * @param table     destination table, or {@code null} for {@code voters_<state>}
 * @param limit     maximum number of data rows to import, or {@code null} for all
 * @param output    file for the address report, or {@code null} to print it
 */
public record RunOptions(
        Path configDir,
        Path dbPath,
        String table,
        Long limit,
        boolean force,
        int threshold,
        Path output,
        Map<String, CanonicalField> manualMappings
) {

    public RunOptions {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative: " + limit);
        }
        manualMappings = manualMappings == null ? Map.of() : Map.copyOf(manualMappings);
    }

    public static RunOptions defaults(VoterImportProperties properties) {
        return new RunOptions(Path.of(properties.getConfigDir()), Path.of(properties.getDbPath()), null, null,
                false, properties.getDuplicateAddressThreshold(), null, Map.of());
    }
}
