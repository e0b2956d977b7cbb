package com.voterimport.voterimport.config;

import com.voterimport.voterimport.schema.CanonicalField;
import com.voterimport.voterimport.schema.DetectionMethod;
import com.voterimport.voterimport.schema.FieldMapping;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateConfigStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSaveAndLoadConfig() throws Exception {
        StateConfigStore store = new StateConfigStore(tempDir.resolve("configs"));
        StateConfig config = sampleConfig();

        Path path = store.save(config);

        assertEquals(tempDir.resolve("configs").resolve("nc_config.json"), path);
        String json = Files.readString(path, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"voter_id\""));
        assertTrue(json.contains("\"manual\""));
        assertTrue(json.contains("2026-01-05T10:00:00Z"));
        assertEquals(Optional.of(config), store.load("nc"));
    }

    @Test
    void shouldReturnEmptyWhenConfigMissing() {
        StateConfigStore store = new StateConfigStore(tempDir);

        assertTrue(store.load("OR").isEmpty());
        ConfigMissingException ex = assertThrows(ConfigMissingException.class, () -> store.require("OR"));
        assertEquals("OR", ex.getStateCode());
    }

    @Test
    void shouldOverwritePreviousVersion() {
        StateConfigStore store = new StateConfigStore(tempDir);
        StateConfig first = sampleConfig();
        StateConfig second = new StateConfig("NC", 2, "|", first.columnNames(), first.fieldMappings(),
                List.of(CanonicalField.ZIP), first.createdAt(), Instant.parse("2026-03-01T00:00:00Z"));

        store.save(first);
        store.save(second);

        assertEquals(second, store.require("NC"));
    }

    @Test
    void shouldIgnoreUnknownProperties() throws Exception {
        Files.writeString(tempDir.resolve("wa_config.json"), """
                {
                  "state_code" : "WA",
                  "version" : 4,
                  "format" : "csv",
                  "column_names" : [ "StateVoterID", "RegStreetName" ],
                  "field_mappings" : [
                    { "source_column" : "StateVoterID", "canonical_field" : "voter_id", "confidence" : 0.6, "method" : "alias" }
                  ]
                }
                """, StandardCharsets.UTF_8);

        StateConfig config = new StateConfigStore(tempDir).require("wa");

        assertEquals("WA", config.stateCode());
        assertEquals(4, config.version());
        assertEquals(CanonicalField.VOTER_ID, config.fieldMappings().get(0).canonicalField());
        assertTrue(config.needsConfirmation().isEmpty());
    }

    @Test
    void shouldRejectCorruptConfigFile() throws Exception {
        Files.writeString(tempDir.resolve("nc_config.json"), "{ not json", StandardCharsets.UTF_8);

        assertThrows(IllegalStateException.class, () -> new StateConfigStore(tempDir).load("NC"));
    }

    private static StateConfig sampleConfig() {
        Instant created = Instant.parse("2026-01-05T10:00:00Z");
        return new StateConfig("NC", 1, ",", List.of("VID", "Addr1", "Zip"),
                List.of(new FieldMapping("VID", CanonicalField.VOTER_ID, 1.0, DetectionMethod.MANUAL),
                        new FieldMapping("Addr1", CanonicalField.ADDRESS_LINE, 0.8, DetectionMethod.ALIAS),
                        new FieldMapping("Zip", CanonicalField.ZIP, 1.0, DetectionMethod.EXACT)),
                List.of(), created, created);
    }
}
