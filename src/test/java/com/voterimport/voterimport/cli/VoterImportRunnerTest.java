package com.voterimport.voterimport.cli;

import com.voterimport.voterimport.schema.CanonicalField;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ExtendWith(OutputCaptureExtension.class)
class VoterImportRunnerTest {

    @Autowired
    private VoterImportRunner runner;

    @TempDir
    Path tempDir;

    @Test
    void shouldPrintUsageWithoutArguments(CapturedOutput output) {
        assertEquals(VoterImportRunner.EXIT_USAGE, execute());
        assertTrue(output.getOut().contains("Usage:"));
    }

    @Test
    void shouldRejectUnknownCommandAndBadOptions(CapturedOutput output) throws IOException {
        Path input = writeExtract();

        assertEquals(VoterImportRunner.EXIT_USAGE, execute("export", "NC"));
        assertTrue(output.getErr().contains("Unknown command: export"));
        assertEquals(VoterImportRunner.EXIT_USAGE, execute("import", "NC"));
        assertEquals(VoterImportRunner.EXIT_USAGE, execute("onboard", "North", input.toString(), configDir()));
        assertEquals(VoterImportRunner.EXIT_USAGE, execute("import", "NC", input.toString(), "--limit=abc"));
        assertEquals(VoterImportRunner.EXIT_USAGE, execute("onboard", "NC", input.toString(), configDir(), "--map=VID"));
    }

    @Test
    void shouldOnboardImportAndAnalyze(CapturedOutput output) throws IOException {
        Path input = writeExtract();

        assertEquals(VoterImportRunner.EXIT_OK, execute("onboard", "NC", input.toString(), configDir()));
        assertTrue(output.getOut().contains("Configuration for NC (version 1) saved to"));

        assertEquals(VoterImportRunner.EXIT_OK, execute("import", "NC", input.toString(), configDir(), database()));
        assertTrue(output.getOut().contains("Import into NC/voters_nc"));
        assertTrue(output.getOut().contains("  rows seen:            4"));
        assertTrue(output.getOut().contains("  inserted:             2"));
        assertTrue(output.getOut().contains("  duplicates:           1"));
        assertTrue(output.getOut().contains("  normalization errors: 1"));
        assertTrue(output.getOut().contains("NORMALIZATION"));

        Path report = tempDir.resolve("report.md");
        assertEquals(VoterImportRunner.EXIT_OK,
                execute("analyze-addresses", "NC", database(), "--threshold=1", "--output=" + report));
        assertTrue(output.getOut().contains("Report saved to " + report));
        assertTrue(Files.readString(report, StandardCharsets.UTF_8).startsWith("# Duplicate Address Analysis Report"));
    }

    @Test
    void shouldAcceptOptionValuesAsSeparateArguments(CapturedOutput output) throws IOException {
        Path input = writeExtract();
        String configs = tempDir.resolve("configs").toString();
        String db = tempDir.resolve("voters.db").toString();

        assertEquals(VoterImportRunner.EXIT_OK, execute("onboard", "NC", input.toString(), "--config-dir", configs));
        assertTrue(Files.exists(tempDir.resolve("configs").resolve("nc_config.json")));

        assertEquals(VoterImportRunner.EXIT_OK,
                execute("import", "NC", input.toString(), "--config-dir", configs, "--db", db, "--limit", "2"));
        assertTrue(Files.exists(tempDir.resolve("voters.db")));
        assertTrue(output.getOut().contains("  rows seen:            2"));
        assertTrue(output.getOut().contains("  field warnings:       0"));
        assertTrue(output.getOut().contains("  voters in table:      2"));
    }

    @Test
    void shouldJoinOnlyValueOptionsWithFollowingArgument() {
        assertArrayEquals(new String[]{"import", "NC", "in.txt", "--db=v.db", "--force", "--table=t1", "--verbose"},
                VoterImportRunner.joinOptionValues(
                        new String[]{"import", "NC", "in.txt", "--db", "v.db", "--force", "--table=t1", "--verbose"}));
        assertArrayEquals(new String[]{"--map", "--force"},
                VoterImportRunner.joinOptionValues(new String[]{"--map", "--force"}));
        assertArrayEquals(new String[]{"--map=Reg Key:voter_id", "--map=Zip5:zip"},
                VoterImportRunner.joinOptionValues(new String[]{"--map", "Reg Key:voter_id", "--map", "Zip5:zip"}));
    }

    @Test
    void shouldNameUnmappedRequirementsWhenConfigIncomplete(CapturedOutput output) throws IOException {
        Path input = tempDir.resolve("partial.txt");
        Files.write(input, List.of("Foo|Addr1|City", "A1|123 Main Street|Raleigh"), StandardCharsets.UTF_8);

        assertEquals(VoterImportRunner.EXIT_OK, execute("onboard", "NC", input.toString(), configDir()));
        assertTrue(output.getOut().contains("Unmapped required fields: [voter_id]"));

        assertEquals(VoterImportRunner.EXIT_FATAL, execute("import", "NC", input.toString(), configDir(), database()));
        assertTrue(output.getErr().contains("Missing mapping for voter_id; re-run onboard with --map=Column:voter_id"));
    }

    @Test
    void shouldFailImportWithoutConfig() throws IOException {
        Path input = writeExtract();

        assertEquals(VoterImportRunner.EXIT_FATAL,
                execute("import", "NC", input.toString(), configDir(), database(), "--verbose"));
    }

    @Test
    void shouldFailOnMissingInputFile() {
        assertEquals(VoterImportRunner.EXIT_FATAL,
                execute("onboard", "NC", tempDir.resolve("missing.csv").toString(), configDir()));
    }

    @Test
    void shouldParseManualMappings() {
        assertEquals(Map.of("Reg Key", CanonicalField.VOTER_ID, "Res:Zip", CanonicalField.ZIP),
                VoterImportRunner.parseManualMappings(List.of("Reg Key:voter_id", "Res:Zip:zip")));
        assertTrue(VoterImportRunner.parseManualMappings(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> VoterImportRunner.parseManualMappings(List.of("NoField")));
        assertThrows(IllegalArgumentException.class, () -> VoterImportRunner.parseManualMappings(List.of("Col:unknown")));
    }

    private int execute(String... args) {
        return runner.execute(new DefaultApplicationArguments(args));
    }

    private String configDir() {
        return "--config-dir=" + tempDir.resolve("configs");
    }

    private String database() {
        return "--db=" + tempDir.resolve("voters.db");
    }

    private Path writeExtract() throws IOException {
        Path file = tempDir.resolve("ncvoter.txt");
        Files.write(file, List.of(
                "VID|First|Last|Addr1|City|ST|Zip",
                "1001|jane|doe|123 Main Street|Raleigh|NC|27601",
                "1002|john|smith|456 Oak Avenue|Raleigh|NC|27601",
                "1001|jane|doe|123 Main Street|Raleigh|NC|27601",
                "1003|ann|lee|9 Elm Street|Cary|NC|1234567"
        ), StandardCharsets.UTF_8);
        return file;
    }
}
