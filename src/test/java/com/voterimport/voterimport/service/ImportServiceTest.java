package com.voterimport.voterimport.service;

import com.voterimport.voterimport.config.ConfigIncompleteException;
import com.voterimport.voterimport.config.ConfigMissingException;
import com.voterimport.voterimport.dedup.DedupScope;
import com.voterimport.voterimport.ingest.ImportSummary;
import com.voterimport.voterimport.schema.CanonicalField;
import com.voterimport.voterimport.storage.ImportRun;
import com.voterimport.voterimport.storage.ImportRunRepository;
import com.voterimport.voterimport.storage.RunStatus;
import com.voterimport.voterimport.storage.SqliteDatabase;
import com.voterimport.voterimport.storage.SqliteStorageSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class ImportServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static final List<String> NC_EXTRACT = List.of(
            "VID,First,Last,Addr1,City,ST,Zip",
            "1001,jane,doe,123 Main Street,Raleigh,NC,27601",
            "1002,john,smith,456 Oak Avenue,Raleigh,nc,276011234",
            "1001,jane,doe,123 Main Street,Raleigh,NC,27601"
    );

    @Autowired
    private ImportService importService;

    @TempDir
    Path tempDir;

    @Test
    void shouldOnboardAndImportExtract() throws IOException {
        Path input = write("ncvoter.csv", NC_EXTRACT);

        OnboardResult onboarded = importService.onboard("nc", input, options());
        assertTrue(onboarded.config().isComplete());
        assertEquals(1, onboarded.config().version());
        assertEquals(",", onboarded.config().delimiter());
        assertEquals(tempDir.resolve("configs").resolve("nc_config.json"), onboarded.configPath());
        assertTrue(Files.exists(onboarded.configPath()));

        ImportOutcome outcome = importService.importFile("NC", input, options());
        ImportSummary summary = outcome.summary();
        assertEquals(DedupScope.forState("NC"), outcome.scope());
        assertEquals(3, summary.rowsSeen());
        assertEquals(2, summary.inserted());
        assertEquals(1, summary.duplicates());
        assertEquals(0, summary.validationErrors());
        assertEquals(0, summary.normalizationErrors());
        assertEquals(2, outcome.storedVoters());

        try (SqliteDatabase database = SqliteDatabase.open(tempDir.resolve("voters.db"))) {
            assertEquals(2, new SqliteStorageSink(database.jdbcTemplate(), Clock.systemUTC()).count(outcome.scope()));
            Map<String, Object> john = database.jdbcTemplate()
                    .queryForMap("SELECT first_name, address, city, state, zip FROM voters_nc WHERE voter_id = '1002'");
            assertEquals("John", john.get("first_name"));
            assertEquals("456 Oak AVE", john.get("address"));
            assertEquals("RALEIGH", john.get("city"));
            assertEquals("NC", john.get("state"));
            assertEquals("27601-1234", john.get("zip"));

            ImportRunRepository runs = new ImportRunRepository(database.jdbcTemplate(), Clock.systemUTC());
            ImportRun run = runs.findRun(outcome.runId()).orElseThrow();
            assertEquals(RunStatus.COMPLETED, run.status());
            assertEquals("ncvoter.csv", run.fileName());
            assertEquals(1, run.configVersion());
            assertEquals(2, run.inserted());
            assertEquals(1, runs.countErrors(outcome.runId()));
        }
    }

    @Test
    void shouldReportEveryRowAsDuplicateOnReimport() throws IOException {
        Path input = write("ncvoter.csv", NC_EXTRACT);
        importService.onboard("NC", input, options());
        importService.importFile("NC", input, options());

        ImportSummary second = importService.importFile("NC", input, options()).summary();

        assertEquals(0, second.inserted());
        assertEquals(3, second.duplicates());
    }

    @Test
    void shouldReloadScopeWhenForced() throws IOException {
        Path input = write("ncvoter.csv", NC_EXTRACT);
        importService.onboard("NC", input, options());
        importService.importFile("NC", input, options());

        RunOptions force = new RunOptions(tempDir.resolve("configs"), tempDir.resolve("voters.db"), null, null,
                true, 2, null, Map.of());
        ImportSummary reloaded = importService.importFile("NC", input, force).summary();

        assertEquals(2, reloaded.inserted());
        assertEquals(1, reloaded.duplicates());
    }

    @Test
    void shouldHonourRowLimitAndCustomTable() throws IOException {
        Path input = write("ncvoter.csv", NC_EXTRACT);
        importService.onboard("NC", input, options());
        RunOptions limited = new RunOptions(tempDir.resolve("configs"), tempDir.resolve("voters.db"), "nc_sample", 1L,
                false, 2, null, Map.of());

        ImportOutcome outcome = importService.importFile("NC", input, limited);

        assertEquals("nc_sample", outcome.scope().table());
        assertEquals(1, outcome.summary().rowsSeen());
        assertEquals(1, outcome.summary().inserted());
    }

    @Test
    void shouldKeepOnboardingIdempotent() throws IOException {
        Path input = write("ncvoter.csv", NC_EXTRACT);

        OnboardResult first = importService.onboard("NC", input, options());
        OnboardResult second = importService.onboard("NC", input, options());

        assertEquals(first.config().fieldMappings(), second.config().fieldMappings());
        assertEquals(1, second.config().version());
        assertTrue(second.config().needsConfirmation().isEmpty());
    }

    @Test
    void shouldRefuseImportWithoutConfig() throws IOException {
        Path input = write("orvoter.csv", NC_EXTRACT);

        assertThrows(ConfigMissingException.class, () -> importService.importFile("OR", input, options()));
        assertFalse(Files.exists(tempDir.resolve("voters.db")));
    }

    @Test
    void shouldRefuseImportWithIncompleteConfig() throws IOException {
        Path input = write("wa.csv", List.of("RegKey,Addr1", "A1,1 Main St"));

        OnboardResult onboarded = importService.onboard("WA", input, options());
        assertFalse(onboarded.config().isComplete());

        assertThrows(ConfigIncompleteException.class, () -> importService.importFile("WA", input, options()));
    }

    @Test
    void shouldApplyManualMappingDuringOnboarding() throws IOException {
        Path input = write("wa.csv", List.of("RegKey,Addr1", "A1,1 Main St", "A2,2 Main St"));
        RunOptions manual = new RunOptions(tempDir.resolve("configs"), tempDir.resolve("voters.db"), null, null,
                false, 2, null, Map.of("RegKey", CanonicalField.VOTER_ID));

        OnboardResult onboarded = importService.onboard("WA", input, manual);
        ImportSummary summary = importService.importFile("WA", input, options()).summary();

        assertTrue(onboarded.config().isComplete());
        assertEquals(2, summary.inserted());
    }

    @Test
    void shouldAnalyzeSharedAddressesAndWriteReport() throws IOException {
        Path input = write("ncvoter.csv", List.of(
                "VID,First,Last,Addr1,City,Zip",
                "1,Ann,Lee,1 Main St,Cary,27511",
                "2,Bo,Lee,1 Main Street,Cary,27511",
                "3,Cy,Ray,9 Elm St,Cary,27511"));
        importService.onboard("NC", input, options());
        importService.importFile("NC", input, options());
        Path report = tempDir.resolve("reports").resolve("nc.md");
        RunOptions analysis = new RunOptions(tempDir.resolve("configs"), tempDir.resolve("voters.db"), null, null,
                false, 2, report, Map.of());

        AnalysisOutcome outcome = importService.analyzeAddresses("NC", analysis);

        assertEquals(1, outcome.report().groups().size());
        assertEquals("1 Main ST", outcome.report().groups().get(0).address());
        assertEquals(report, outcome.reportPath());
        assertEquals(outcome.markdown(), Files.readString(report, StandardCharsets.UTF_8));
        assertNull(importService.analyzeAddresses("NC", options()).reportPath());
    }

    @Test
    void shouldRefuseAnalysisWithoutImportedTable() {
        assertThrows(IllegalStateException.class, () -> importService.analyzeAddresses("NC", options()));
    }

    @Test
    void shouldRejectInvalidStateCode() throws IOException {
        Path input = write("ncvoter.csv", NC_EXTRACT);

        assertThrows(IllegalArgumentException.class, () -> importService.onboard("N1", input, options()));
        assertThrows(IllegalArgumentException.class, () -> importService.importFile("", input, options()));
    }

    private RunOptions options() {
        return new RunOptions(tempDir.resolve("configs"), tempDir.resolve("voters.db"), null, null, false, 2, null, Map.of());
    }

    private Path write(String name, List<String> lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, lines, StandardCharsets.UTF_8);
        return file;
    }

    @TestConfiguration
    static class FixedClockConfiguration {

        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }
}
