package com.voterimport.voterimport.storage;

import com.voterimport.voterimport.ingest.ImportSummary;
import com.voterimport.voterimport.ingest.RejectionKind;
import com.voterimport.voterimport.ingest.RowError;
import com.voterimport.voterimport.schema.CanonicalField;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImportRunRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteDatabase database;
    private ImportRunRepository runs;

    @BeforeEach
    void setUp() {
        database = SqliteDatabase.open(tempDir.resolve("voters.db"));
        runs = new ImportRunRepository(database.jdbcTemplate(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void shouldRecordRunningRun() {
        long runId = runs.startRun("NC", "voters_nc", "ncvoter.txt", 2);

        ImportRun run = runs.findRun(runId).orElseThrow();
        assertEquals(NOW.toEpochMilli(), run.runId());
        assertEquals(NOW.toEpochMilli(), run.runDatetime());
        assertEquals("NC", run.stateCode());
        assertEquals("voters_nc", run.tableName());
        assertEquals("ncvoter.txt", run.fileName());
        assertEquals(2, run.configVersion());
        assertEquals(RunStatus.RUNNING, run.status());
        assertEquals(0, run.rowsSeen());
    }

    @Test
    void shouldGenerateDistinctIdsWithinSameMillisecond() {
        long first = runs.startRun("NC", "voters_nc", "a.txt", 1);
        long second = runs.startRun("NC", "voters_nc", "b.txt", 1);

        assertNotEquals(first, second);
        assertEquals(first + 1, second);
    }

    @Test
    void shouldStoreCountersAndRowErrors() {
        long runId = runs.startRun("NC", "voters_nc", "ncvoter.txt", 1);
        ImportSummary summary = new ImportSummary(4, 2, 1, 1, 0, List.of(
                new RowError(2, RejectionKind.VALIDATION, CanonicalField.VOTER_ID, "", "Required field voter_id is missing or empty"),
                new RowError(4, RejectionKind.DUPLICATE, CanonicalField.VOTER_ID, "1001", "Voter id 1001 already present")
        ), false);

        runs.completeRun(runId, summary);

        ImportRun run = runs.findRun(runId).orElseThrow();
        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals(4, run.rowsSeen());
        assertEquals(2, run.inserted());
        assertEquals(1, run.duplicates());
        assertEquals(1, run.validationErrors());
        assertEquals(0, run.normalizationErrors());
        assertNull(run.message());
        assertEquals(2, runs.countErrors(runId));

        Map<String, Object> error = database.jdbcTemplate().queryForMap(
                "SELECT row_num, kind, field, raw_value FROM import_run_error WHERE run_id = ? AND kind = 'DUPLICATE'", runId);
        assertEquals(4, ((Number) error.get("row_num")).intValue());
        assertEquals("voter_id", error.get("field"));
        assertEquals("1001", error.get("raw_value"));
    }

    @Test
    void shouldStoreFieldWarningsOfKeptRows() {
        long runId = runs.startRun("NC", "voters_nc", "ncvoter.txt", 1);
        ImportSummary summary = new ImportSummary(3, 3, 0, 0, 0, 2, List.of(
                new RowError(1, RejectionKind.FIELD_WARNING, CanonicalField.BIRTH_DATE, "00/00/0000",
                        "unrecognized date format; stored blank"),
                new RowError(3, RejectionKind.FIELD_WARNING, CanonicalField.MAILING_ZIP, "123",
                        "expected 5 or 9 digits but found 3; stored blank")
        ), false);

        runs.completeRun(runId, summary);

        ImportRun run = runs.findRun(runId).orElseThrow();
        assertEquals(3, run.inserted());
        assertEquals(2, run.fieldWarnings());
        assertEquals(0, summary.rejected());
        assertEquals(2, runs.countErrors(runId));
        assertEquals("mailing_zip", database.jdbcTemplate().queryForObject(
                "SELECT field FROM import_run_error WHERE run_id = ? AND row_num = 3", String.class, runId));
    }

    @Test
    void shouldAddFieldWarningsColumnToOlderLedger() {
        database.jdbcTemplate().execute("""
                CREATE TABLE import_run (
                    run_id INTEGER PRIMARY KEY,
                    run_datetime INTEGER NOT NULL,
                    state_code TEXT NOT NULL,
                    table_name TEXT NOT NULL,
                    file_name TEXT,
                    config_version INTEGER NOT NULL,
                    status TEXT NOT NULL,
                    rows_seen INTEGER NOT NULL DEFAULT 0,
                    inserted INTEGER NOT NULL DEFAULT 0,
                    duplicates INTEGER NOT NULL DEFAULT 0,
                    validation_errors INTEGER NOT NULL DEFAULT 0,
                    normalization_errors INTEGER NOT NULL DEFAULT 0,
                    message TEXT
                )
                """);

        long runId = runs.startRun("NC", "voters_nc", "ncvoter.txt", 1);
        runs.completeRun(runId, new ImportSummary(1, 1, 0, 0, 0, 1, List.of(), false));

        assertEquals(1, runs.findRun(runId).orElseThrow().fieldWarnings());
    }

    @Test
    void shouldNoteTruncatedErrorList() {
        long runId = runs.startRun("NC", "voters_nc", "ncvoter.txt", 1);
        ImportSummary summary = new ImportSummary(10, 0, 0, 10, 0, List.of(
                new RowError(1, RejectionKind.VALIDATION, CanonicalField.VOTER_ID, "", "missing")
        ), false);

        runs.completeRun(runId, summary);

        ImportRun run = runs.findRun(runId).orElseThrow();
        assertEquals("Recorded 1 of 10 row errors", run.message());
        assertEquals(1, runs.countErrors(runId));
    }

    @Test
    void shouldMarkCancelledAndFailedRuns() {
        long cancelled = runs.startRun("NC", "voters_nc", "a.txt", 1);
        runs.completeRun(cancelled, new ImportSummary(1, 1, 0, 0, 0, List.of(), true));
        long failed = runs.startRun("NC", "voters_nc", "b.txt", 1);
        runs.failRun(failed, "disk full");

        assertEquals(RunStatus.CANCELLED, runs.findRun(cancelled).orElseThrow().status());
        ImportRun failedRun = runs.findRun(failed).orElseThrow();
        assertEquals(RunStatus.FAILED, failedRun.status());
        assertEquals("disk full", failedRun.message());
    }

    @Test
    void shouldReturnEmptyForUnknownRun() {
        runs.ensureTables();

        assertTrue(runs.findRun(42L).isEmpty());
    }
}
