package com.voterimport.voterimport.storage;

import com.voterimport.voterimport.config.VoterImportConstants;
import com.voterimport.voterimport.ingest.ImportSummary;
import com.voterimport.voterimport.ingest.RowError;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Run ledger: one {@code import_run} row per import and one {@code import_run_error} row per recorded row error.
 */
public class ImportRunRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ImportRunRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public void ensureTables() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS import_run (
                    run_id INTEGER PRIMARY KEY,
                    run_datetime INTEGER NOT NULL,
                    state_code TEXT NOT NULL,
                    table_name TEXT NOT NULL,
                    file_name TEXT,
                    config_version INTEGER NOT NULL,
                    status TEXT NOT NULL,
                    rows_seen INTEGER NOT NULL,
                    inserted INTEGER NOT NULL,
                    duplicates INTEGER NOT NULL,
                    validation_errors INTEGER NOT NULL,
                    normalization_errors INTEGER NOT NULL,
                    field_warnings INTEGER NOT NULL DEFAULT 0,
                    message TEXT
                )
                """);
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS import_run_error (
                    error_id INTEGER PRIMARY KEY AUTOINCREMENT,
                    run_id INTEGER NOT NULL,
                    row_num INTEGER NOT NULL,
                    kind TEXT NOT NULL,
                    field TEXT,
                    raw_value TEXT,
                    error_description TEXT
                )
                """);
        Integer warningsColumn = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM pragma_table_info('import_run') WHERE name = 'field_warnings'",
                Integer.class
        );
        if (warningsColumn == null || warningsColumn == 0) {
            jdbcTemplate.execute("ALTER TABLE import_run ADD COLUMN field_warnings INTEGER NOT NULL DEFAULT 0");
        }
    }

    /**
     * Creates the run row before ingestion starts and returns its id.
     */
    public long startRun(String stateCode, String tableName, String fileName, int configVersion) {
        ensureTables();
        long runId = generateRunId();
        jdbcTemplate.update("""
                        INSERT INTO import_run (run_id, run_datetime, state_code, table_name, file_name, config_version,
                            status, rows_seen, inserted, duplicates, validation_errors, normalization_errors, field_warnings)
                        VALUES (?, ?, ?, ?, ?, ?, ?, 0, 0, 0, 0, 0, 0)
                        """,
                runId, clock.millis(), stateCode, tableName, fileName, configVersion, RunStatus.RUNNING.name());
        return runId;
    }

    /**
     * Writes the final counters and the recorded row errors.
     */
    public void completeRun(long runId, ImportSummary summary) {
        RunStatus status = summary.cancelled() ? RunStatus.CANCELLED : RunStatus.COMPLETED;
        String message = summary.errorsTruncated()
                ? "Recorded " + summary.errors().size() + " of " + summary.issues() + " row errors"
                : null;
        jdbcTemplate.update("""
                        UPDATE import_run SET status = ?, rows_seen = ?, inserted = ?, duplicates = ?,
                            validation_errors = ?, normalization_errors = ?, field_warnings = ?, message = ?
                        WHERE run_id = ?
                        """,
                status.name(), summary.rowsSeen(), summary.inserted(), summary.duplicates(),
                summary.validationErrors(), summary.normalizationErrors(), summary.fieldWarnings(), message, runId);

        List<RowError> errors = summary.errors();
        if (!errors.isEmpty()) {
            jdbcTemplate.batchUpdate(
                    "INSERT INTO import_run_error (run_id, row_num, kind, field, raw_value, error_description) VALUES (?, ?, ?, ?, ?, ?)",
                    errors,
                    errors.size(),
                    (ps, error) -> {
                        ps.setLong(1, runId);
                        ps.setLong(2, error.rowNumber());
                        ps.setString(3, error.kind().name());
                        ps.setString(4, error.field() == null ? null : error.field().key());
                        ps.setString(5, error.value());
                        ps.setString(6, error.message());
                    });
        }
    }

    public void failRun(long runId, String message) {
        jdbcTemplate.update("UPDATE import_run SET status = ?, message = ? WHERE run_id = ?",
                RunStatus.FAILED.name(), message, runId);
    }

    public Optional<ImportRun> findRun(long runId) {
        List<ImportRun> runs = jdbcTemplate.query(
                """
                SELECT run_id, run_datetime, state_code, table_name, file_name, config_version, status, rows_seen,
                    inserted, duplicates, validation_errors, normalization_errors, field_warnings, message
                FROM import_run WHERE run_id = ?
                """,
                (rs, rowNum) -> new ImportRun(
                        rs.getLong("run_id"),
                        rs.getLong("run_datetime"),
                        rs.getString("state_code"),
                        rs.getString("table_name"),
                        rs.getString("file_name"),
                        rs.getInt("config_version"),
                        RunStatus.valueOf(rs.getString("status")),
                        rs.getLong("rows_seen"),
                        rs.getLong("inserted"),
                        rs.getLong("duplicates"),
                        rs.getLong("validation_errors"),
                        rs.getLong("normalization_errors"),
                        rs.getLong("field_warnings"),
                        rs.getString("message")
                ),
                runId
        );
        return runs.stream().findFirst();
    }

    public int countErrors(long runId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM import_run_error WHERE run_id = ?",
                Integer.class,
                runId
        );
        return count == null ? 0 : count;
    }

    private long generateRunId() {
        long candidate = clock.millis();
        for (int attempt = 0; attempt < 1000; attempt++) {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM import_run WHERE run_id = ?",
                    Integer.class,
                    candidate
            );
            if (count == null || count == 0) {
                return candidate;
            }
            candidate++;
        }
        throw new IllegalStateException(VoterImportConstants.MSG_RUN_ID_NOT_GENERATED);
    }
}
