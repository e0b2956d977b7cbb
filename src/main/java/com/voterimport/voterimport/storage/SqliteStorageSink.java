package com.voterimport.voterimport.storage;

import com.voterimport.voterimport.config.VoterImportConstants;
import com.voterimport.voterimport.dedup.DedupScope;
import com.voterimport.voterimport.ingest.CanonicalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteException;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Stores each scope as one SQLite table with a {@code UNIQUE} voter id. Records are committed one by one;
 * {@code INSERT OR IGNORE} makes the constraint the arbiter between concurrent writers.
 */
public class SqliteStorageSink implements StorageSink {

    private static final Logger log = LoggerFactory.getLogger(SqliteStorageSink.class);

    private static final List<String> RECORD_COLUMNS = List.of(
            "voter_id", "first_name", "middle_name", "last_name", "suffix", "street_number", "street_fraction",
            "street_name", "unit", "address", "city", "state", "zip", "county", "precinct", "party", "gender",
            "status_code", "legislative_district", "congressional_district", "birth_date", "registration_date",
            "last_voted_date", "mailing_address", "mailing_address2", "mailing_address3", "mailing_city",
            "mailing_state", "mailing_zip", "mailing_country", "state_code", "source_row_ref", "imported_at"
    );

    /**
     * Columns added after the first table layout; tables created before them gain them on first use.
     */
    private static final List<String> ADDED_COLUMNS = List.of(
            "suffix", "street_fraction", "gender", "status_code", "legislative_district", "congressional_district",
            "last_voted_date", "mailing_address", "mailing_address2", "mailing_address3", "mailing_city",
            "mailing_state", "mailing_zip", "mailing_country"
    );

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public SqliteStorageSink(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public boolean exists(DedupScope scope) {
        return translate(scope, () -> {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?",
                    Integer.class,
                    scope.table()
            );
            return count != null && count > 0;
        });
    }

    /**
     * Ensures the scope table and its address lookup index exist.
     */
    @Override
    public void ensureScope(DedupScope scope) {
        String table = tableName(scope);
        translate(scope, () -> {
            jdbcTemplate.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        voter_id TEXT NOT NULL UNIQUE,
                        first_name TEXT,
                        middle_name TEXT,
                        last_name TEXT,
                        suffix TEXT,
                        street_number TEXT,
                        street_fraction TEXT,
                        street_name TEXT,
                        unit TEXT,
                        address TEXT,
                        city TEXT,
                        state TEXT,
                        zip TEXT,
                        county TEXT,
                        precinct TEXT,
                        party TEXT,
                        gender TEXT,
                        status_code TEXT,
                        legislative_district TEXT,
                        congressional_district TEXT,
                        birth_date TEXT,
                        registration_date TEXT,
                        last_voted_date TEXT,
                        mailing_address TEXT,
                        mailing_address2 TEXT,
                        mailing_address3 TEXT,
                        mailing_city TEXT,
                        mailing_state TEXT,
                        mailing_zip TEXT,
                        mailing_country TEXT,
                        state_code TEXT NOT NULL,
                        source_row_ref TEXT,
                        imported_at TEXT NOT NULL
                    )
                    """.formatted(table));
            for (String column : ADDED_COLUMNS) {
                ensureColumnExists(table, column);
            }
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_%s_address ON %s (address, city, zip)".formatted(table, table));
            return null;
        });
    }

    @Override
    public void dropScope(DedupScope scope) {
        String table = tableName(scope);
        translate(scope, () -> {
            jdbcTemplate.execute("DROP TABLE IF EXISTS " + table);
            return null;
        });
        log.info("Dropped table {}", table);
    }

    @Override
    public Collection<String> existingVoterIds(DedupScope scope) {
        if (!exists(scope)) {
            return Collections.emptyList();
        }
        String table = tableName(scope);
        return translate(scope, () -> jdbcTemplate.queryForList("SELECT voter_id FROM " + table, String.class));
    }

    @Override
    public InsertResult insert(DedupScope scope, CanonicalRecord record) {
        String table = tableName(scope);
        String placeholders = String.join(", ", Collections.nCopies(RECORD_COLUMNS.size(), "?"));
        String sql = """
                INSERT OR IGNORE INTO %s (%s)
                VALUES (%s)
                """.formatted(table, String.join(", ", RECORD_COLUMNS), placeholders);
        int changed = translate(scope, () -> jdbcTemplate.update(sql,
                record.voterId(),
                record.firstName(),
                record.middleName(),
                record.lastName(),
                record.suffix(),
                record.streetNumber(),
                record.streetFraction(),
                record.streetName(),
                record.unit(),
                record.address(),
                record.city(),
                record.state(),
                record.zip(),
                record.county(),
                record.precinct(),
                record.party(),
                record.gender(),
                record.statusCode(),
                record.legislativeDistrict(),
                record.congressionalDistrict(),
                record.birthDate(),
                record.registrationDate(),
                record.lastVotedDate(),
                record.mailingAddress(),
                record.mailingAddress2(),
                record.mailingAddress3(),
                record.mailingCity(),
                record.mailingState(),
                record.mailingZip(),
                record.mailingCountry(),
                record.stateCode(),
                record.sourceRowRef(),
                Instant.now(clock).toString()
        ));
        return changed == 0 ? InsertResult.DUPLICATE : InsertResult.INSERTED;
    }

    public long count(DedupScope scope) {
        if (!exists(scope)) {
            return 0;
        }
        String table = tableName(scope);
        Long count = translate(scope, () -> jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class));
        return count == null ? 0 : count;
    }

    private <T> T translate(DedupScope scope, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException ex) {
            throw new SinkException(VoterImportConstants.MSG_SINK_FAILED.formatted(scope), ex, isTransient(ex));
        }
    }

    /**
     * Lock contention reported by SQLite is retryable even though Spring cannot classify it.
     */
    static boolean isTransient(DataAccessException ex) {
        if (ex instanceof TransientDataAccessException) {
            return true;
        }
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof SQLiteException sqliteException) {
            String code = sqliteException.getResultCode().name();
            return code.startsWith("SQLITE_BUSY") || code.startsWith("SQLITE_LOCKED");
        }
        return false;
    }

    private void ensureColumnExists(String table, String column) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM pragma_table_info(?) WHERE name = ?",
                Integer.class,
                table,
                column
        );
        if (count == null || count == 0) {
            jdbcTemplate.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " TEXT");
            log.info("Added column {} to {}", column, table);
        }
    }

    private static String tableName(DedupScope scope) {
        if (!scope.table().matches(VoterImportConstants.VALID_TABLE_NAME_REGEX)) {
            throw new IllegalArgumentException(VoterImportConstants.MSG_INVALID_TABLE.formatted(scope.table()));
        }
        return scope.table();
    }
}
