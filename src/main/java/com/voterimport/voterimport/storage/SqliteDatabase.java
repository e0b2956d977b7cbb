package com.voterimport.voterimport.storage;

import com.voterimport.voterimport.config.VoterImportConstants;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Single-connection pool over one SQLite database file, shared by the sink, the run ledger and the analyzer of a run.
 */
public final class SqliteDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteDatabase.class);

    private static final String BUSY_TIMEOUT_MILLIS = "5000";

    private final Path path;
    private final HikariDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;

    private SqliteDatabase(Path path, HikariDataSource dataSource) {
        this.path = path;
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    public static SqliteDatabase open(Path dbPath) {
        Path absolute = dbPath.toAbsolutePath();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create database directory for " + absolute, ex);
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(VoterImportConstants.JDBC_URL_PREFIX + absolute);
        config.setMaximumPoolSize(1);
        config.setPoolName("voter-sqlite");
        config.addDataSourceProperty("busy_timeout", BUSY_TIMEOUT_MILLIS);
        log.debug("Opening SQLite database {}", absolute);
        return new SqliteDatabase(absolute, new HikariDataSource(config));
    }

    public Path path() {
        return path;
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
