package com.voterimport.voterimport.service;

import com.voterimport.voterimport.config.ConfigBuilder;
import com.voterimport.voterimport.config.StateConfig;
import com.voterimport.voterimport.config.StateConfigStore;
import com.voterimport.voterimport.config.VoterImportConstants;
import com.voterimport.voterimport.config.VoterImportProperties;
import com.voterimport.voterimport.dedup.DedupScope;
import com.voterimport.voterimport.ingest.CsvRawRowReader;
import com.voterimport.voterimport.ingest.ImportPipeline;
import com.voterimport.voterimport.ingest.ImportSummary;
import com.voterimport.voterimport.ingest.RawRow;
import com.voterimport.voterimport.schema.DetectionResult;
import com.voterimport.voterimport.schema.FieldMapping;
import com.voterimport.voterimport.schema.SchemaDetector;
import com.voterimport.voterimport.storage.DuplicateAddressAnalyzer;
import com.voterimport.voterimport.storage.DuplicateAddressReport;
import com.voterimport.voterimport.storage.ImportRunRepository;
import com.voterimport.voterimport.storage.SqliteDatabase;
import com.voterimport.voterimport.storage.SqliteStorageSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Orchestrates the three command flows: onboarding a state's extract format, importing an extract into the
 * state's table with a run ledger entry, and reporting addresses shared by many voters.
 * <p>
 * Imports into the same scope are serialized within the process; different scopes proceed independently.
 */
@Service
public class ImportService {

    private static final Logger log = LoggerFactory.getLogger(ImportService.class);

    private final SchemaDetector schemaDetector;
    private final ConfigBuilder configBuilder;
    private final ImportPipeline importPipeline;
    private final VoterImportProperties properties;
    private final Clock clock;
    private final Map<DedupScope, ReentrantLock> scopeLocks = new ConcurrentHashMap<>();

    public ImportService(SchemaDetector schemaDetector, ConfigBuilder configBuilder, ImportPipeline importPipeline,
                         VoterImportProperties properties, Clock clock) {
        this.schemaDetector = schemaDetector;
        this.configBuilder = configBuilder;
        this.importPipeline = importPipeline;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Detects mappings from the extract's header and leading sample rows, merges them with any previous config
     * for the state and saves the result.
     */
    public OnboardResult onboard(String stateCode, Path input, RunOptions options) {
        String state = requireStateCode(stateCode);
        StateConfigStore store = new StateConfigStore(options.configDir());
        StateConfig existing = store.load(state).orElse(null);

        try (CsvRawRowReader reader = new CsvRawRowReader(input)) {
            List<String> headers = reader.headers();
            List<RawRow> sample;
            try (Stream<RawRow> rows = reader.rows()) {
                sample = rows.limit(properties.getSampleSize()).toList();
            }
            log.info("Onboarding {} from {} ({}): {} columns, {} sample rows",
                    state, input, reader.charset(), headers.size(), sample.size());

            DetectionResult detection = schemaDetector.detect(headers, sample);
            StateConfig config = configBuilder.merge(state, headers, detection, existing)
                    .withDelimiter(reader.delimiter());
            config = configBuilder.withManualMappings(config, options.manualMappings());
            if (!config.isComplete()) {
                log.warn("Configuration for {} is incomplete; unmapped: {}", state, config.missingRequirements());
            }
            Path path = store.save(config);
            return new OnboardResult(config, detection, path);
        }
    }

    /**
     * Imports the extract with the state's saved config and records the run in the ledger.
     */
    public ImportOutcome importFile(String stateCode, Path input, RunOptions options) {
        String state = requireStateCode(stateCode);
        StateConfig config = new StateConfigStore(options.configDir()).require(state);
        config.requireComplete();
        DedupScope scope = options.table() == null ? DedupScope.forState(state) : new DedupScope(state, options.table());

        ReentrantLock lock = scopeLocks.computeIfAbsent(scope, key -> new ReentrantLock());
        lock.lock();
        try (SqliteDatabase database = SqliteDatabase.open(options.dbPath());
             CsvRawRowReader reader = new CsvRawRowReader(input, config.delimiter())) {
            log.info("Reading {} as {} with delimiter '{}'", input, reader.charset(), reader.delimiter());
            warnOnMissingColumns(config, reader.headers());
            SqliteStorageSink sink = new SqliteStorageSink(database.jdbcTemplate(), clock);
            ImportRunRepository runs = new ImportRunRepository(database.jdbcTemplate(), clock);
            if (options.force()) {
                sink.dropScope(scope);
            }

            long runId = runs.startRun(state, scope.table(), input.getFileName().toString(), config.version());
            try (Stream<RawRow> rows = reader.rows()) {
                Stream<RawRow> limited = options.limit() == null ? rows : rows.limit(options.limit());
                ImportSummary summary = importPipeline.run(state, limited, config, sink, scope);
                runs.completeRun(runId, summary);
                return new ImportOutcome(runId, scope, summary, sink.count(scope));
            } catch (RuntimeException ex) {
                markFailed(runs, runId, ex);
                throw ex;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports addresses with at least the threshold number of voters and writes the Markdown when an output is set.
     */
    public AnalysisOutcome analyzeAddresses(String stateCode, RunOptions options) {
        String state = requireStateCode(stateCode);
        DedupScope scope = options.table() == null ? DedupScope.forState(state) : new DedupScope(state, options.table());

        try (SqliteDatabase database = SqliteDatabase.open(options.dbPath())) {
            SqliteStorageSink sink = new SqliteStorageSink(database.jdbcTemplate(), clock);
            if (!sink.exists(scope)) {
                throw new IllegalStateException("No imported table " + scope.table() + " in " + database.path());
            }
            DuplicateAddressAnalyzer analyzer = new DuplicateAddressAnalyzer(database.jdbcTemplate());
            DuplicateAddressReport report = analyzer.analyze(scope, options.threshold());
            String markdown = analyzer.toMarkdown(report);
            if (options.output() == null) {
                return new AnalysisOutcome(report, markdown, null);
            }
            writeReport(options.output(), markdown);
            return new AnalysisOutcome(report, markdown, options.output());
        }
    }

    private void warnOnMissingColumns(StateConfig config, List<String> headers) {
        Set<String> present = new HashSet<>(headers);
        for (FieldMapping mapping : config.fieldMappings()) {
            if (!present.contains(mapping.sourceColumn())) {
                log.warn("Column '{}' mapped to {} is not in the input; its values are treated as blank. Re-run onboard.",
                        mapping.sourceColumn(), mapping.canonicalField().key());
            }
        }
    }

    private void markFailed(ImportRunRepository runs, long runId, RuntimeException cause) {
        try {
            runs.failRun(runId, cause.getMessage());
        } catch (RuntimeException ledgerFailure) {
            cause.addSuppressed(ledgerFailure);
        }
    }

    private void writeReport(Path output, String markdown) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, markdown, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to write report: " + output, ex);
        }
        log.info("Wrote duplicate address report to {}", output);
    }

    static String requireStateCode(String stateCode) {
        if (stateCode == null || !stateCode.trim().matches(VoterImportConstants.VALID_STATE_CODE_REGEX)) {
            throw new IllegalArgumentException(VoterImportConstants.MSG_INVALID_STATE_CODE.formatted(stateCode));
        }
        return stateCode.trim().toUpperCase(Locale.ROOT);
    }
}
