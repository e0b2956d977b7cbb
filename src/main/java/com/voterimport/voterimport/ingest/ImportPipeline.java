package com.voterimport.voterimport.ingest;

import com.voterimport.voterimport.config.ConfigMissingException;
import com.voterimport.voterimport.config.StateConfig;
import com.voterimport.voterimport.dedup.DedupOutcome;
import com.voterimport.voterimport.dedup.DedupScope;
import com.voterimport.voterimport.dedup.Deduplicator;
import com.voterimport.voterimport.normalize.AddressLineParser;
import com.voterimport.voterimport.normalize.FieldNormalizer;
import com.voterimport.voterimport.normalize.NormalizationException;
import com.voterimport.voterimport.schema.CanonicalField;
import com.voterimport.voterimport.schema.FieldMapping;
import com.voterimport.voterimport.storage.InsertResult;
import com.voterimport.voterimport.storage.SinkException;
import com.voterimport.voterimport.storage.StorageSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Routes raw rows through mapping, validation, normalization, deduplication and storage.
 * <p>
 * Row-level rejections are counted and never abort the run. An optional field that cannot be normalized
 * is stored blank and reported as a field warning while the row itself is kept. Missing or incomplete configuration and
 * non-transient sink failures abort it. The run checks the thread's interrupt flag between rows and
 * returns what was committed so far, marked cancelled.
 */
public class ImportPipeline {

    private static final Logger log = LoggerFactory.getLogger(ImportPipeline.class);

    private final FieldNormalizer normalizer;
    private final Deduplicator deduplicator;
    private final int maxRecordedErrors;
    private final int sinkRetryAttempts;

    public ImportPipeline(FieldNormalizer normalizer, Deduplicator deduplicator, int maxRecordedErrors, int sinkRetryAttempts) {
        if (maxRecordedErrors < 0 || sinkRetryAttempts < 0) {
            throw new IllegalArgumentException("Error cap and retry attempts must not be negative");
        }
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
        this.maxRecordedErrors = maxRecordedErrors;
        this.sinkRetryAttempts = sinkRetryAttempts;
    }

    public ImportSummary run(String stateCode, Stream<RawRow> rows, StateConfig config, StorageSink sink, DedupScope scope) {
        if (config == null) {
            throw new ConfigMissingException(stateCode, "the config store");
        }
        config.requireComplete();
        if (!config.stateCode().equalsIgnoreCase(stateCode)) {
            throw new IllegalArgumentException("Config for " + config.stateCode() + " cannot import state " + stateCode);
        }

        Map<CanonicalField, String> columns = new LinkedHashMap<>();
        for (FieldMapping mapping : config.fieldMappings()) {
            columns.putIfAbsent(mapping.canonicalField(), mapping.sourceColumn());
        }

        sink.ensureScope(scope);
        deduplicator.seed(scope, sink.existingVoterIds(scope));
        log.info("Importing {} into {} with config v{}", config.stateCode(), scope, config.version());

        Tally tally = new Tally();
        try {
            Iterator<RawRow> iterator = rows.iterator();
            while (iterator.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Import of {} interrupted after {} rows", scope, tally.rowsSeen);
                    tally.cancelled = true;
                    break;
                }
                RawRow row = iterator.next();
                tally.rowsSeen++;
                List<NormalizationException> warnings = new ArrayList<>();
                try {
                    CanonicalRecord record = toRecord(row, columns, config.stateCode(), warnings);
                    store(scope, sink, record);
                    tally.inserted++;
                    warnings.forEach(warning -> tally.warn(row, warning));
                } catch (RowRejectedException ex) {
                    tally.reject(row, ex);
                }
            }
        } finally {
            deduplicator.release(scope);
        }

        ImportSummary summary = tally.toSummary();
        log.info("Import of {} finished: rows={}, inserted={}, duplicates={}, validation errors={}, normalization errors={},"
                        + " field warnings={}",
                scope, summary.rowsSeen(), summary.inserted(), summary.duplicates(),
                summary.validationErrors(), summary.normalizationErrors(), summary.fieldWarnings());
        return summary;
    }

    CanonicalRecord toRecord(RawRow row, Map<CanonicalField, String> columns, String stateCode,
                             List<NormalizationException> warnings) throws RowRejectedException {
        requirePresent(row, columns, CanonicalField.VOTER_ID);
        boolean split = columns.containsKey(CanonicalField.STREET_NUMBER) && columns.containsKey(CanonicalField.STREET_NAME);
        if (split) {
            requirePresent(row, columns, CanonicalField.STREET_NUMBER);
            requirePresent(row, columns, CanonicalField.STREET_NAME);
        } else {
            requirePresent(row, columns, CanonicalField.ADDRESS_LINE);
        }

        Map<CanonicalField, String> values = new EnumMap<>(CanonicalField.class);
        for (Map.Entry<CanonicalField, String> entry : columns.entrySet()) {
            CanonicalField field = entry.getKey();
            String raw = row.get(entry.getValue());
            try {
                values.put(field, normalizer.normalize(field, raw == null ? FieldNormalizer.EMPTY : raw));
            } catch (NormalizationException ex) {
                if (field.isRowCritical()) {
                    throw ex;
                }
                values.put(field, FieldNormalizer.EMPTY);
                warnings.add(ex);
            }
        }

        String separateUnit = joinMapped(values, CanonicalField.UNIT_TYPE, CanonicalField.UNIT);
        String streetNumber;
        String streetFraction;
        String streetName;
        String unit;
        String address;
        if (split) {
            streetNumber = values.get(CanonicalField.STREET_NUMBER);
            streetFraction = values.get(CanonicalField.STREET_FRACTION);
            streetName = joinMapped(values, CanonicalField.STREET_PRE_DIRECTION, CanonicalField.STREET_NAME,
                    CanonicalField.STREET_TYPE, CanonicalField.STREET_POST_DIRECTION);
            unit = separateUnit;
            address = joinNonEmpty(streetNumber, streetFraction, streetName, unit);
        } else {
            String line = values.get(CanonicalField.ADDRESS_LINE);
            AddressLineParser.ParsedAddress parsed = AddressLineParser.parse(line);
            streetNumber = parsed.streetNumber();
            streetFraction = parsed.streetFraction();
            streetName = parsed.streetName();
            if (separateUnit != null && !separateUnit.isEmpty()) {
                unit = separateUnit;
                address = joinNonEmpty(line, separateUnit);
            } else {
                unit = parsed.unit();
                address = line;
            }
        }

        String state = values.get(CanonicalField.STATE);
        if (state == null || state.isEmpty()) {
            state = stateCode;
        }

        return new CanonicalRecord(
                values.get(CanonicalField.VOTER_ID),
                values.get(CanonicalField.FIRST_NAME),
                values.get(CanonicalField.MIDDLE_NAME),
                values.get(CanonicalField.LAST_NAME),
                values.get(CanonicalField.SUFFIX),
                streetNumber,
                streetFraction,
                streetName,
                unit,
                address,
                values.get(CanonicalField.CITY),
                state,
                values.get(CanonicalField.ZIP),
                values.get(CanonicalField.COUNTY),
                values.get(CanonicalField.PRECINCT),
                values.get(CanonicalField.PARTY),
                values.get(CanonicalField.GENDER),
                values.get(CanonicalField.STATUS_CODE),
                values.get(CanonicalField.LEGISLATIVE_DISTRICT),
                values.get(CanonicalField.CONGRESSIONAL_DISTRICT),
                values.get(CanonicalField.BIRTH_DATE),
                values.get(CanonicalField.REGISTRATION_DATE),
                values.get(CanonicalField.LAST_VOTED_DATE),
                values.get(CanonicalField.MAILING_ADDRESS),
                values.get(CanonicalField.MAILING_ADDRESS2),
                values.get(CanonicalField.MAILING_ADDRESS3),
                values.get(CanonicalField.MAILING_CITY),
                values.get(CanonicalField.MAILING_STATE),
                values.get(CanonicalField.MAILING_ZIP),
                values.get(CanonicalField.MAILING_COUNTRY),
                stateCode,
                Long.toString(row.rowNumber())
        );
    }

    private void store(DedupScope scope, StorageSink sink, CanonicalRecord record) throws DuplicateVoterIdException {
        if (deduplicator.checkAndRecord(scope, record.voterId()) == DedupOutcome.DUPLICATE) {
            throw new DuplicateVoterIdException(record.voterId(), scope.toString());
        }
        InsertResult result;
        try {
            result = insertWithRetry(scope, sink, record);
        } catch (SinkException ex) {
            deduplicator.forget(scope, record.voterId());
            throw ex;
        }
        // another writer committed the id first; it stays recorded
        if (result == InsertResult.DUPLICATE) {
            throw new DuplicateVoterIdException(record.voterId(), scope.toString());
        }
    }

    private InsertResult insertWithRetry(DedupScope scope, StorageSink sink, CanonicalRecord record) {
        int attempt = 0;
        while (true) {
            try {
                return sink.insert(scope, record);
            } catch (SinkException ex) {
                if (!ex.isTransient() || attempt >= sinkRetryAttempts) {
                    throw ex;
                }
                attempt++;
                log.warn("Transient storage failure for voter {} in {}, retry {}/{}: {}",
                        record.voterId(), scope, attempt, sinkRetryAttempts, ex.getMessage());
            }
        }
    }

    private static void requirePresent(RawRow row, Map<CanonicalField, String> columns, CanonicalField field) throws ValidationException {
        String raw = row.get(columns.get(field));
        if (FieldNormalizer.isBlank(raw)) {
            throw new ValidationException(field, raw);
        }
    }

    /**
     * Joins the non-empty values of the given fields; null when none of them is mapped.
     */
    private static String joinMapped(Map<CanonicalField, String> values, CanonicalField... fields) {
        boolean anyMapped = false;
        List<String> parts = new ArrayList<>(fields.length);
        for (CanonicalField field : fields) {
            if (values.containsKey(field)) {
                anyMapped = true;
                parts.add(values.get(field));
            }
        }
        return anyMapped ? joinNonEmpty(parts.toArray(new String[0])) : null;
    }

    private static String joinNonEmpty(String... parts) {
        StringBuilder out = new StringBuilder();
        for (String part : parts) {
            if (part != null && !part.isEmpty()) {
                if (out.length() > 0) {
                    out.append(' ');
                }
                out.append(part);
            }
        }
        return out.toString();
    }

    private final class Tally {
        private long rowsSeen;
        private long inserted;
        private long duplicates;
        private long validationErrors;
        private long normalizationErrors;
        private long fieldWarnings;
        private boolean cancelled;
        private final List<RowError> errors = new ArrayList<>();

        private void reject(RawRow row, RowRejectedException ex) {
            switch (ex.kind()) {
                case VALIDATION -> validationErrors++;
                case NORMALIZATION -> normalizationErrors++;
                case DUPLICATE -> duplicates++;
                case FIELD_WARNING -> fieldWarnings++;
            }
            log.debug("Row {} rejected: {}", row.rowNumber(), ex.getMessage());
            record(RowError.of(row, ex));
        }

        private void warn(RawRow row, NormalizationException ex) {
            fieldWarnings++;
            log.debug("Row {} kept with {} stored blank: {}", row.rowNumber(), ex.getField().key(), ex.getMessage());
            record(new RowError(row.rowNumber(), RejectionKind.FIELD_WARNING, ex.getField(), ex.getValue(),
                    ex.getMessage() + "; stored blank"));
        }

        private void record(RowError error) {
            if (errors.size() < maxRecordedErrors) {
                errors.add(error);
            }
        }

        private ImportSummary toSummary() {
            return new ImportSummary(rowsSeen, inserted, duplicates, validationErrors, normalizationErrors, fieldWarnings,
                    errors, cancelled);
        }
    }
}
