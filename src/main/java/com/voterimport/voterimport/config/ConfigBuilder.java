package com.voterimport.voterimport.config;

import com.voterimport.voterimport.ingest.RawRow;
import com.voterimport.voterimport.schema.CanonicalField;
import com.voterimport.voterimport.schema.DetectionMethod;
import com.voterimport.voterimport.schema.DetectionResult;
import com.voterimport.voterimport.schema.FieldMapping;
import com.voterimport.voterimport.schema.MappingRequirement;
import com.voterimport.voterimport.schema.SchemaDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds state configs during onboarding by merging freshly detected mappings with a previous config.
 * <p>
 * Mappings of the previous config win while their source column is still present. Fields whose column
 * disappeared are flagged for re-confirmation and take the detected replacement when there is one.
 */
public class ConfigBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConfigBuilder.class);

    private final SchemaDetector schemaDetector;
    private final Clock clock;

    public ConfigBuilder(SchemaDetector schemaDetector, Clock clock) {
        this.schemaDetector = schemaDetector;
        this.clock = clock;
    }

    public StateConfig build(String stateCode, List<String> headers, List<RawRow> sampleRows, StateConfig existing) {
        return merge(stateCode, headers, schemaDetector.detect(headers, sampleRows), existing);
    }

    public StateConfig merge(String stateCode, List<String> headers, DetectionResult detection, StateConfig existing) {
        Set<String> headerSet = new HashSet<>(headers);
        Map<CanonicalField, FieldMapping> merged = new EnumMap<>(CanonicalField.class);
        Set<CanonicalField> flagged = new LinkedHashSet<>();

        if (existing != null) {
            for (FieldMapping previous : existing.fieldMappings()) {
                if (headerSet.contains(previous.sourceColumn())) {
                    merged.put(previous.canonicalField(), previous);
                } else {
                    log.warn("Column '{}' previously mapped to {} is missing from the {} extract",
                            previous.sourceColumn(), previous.canonicalField().key(), stateCode);
                    flagged.add(previous.canonicalField());
                }
            }
            for (CanonicalField field : existing.needsConfirmation()) {
                FieldMapping kept = merged.get(field);
                if (kept == null || kept.method() != DetectionMethod.MANUAL) {
                    flagged.add(field);
                }
            }
        }

        boolean keptCombined = merged.containsKey(CanonicalField.ADDRESS_LINE);
        boolean keptSplit = merged.keySet().stream().anyMatch(CanonicalField.SPLIT_STREET_FIELDS::contains);
        Set<String> claimedColumns = new HashSet<>();
        merged.values().forEach(m -> claimedColumns.add(m.sourceColumn()));

        for (FieldMapping detected : detection.mappings()) {
            CanonicalField field = detected.canonicalField();
            if (merged.containsKey(field) || claimedColumns.contains(detected.sourceColumn())) {
                continue;
            }
            if (keptCombined && CanonicalField.SPLIT_STREET_FIELDS.contains(field)) {
                continue;
            }
            if (keptSplit && field == CanonicalField.ADDRESS_LINE) {
                continue;
            }
            merged.put(field, detected);
            claimedColumns.add(detected.sourceColumn());
        }

        if (existing != null) {
            List<MappingRequirement> lost = MappingRequirement.unmet(merged.keySet());
            for (MappingRequirement requirement : lost) {
                if (requirement.isSatisfiedBy(existing.mappedFields())) {
                    log.warn("Required mapping {} lost for state {}", requirement.description(), stateCode);
                    flagged.addAll(fieldsOf(requirement));
                }
            }
        }

        List<FieldMapping> mappings = orderByHeader(merged.values(), headers);
        Instant now = clock.instant();
        int version = 1;
        Instant createdAt = now;
        if (existing != null) {
            createdAt = existing.createdAt() == null ? now : existing.createdAt();
            version = mappings.equals(existing.fieldMappings()) ? existing.version() : existing.version() + 1;
        }
        String delimiter = existing == null ? null : existing.delimiter();

        return new StateConfig(stateCode, version, delimiter, headers, mappings,
                new ArrayList<>(flagged), createdAt, now);
    }

    /**
     * Pins columns to fields as confirmed manual mappings, replacing whatever mapped either side before.
     */
    public StateConfig withManualMappings(StateConfig config, Map<String, CanonicalField> manual) {
        if (manual.isEmpty()) {
            return config;
        }
        List<FieldMapping> mappings = new ArrayList<>(config.fieldMappings());
        Set<CanonicalField> flagged = new LinkedHashSet<>(config.needsConfirmation());
        manual.forEach((column, field) -> {
            if (!config.columnNames().isEmpty() && !config.columnNames().contains(column)) {
                throw new IllegalArgumentException(
                        VoterImportConstants.MSG_UNKNOWN_COLUMN.formatted(column, config.stateCode()));
            }
            mappings.removeIf(m -> m.canonicalField() == field || m.sourceColumn().equals(column));
            mappings.add(new FieldMapping(column, field, 1.0, DetectionMethod.MANUAL));
            flagged.remove(field);
        });

        List<FieldMapping> ordered = orderByHeader(mappings, config.columnNames());
        int version = ordered.equals(config.fieldMappings()) ? config.version() : config.version() + 1;
        return new StateConfig(config.stateCode(), version, config.delimiter(), config.columnNames(), ordered,
                new ArrayList<>(flagged), config.createdAt(), clock.instant());
    }

    private List<FieldMapping> orderByHeader(Iterable<FieldMapping> mappings, List<String> headers) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            position.putIfAbsent(headers.get(i), i);
        }
        List<FieldMapping> ordered = new ArrayList<>();
        mappings.forEach(ordered::add);
        ordered.sort(Comparator
                .comparingInt((FieldMapping m) -> position.getOrDefault(m.sourceColumn(), Integer.MAX_VALUE))
                .thenComparingInt(m -> m.canonicalField().ordinal()));
        return ordered;
    }

    private List<CanonicalField> fieldsOf(MappingRequirement requirement) {
        return switch (requirement) {
            case VOTER_ID -> List.of(CanonicalField.VOTER_ID);
            case ADDRESS -> List.of(CanonicalField.ADDRESS_LINE, CanonicalField.STREET_NUMBER, CanonicalField.STREET_NAME);
        };
    }
}
