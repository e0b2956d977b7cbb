package com.voterimport.voterimport.schema;

import com.voterimport.voterimport.ingest.RawRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Infers how an extract's columns map onto canonical fields from header text and sample values.
 * <p>
 * Each header is tried against canonical names, then known synonyms, then synonyms contained in the
 * header, and finally against value signatures of the sampled rows. Output depends only on the header
 * order and the first {@code sampleSize} sample rows.
 */
public class SchemaDetector {

    private static final Logger log = LoggerFactory.getLogger(SchemaDetector.class);

    public static final double EXACT_CONFIDENCE = 1.0;
    public static final double ALIAS_CONFIDENCE = 0.8;
    public static final double CONTAINED_ALIAS_CONFIDENCE = 0.6;

    private static final Pattern ZIP_VALUE = Pattern.compile("^\\d{5}(-?\\d{4})?$");
    private static final Pattern STATE_VALUE = Pattern.compile("^[A-Z]{2}$");
    private static final Pattern STREET_LINE_VALUE = Pattern.compile("^\\d+\\S*\\s+[A-Za-z].*$");
    private static final Pattern PLACE_VALUE = Pattern.compile(".*[A-Za-z].*");

    /**
     * Share of sample values that must fit the field's value shape before a contained synonym is trusted.
     */
    static final double CONTAINED_VALUE_AGREEMENT = 0.5;

    private final AliasCatalog aliasCatalog;
    private final double minConfidence;
    private final int sampleSize;

    public SchemaDetector(AliasCatalog aliasCatalog, double minConfidence, int sampleSize) {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("Minimum confidence must be within [0,1]: " + minConfidence);
        }
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("Sample size must be positive: " + sampleSize);
        }
        this.aliasCatalog = aliasCatalog;
        this.minConfidence = minConfidence;
        this.sampleSize = sampleSize;
    }

    public DetectionResult detect(List<String> headers, List<RawRow> sampleRows) {
        List<RawRow> samples = sampleRows == null ? List.of() : sampleRows.stream().limit(sampleSize).toList();
        List<String> warnings = new ArrayList<>();
        List<String> unmappedColumns = new ArrayList<>();
        Map<String, Integer> headerOrder = new HashMap<>();
        Map<CanonicalField, FieldMapping> chosen = new EnumMap<>(CanonicalField.class);

        for (String header : headers) {
            if (header == null || header.isBlank() || headerOrder.containsKey(header)) {
                if (header != null && headerOrder.containsKey(header)) {
                    warn(warnings, "Duplicate column '%s' ignored".formatted(header));
                }
                continue;
            }
            headerOrder.put(header, headerOrder.size());

            Optional<FieldMapping> candidate = candidateFor(header, samples);
            if (candidate.isEmpty() || candidate.get().confidence() < minConfidence) {
                unmappedColumns.add(header);
                continue;
            }

            FieldMapping mapping = candidate.get();
            FieldMapping current = chosen.get(mapping.canonicalField());
            if (current == null) {
                chosen.put(mapping.canonicalField(), mapping);
            } else if (mapping.confidence() > current.confidence()) {
                warn(warnings, conflictMessage(mapping, current));
                chosen.put(mapping.canonicalField(), mapping);
                unmappedColumns.add(current.sourceColumn());
            } else {
                warn(warnings, conflictMessage(current, mapping));
                unmappedColumns.add(header);
            }
        }

        resolveAddressRepresentation(chosen, warnings, unmappedColumns);

        List<FieldMapping> mappings = new ArrayList<>(chosen.values());
        mappings.sort(Comparator.comparingInt(m -> headerOrder.get(m.sourceColumn())));
        unmappedColumns.sort(Comparator.comparingInt(headerOrder::get));

        List<CanonicalField> unmappedFields = new ArrayList<>();
        for (CanonicalField field : CanonicalField.values()) {
            if (!chosen.containsKey(field)) {
                unmappedFields.add(field);
            }
        }
        List<MappingRequirement> unmet = MappingRequirement.unmet(chosen.keySet());
        if (!unmet.isEmpty()) {
            log.warn("Required fields without a mapping: {}", unmet);
        }

        return new DetectionResult(mappings, unmet, unmappedFields, unmappedColumns, warnings);
    }

    /**
     * Returns the best single candidate for one header, or empty when nothing matches.
     */
    private Optional<FieldMapping> candidateFor(String header, List<RawRow> samples) {
        String normalized = AliasCatalog.normalizeHeader(header);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }

        Optional<CanonicalField> exact = aliasCatalog.exactMatch(normalized);
        if (exact.isPresent()) {
            return Optional.of(new FieldMapping(header, exact.get(), EXACT_CONFIDENCE, DetectionMethod.EXACT));
        }

        Optional<CanonicalField> alias = aliasCatalog.aliasMatch(normalized);
        if (alias.isPresent()) {
            return Optional.of(new FieldMapping(header, alias.get(), ALIAS_CONFIDENCE, DetectionMethod.ALIAS));
        }

        Optional<CanonicalField> contained = aliasCatalog.containedMatch(normalized);
        if (contained.isPresent()) {
            if (valuesAgree(contained.get(), header, samples)) {
                return Optional.of(new FieldMapping(
                        header, contained.get(), CONTAINED_ALIAS_CONFIDENCE, DetectionMethod.ALIAS));
            }
            log.debug("Column '{}' names {} but its sampled values do not fit; trying value patterns",
                    header, contained.get().key());
        }

        // every value signature describes a residential address part
        if (AliasCatalog.isMailingHeader(normalized)) {
            return Optional.empty();
        }
        return patternCandidate(header, samples);
    }

    private Optional<FieldMapping> patternCandidate(String header, List<RawRow> samples) {
        List<String> values = sampleValues(header, samples);
        if (values.isEmpty()) {
            return Optional.empty();
        }

        double zip = fractionMatching(values, ZIP_VALUE, false);
        double state = fractionMatching(values, STATE_VALUE, true);
        double street = fractionMatching(values, STREET_LINE_VALUE, false);

        CanonicalField field = CanonicalField.ZIP;
        double best = zip;
        if (state > best) {
            field = CanonicalField.STATE;
            best = state;
        }
        if (street > best) {
            field = CanonicalField.ADDRESS_LINE;
            best = street;
        }
        if (best == 0.0) {
            return Optional.empty();
        }
        log.debug("Column '{}' matched {} value pattern in {} of sampled values", header, field.key(), best);
        return Optional.of(new FieldMapping(header, field, best, DetectionMethod.PATTERN));
    }

    /**
     * Checks sampled values of a contained-synonym match for fields with a fixed value shape, so that a
     * header such as {@code State House District} holding district numbers is not taken for {@code state}.
     * Without sample values the header alone decides.
     */
    private boolean valuesAgree(CanonicalField field, String header, List<RawRow> samples) {
        Predicate<String> fits;
        if (field.type() == FieldType.STATE) {
            fits = SchemaDetector::isStateValue;
        } else if (field.type() == FieldType.ZIP) {
            fits = value -> ZIP_VALUE.matcher(value).matches();
        } else if (field == CanonicalField.CITY || field == CanonicalField.MAILING_CITY) {
            fits = value -> PLACE_VALUE.matcher(value).matches();
        } else {
            return true;
        }
        List<String> values = sampleValues(header, samples);
        if (values.isEmpty()) {
            return true;
        }
        long matching = values.stream().filter(fits).count();
        return (double) matching / values.size() >= CONTAINED_VALUE_AGREEMENT;
    }

    private static boolean isStateValue(String value) {
        String upper = value.replace(".", "").toUpperCase(Locale.ROOT);
        return StateCodes.isAbbreviation(upper) || StateCodes.abbreviationFor(upper).isPresent();
    }

    private List<String> sampleValues(String header, List<RawRow> samples) {
        List<String> values = new ArrayList<>();
        for (RawRow row : samples) {
            String value = row.get(header);
            if (value != null && !value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    private double fractionMatching(List<String> values, Pattern pattern, boolean stateCode) {
        int matches = 0;
        for (String value : values) {
            if (pattern.matcher(value).matches() && (!stateCode || StateCodes.isAbbreviation(value))) {
                matches++;
            }
        }
        return (double) matches / values.size();
    }

    /**
     * Keeps exactly one street representation: the split columns when complete and at least as
     * confident as the combined line, otherwise the combined line.
     */
    private void resolveAddressRepresentation(
            Map<CanonicalField, FieldMapping> chosen, List<String> warnings, List<String> unmappedColumns) {
        FieldMapping combined = chosen.get(CanonicalField.ADDRESS_LINE);
        if (combined == null) {
            return;
        }
        FieldMapping number = chosen.get(CanonicalField.STREET_NUMBER);
        FieldMapping name = chosen.get(CanonicalField.STREET_NAME);
        boolean splitComplete = number != null && name != null;

        if (splitComplete && (number.confidence() + name.confidence()) / 2.0 >= combined.confidence()) {
            chosen.remove(CanonicalField.ADDRESS_LINE);
            unmappedColumns.add(combined.sourceColumn());
            warn(warnings, "Split street columns preferred over combined address column '%s'"
                    .formatted(combined.sourceColumn()));
            return;
        }

        Set<String> dropped = new HashSet<>();
        for (CanonicalField field : CanonicalField.SPLIT_STREET_FIELDS) {
            FieldMapping removed = chosen.remove(field);
            if (removed != null) {
                dropped.add(removed.sourceColumn());
                unmappedColumns.add(removed.sourceColumn());
            }
        }
        if (!dropped.isEmpty()) {
            warn(warnings, "Combined address column '%s' preferred over street columns %s"
                    .formatted(combined.sourceColumn(), dropped.stream().sorted().toList()));
        }
    }

    private String conflictMessage(FieldMapping kept, FieldMapping discarded) {
        return "Columns '%s' (%.2f) and '%s' (%.2f) both match %s; keeping '%s'".formatted(
                kept.sourceColumn(), kept.confidence(),
                discarded.sourceColumn(), discarded.confidence(),
                kept.canonicalField().key(), kept.sourceColumn());
    }

    private void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}
