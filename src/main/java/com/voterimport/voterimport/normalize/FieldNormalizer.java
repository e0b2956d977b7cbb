package com.voterimport.voterimport.normalize;

import com.voterimport.voterimport.schema.CanonicalField;
import com.voterimport.voterimport.schema.StateCodes;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Brings raw values into the canonical form of their field type.
 * <p>
 * Every rule's output is a fixed point of the same rule, so normalizing twice gives the same result.
 * Blank input yields {@link #EMPTY}, which marks a present-but-blank value; {@code null} is reserved
 * for fields that are not mapped at all.
 */
public class FieldNormalizer {

    public static final String EMPTY = "";

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern TWO_LETTERS = Pattern.compile("^[A-Z]{2}$");

    private static final Pattern HOUSE_NUMBER_TOKEN = Pattern.compile("^\\d.*");

    /**
     * Generational suffixes kept upper case by name casing.
     */
    private static final Set<String> ROMAN_SUFFIXES = Set.of("II", "III", "IV");

    private static final Set<String> DIRECTIONS = Set.of(
            "N", "S", "E", "W", "NE", "NW", "SE", "SW", "NORTH", "SOUTH", "EAST", "WEST",
            "NORTHEAST", "NORTHWEST", "SOUTHEAST", "SOUTHWEST"
    );

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            ISO_DATE,
            strictDate("M/d/uuuu"),
            strictDate("M-d-uuuu"),
            strictDate("uuuu/M/d")
    );

    private static final DateTimeFormatter EXPORT_DATE_TIME = DateTimeFormatter.ofPattern("M/d/uuuu h:mm:ss a", Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Map<String, String> STREET_ABBREVIATIONS = Map.ofEntries(
            Map.entry("STREET", "ST"), Map.entry("ST", "ST"),
            Map.entry("AVENUE", "AVE"), Map.entry("AV", "AVE"), Map.entry("AVE", "AVE"),
            Map.entry("BOULEVARD", "BLVD"), Map.entry("BLVD", "BLVD"),
            Map.entry("ROAD", "RD"), Map.entry("RD", "RD"),
            Map.entry("DRIVE", "DR"), Map.entry("DR", "DR"),
            Map.entry("LANE", "LN"), Map.entry("LN", "LN"),
            Map.entry("COURT", "CT"), Map.entry("CT", "CT"),
            Map.entry("PLACE", "PL"), Map.entry("PL", "PL"),
            Map.entry("TERRACE", "TER"), Map.entry("TER", "TER"),
            Map.entry("CIRCLE", "CIR"), Map.entry("CIR", "CIR"),
            Map.entry("HIGHWAY", "HWY"), Map.entry("HWY", "HWY"),
            Map.entry("PARKWAY", "PKWY"), Map.entry("PKWY", "PKWY"),
            Map.entry("SQUARE", "SQ"), Map.entry("SQ", "SQ"),
            Map.entry("TRAIL", "TRL"), Map.entry("TRL", "TRL"),
            Map.entry("ALLEY", "ALY"), Map.entry("ALY", "ALY"),
            Map.entry("EXPRESSWAY", "EXPY"), Map.entry("EXPY", "EXPY"),
            Map.entry("FREEWAY", "FWY"), Map.entry("FWY", "FWY"),
            Map.entry("PLAZA", "PLZ"), Map.entry("PLZ", "PLZ"),
            Map.entry("ROUTE", "RTE"), Map.entry("RTE", "RTE"),
            Map.entry("CROSSING", "XING"), Map.entry("XING", "XING"),
            Map.entry("HEIGHTS", "HTS"), Map.entry("HTS", "HTS"),
            Map.entry("WAY", "WAY"),
            Map.entry("LOOP", "LOOP"),
            Map.entry("NORTH", "N"), Map.entry("N", "N"),
            Map.entry("SOUTH", "S"), Map.entry("S", "S"),
            Map.entry("EAST", "E"), Map.entry("E", "E"),
            Map.entry("WEST", "W"), Map.entry("W", "W"),
            Map.entry("NORTHEAST", "NE"), Map.entry("NE", "NE"),
            Map.entry("NORTHWEST", "NW"), Map.entry("NW", "NW"),
            Map.entry("SOUTHEAST", "SE"), Map.entry("SE", "SE"),
            Map.entry("SOUTHWEST", "SW"), Map.entry("SW", "SW")
    );

    public String normalize(CanonicalField field, String raw) throws NormalizationException {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(raw, "raw");
        String value = collapseWhitespace(raw);
        if (value.isEmpty()) {
            return EMPTY;
        }

        return switch (field.type()) {
            case IDENTIFIER, HOUSE_NUMBER, UNIT -> value;
            case NAME -> titleCase(value);
            case STREET -> abbreviateStreet(value);
            case PLACE, CODE -> value.toUpperCase(Locale.ROOT);
            case STATE -> normalizeState(field, raw, value);
            case ZIP -> normalizeZip(field, raw);
            case DATE -> normalizeDate(field, raw, value);
        };
    }

    /**
     * True when the value is null or holds nothing but whitespace, non-breaking spaces included.
     */
    public static boolean isBlank(String raw) {
        return raw == null || collapseWhitespace(raw).isEmpty();
    }

    static String collapseWhitespace(String raw) {
        return WHITESPACE.matcher(raw).replaceAll(" ").trim();
    }

    /**
     * Lower-cases the value and capitalizes a segment's first character when it is a letter; segments are
     * separated by spaces, hyphens and apostrophes. Roman generational suffixes stay upper case.
     */
    private String titleCase(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        StringBuilder out = new StringBuilder(lower.length());
        boolean capitalizeNext = true;
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (c == ' ' || c == '-' || c == '\'' || c == '\u2019') {
                out.append(c);
                capitalizeNext = true;
                continue;
            }
            out.append(capitalizeNext ? Character.toUpperCase(c) : c);
            capitalizeNext = false;
        }

        String[] words = out.toString().split(" ");
        for (int i = 0; i < words.length; i++) {
            String upper = words[i].replace(".", "").replace(",", "").toUpperCase(Locale.ROOT);
            if (ROMAN_SUFFIXES.contains(upper)) {
                words[i] = words[i].toUpperCase(Locale.ROOT);
            }
        }
        return String.join(" ", words);
    }

    /**
     * Abbreviates street types and directions token by token. An {@code ST} opening the street name and
     * followed by more of it reads as Saint and is kept as written ({@code 123 St. Marys Road}).
     */
    private String abbreviateStreet(String value) {
        String[] tokens = value.split(" ");
        int nameStart = 0;
        while (nameStart < tokens.length - 1 && (HOUSE_NUMBER_TOKEN.matcher(tokens[nameStart]).matches()
                || DIRECTIONS.contains(tokenKey(tokens[nameStart])))) {
            nameStart++;
        }
        for (int i = 0; i < tokens.length; i++) {
            String key = tokenKey(tokens[i]);
            if (i == nameStart && i < tokens.length - 1 && key.equals("ST")) {
                continue;
            }
            String abbreviation = STREET_ABBREVIATIONS.get(key);
            if (abbreviation != null) {
                tokens[i] = abbreviation;
            }
        }
        return String.join(" ", tokens);
    }

    private static String tokenKey(String token) {
        String key = token.toUpperCase(Locale.ROOT);
        if (key.length() > 1 && key.endsWith(".")) {
            key = key.substring(0, key.length() - 1);
        }
        return key;
    }

    private String normalizeState(CanonicalField field, String raw, String value) throws NormalizationException {
        String upper = value.replace(".", "").toUpperCase(Locale.ROOT);
        if (TWO_LETTERS.matcher(upper).matches()) {
            if (StateCodes.isAbbreviation(upper)) {
                return upper;
            }
            throw new NormalizationException(field, raw, "unknown state abbreviation");
        }
        Optional<String> abbreviation = StateCodes.abbreviationFor(upper);
        if (abbreviation.isPresent()) {
            return abbreviation.get();
        }
        throw new NormalizationException(field, raw, "unknown state");
    }

    private String normalizeZip(CanonicalField field, String raw) throws NormalizationException {
        String digits = NON_DIGIT.matcher(raw).replaceAll("");
        if (digits.length() == 5) {
            return digits;
        }
        if (digits.length() == 9) {
            return digits.substring(0, 5) + "-" + digits.substring(5);
        }
        throw new NormalizationException(field, raw, "expected 5 or 9 digits but found " + digits.length());
    }

    private String normalizeDate(CanonicalField field, String raw, String value) throws NormalizationException {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format).format(ISO_DATE);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return LocalDateTime.parse(value.toUpperCase(Locale.ROOT), EXPORT_DATE_TIME).toLocalDate().format(ISO_DATE);
        } catch (DateTimeParseException ex) {
            throw new NormalizationException(field, raw, "unrecognized date format");
        }
    }

    private static DateTimeFormatter strictDate(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
