package com.voterimport.voterimport.normalize;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits a normalized combined street line into house number, house number fraction, street name and unit.
 */
public final class AddressLineParser {

    private static final Pattern HOUSE_NUMBER = Pattern.compile("^\\d+[A-Za-z]?(-\\d+[A-Za-z]?)?$");
    private static final Pattern FRACTION = Pattern.compile("^\\d+/\\d+$");

    private static final Set<String> UNIT_DESIGNATORS = Set.of(
            "APT", "APARTMENT", "UNIT", "STE", "SUITE", "LOT", "SPC", "SPACE",
            "RM", "ROOM", "FL", "FLOOR", "BLDG", "TRLR", "DEPT"
    );

    private AddressLineParser() {
    }

    public static ParsedAddress parse(String line) {
        if (line == null || line.isBlank()) {
            return new ParsedAddress(FieldNormalizer.EMPTY, FieldNormalizer.EMPTY, FieldNormalizer.EMPTY, FieldNormalizer.EMPTY);
        }
        String[] tokens = FieldNormalizer.collapseWhitespace(line).split(" ");

        int start = 0;
        String number = FieldNormalizer.EMPTY;
        String fraction = FieldNormalizer.EMPTY;
        if (HOUSE_NUMBER.matcher(tokens[0]).matches()) {
            number = tokens[0];
            start = 1;
            if (tokens.length > 1 && FRACTION.matcher(tokens[1]).matches()) {
                fraction = tokens[1];
                start = 2;
            }
        }

        // the street name keeps at least one token
        int unitStart = tokens.length;
        for (int i = start + 1; i < tokens.length; i++) {
            if (isUnitDesignator(tokens[i])) {
                unitStart = i;
                break;
            }
        }

        String streetName = join(tokens, start, unitStart);
        String unit = join(tokens, unitStart, tokens.length);
        return new ParsedAddress(number, fraction, streetName, unit);
    }

    private static boolean isUnitDesignator(String token) {
        if (token.startsWith("#")) {
            return true;
        }
        String key = token.toUpperCase(Locale.ROOT);
        if (key.endsWith(".")) {
            key = key.substring(0, key.length() - 1);
        }
        return UNIT_DESIGNATORS.contains(key);
    }

    private static String join(String[] tokens, int from, int to) {
        if (from >= to) {
            return FieldNormalizer.EMPTY;
        }
        return String.join(" ", Arrays.copyOfRange(tokens, from, to));
    }

    public record ParsedAddress(String streetNumber, String streetFraction, String streetName, String unit) {
    }
}
