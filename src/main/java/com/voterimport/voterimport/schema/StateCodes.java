package com.voterimport.voterimport.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * US state, district and territory postal abbreviations.
 */
public final class StateCodes {

    private static final Map<String, String> ABBREVIATION_BY_NAME = buildNames();

    private static final Set<String> ABBREVIATIONS = Set.copyOf(ABBREVIATION_BY_NAME.values());

    private StateCodes() {
    }

    public static boolean isAbbreviation(String value) {
        return value != null && ABBREVIATIONS.contains(value);
    }

    /**
     * Resolves an upper-case full state name (single spaces) to its abbreviation.
     */
    public static Optional<String> abbreviationFor(String upperCaseName) {
        return Optional.ofNullable(ABBREVIATION_BY_NAME.get(upperCaseName.toUpperCase(Locale.ROOT)));
    }

    private static Map<String, String> buildNames() {
        Map<String, String> names = new LinkedHashMap<>();
        names.put("ALABAMA", "AL");
        names.put("ALASKA", "AK");
        names.put("ARIZONA", "AZ");
        names.put("ARKANSAS", "AR");
        names.put("CALIFORNIA", "CA");
        names.put("COLORADO", "CO");
        names.put("CONNECTICUT", "CT");
        names.put("DELAWARE", "DE");
        names.put("DISTRICT OF COLUMBIA", "DC");
        names.put("FLORIDA", "FL");
        names.put("GEORGIA", "GA");
        names.put("HAWAII", "HI");
        names.put("IDAHO", "ID");
        names.put("ILLINOIS", "IL");
        names.put("INDIANA", "IN");
        names.put("IOWA", "IA");
        names.put("KANSAS", "KS");
        names.put("KENTUCKY", "KY");
        names.put("LOUISIANA", "LA");
        names.put("MAINE", "ME");
        names.put("MARYLAND", "MD");
        names.put("MASSACHUSETTS", "MA");
        names.put("MICHIGAN", "MI");
        names.put("MINNESOTA", "MN");
        names.put("MISSISSIPPI", "MS");
        names.put("MISSOURI", "MO");
        names.put("MONTANA", "MT");
        names.put("NEBRASKA", "NE");
        names.put("NEVADA", "NV");
        names.put("NEW HAMPSHIRE", "NH");
        names.put("NEW JERSEY", "NJ");
        names.put("NEW MEXICO", "NM");
        names.put("NEW YORK", "NY");
        names.put("NORTH CAROLINA", "NC");
        names.put("NORTH DAKOTA", "ND");
        names.put("OHIO", "OH");
        names.put("OKLAHOMA", "OK");
        names.put("OREGON", "OR");
        names.put("PENNSYLVANIA", "PA");
        names.put("RHODE ISLAND", "RI");
        names.put("SOUTH CAROLINA", "SC");
        names.put("SOUTH DAKOTA", "SD");
        names.put("TENNESSEE", "TN");
        names.put("TEXAS", "TX");
        names.put("UTAH", "UT");
        names.put("VERMONT", "VT");
        names.put("VIRGINIA", "VA");
        names.put("WASHINGTON", "WA");
        names.put("WEST VIRGINIA", "WV");
        names.put("WISCONSIN", "WI");
        names.put("WYOMING", "WY");
        names.put("PUERTO RICO", "PR");
        names.put("GUAM", "GU");
        names.put("US VIRGIN ISLANDS", "VI");
        names.put("AMERICAN SAMOA", "AS");
        names.put("NORTHERN MARIANA ISLANDS", "MP");
        return Collections.unmodifiableMap(names);
    }
}
