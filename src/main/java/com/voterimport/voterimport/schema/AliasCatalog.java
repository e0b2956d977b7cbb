package com.voterimport.voterimport.schema;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical field names and the header synonyms known for them across state export formats.
 * Names and synonyms are held in normalized header form (see {@link #normalizeHeader(String)}).
 */
public final class AliasCatalog {

    static final int MIN_CONTAINED_ALIAS_LENGTH = 4;

    private static final String MAILING_MARKER = "mail";

    private static final AliasCatalog STANDARD = new AliasCatalog(standardAliases());

    private final Map<String, CanonicalField> canonicalNames;
    private final Map<String, CanonicalField> aliases;

    AliasCatalog(Map<CanonicalField, List<String>> aliasesByField) {
        Map<String, CanonicalField> names = new LinkedHashMap<>();
        Map<String, CanonicalField> synonyms = new LinkedHashMap<>();
        for (CanonicalField field : CanonicalField.values()) {
            names.put(normalizeHeader(field.key()), field);
        }
        aliasesByField.forEach((field, list) -> {
            for (String alias : list) {
                String normalized = normalizeHeader(alias);
                if (!names.containsKey(normalized)) {
                    synonyms.putIfAbsent(normalized, field);
                }
            }
        });
        this.canonicalNames = Collections.unmodifiableMap(names);
        this.aliases = Collections.unmodifiableMap(synonyms);
    }

    public static AliasCatalog standard() {
        return STANDARD;
    }

    /**
     * Lower-cases a header and strips punctuation, whitespace and separators,
     * so {@code "Voter ID"}, {@code "voter_id"} and {@code "VoterID"} collapse to {@code voterid}.
     */
    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        return header.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    public Optional<CanonicalField> exactMatch(String normalizedHeader) {
        return Optional.ofNullable(canonicalNames.get(normalizedHeader));
    }

    public Optional<CanonicalField> aliasMatch(String normalizedHeader) {
        return Optional.ofNullable(aliases.get(normalizedHeader));
    }

    /**
     * Finds the field whose longest name or synonym is contained in the header.
     * Headers naming a mailing address never resolve to residential address fields.
     * Callers confirm the match against sample values where the field has a fixed value shape.
     */
    public Optional<CanonicalField> containedMatch(String normalizedHeader) {
        boolean mailing = isMailingHeader(normalizedHeader);
        CanonicalField best = null;
        int bestLength = 0;
        for (Map<String, CanonicalField> table : List.of(canonicalNames, aliases)) {
            for (Map.Entry<String, CanonicalField> entry : table.entrySet()) {
                String alias = entry.getKey();
                if (alias.length() < MIN_CONTAINED_ALIAS_LENGTH || alias.length() <= bestLength) {
                    continue;
                }
                if (mailing && CanonicalField.RESIDENTIAL_ADDRESS_FIELDS.contains(entry.getValue())) {
                    continue;
                }
                if (normalizedHeader.contains(alias)) {
                    best = entry.getValue();
                    bestLength = alias.length();
                }
            }
        }
        return Optional.ofNullable(best);
    }

    public static boolean isMailingHeader(String normalizedHeader) {
        return normalizedHeader.contains(MAILING_MARKER);
    }

    private static Map<CanonicalField, List<String>> standardAliases() {
        Map<CanonicalField, List<String>> aliases = new EnumMap<>(CanonicalField.class);
        aliases.put(CanonicalField.VOTER_ID, List.of(
                "vid", "id", "voter no", "voter number", "voter num", "voter_key", "registration id",
                "registration number", "reg id", "reg num", "state voter id", "sos voter id", "votid",
                "voter reg id", "voter registration id", "registrant id"));
        aliases.put(CanonicalField.FIRST_NAME, List.of(
                "first", "fname", "given name", "name first", "forename", "first nm"));
        aliases.put(CanonicalField.MIDDLE_NAME, List.of(
                "middle", "mname", "name middle", "middle initial", "middle nm"));
        aliases.put(CanonicalField.LAST_NAME, List.of(
                "last", "lname", "surname", "name last", "family name", "last nm"));
        aliases.put(CanonicalField.SUFFIX, List.of(
                "name suffix", "suffix name", "sfx", "name sfx", "suffix cd", "generation"));
        aliases.put(CanonicalField.ADDRESS_LINE, List.of(
                "addr1", "addr", "address", "address1", "address line 1", "street address", "street addr",
                "res address", "residential address", "residence address", "reg address",
                "address full", "full address", "complete address", "res street address"));
        aliases.put(CanonicalField.STREET_NUMBER, List.of(
                "stnum", "st number", "street no", "street num", "house number", "house no", "house num",
                "reg st num", "address number", "res street number"));
        aliases.put(CanonicalField.STREET_FRACTION, List.of(
                "stfrac", "st frac", "fraction", "reg st frac", "address frac", "street frac",
                "house fraction", "res street fraction"));
        aliases.put(CanonicalField.STREET_PRE_DIRECTION, List.of(
                "st pre dir", "pre direction", "pre dir", "reg st pre direction", "address dir pre",
                "street dir", "street direction", "res street pre direction"));
        aliases.put(CanonicalField.STREET_NAME, List.of(
                "stname", "st name", "reg st name", "address street", "street", "res street name"));
        aliases.put(CanonicalField.STREET_TYPE, List.of(
                "sttype", "st type", "reg st type", "address suffix", "street suffix", "st suffix", "addr suffix", "res street type"));
        aliases.put(CanonicalField.STREET_POST_DIRECTION, List.of(
                "st post dir", "post direction", "post dir", "reg st post direction", "address dir post",
                "street post dir", "res street post direction"));
        aliases.put(CanonicalField.UNIT_TYPE, List.of(
                "reg unit type", "address unit type", "apartment type", "apt type", "res unit type"));
        aliases.put(CanonicalField.UNIT, List.of(
                "unit num", "unit number", "unit no", "reg st unit num", "address unit", "apartment number",
                "apt", "apt no", "apartment", "suite", "res unit number"));
        aliases.put(CanonicalField.CITY, List.of(
                "town", "reg city", "municipality", "res city", "city name", "residence city"));
        aliases.put(CanonicalField.STATE, List.of(
                "st", "reg state", "province", "res state", "state code", "residence state"));
        aliases.put(CanonicalField.ZIP, List.of(
                "zip code", "zip5", "postal", "postal code", "post code", "reg zip code", "res zip",
                "zipcode5", "residence zip"));
        aliases.put(CanonicalField.COUNTY, List.of(
                "parish", "county code", "county name", "jurisdiction"));
        aliases.put(CanonicalField.PRECINCT, List.of(
                "precinct code", "precinct id", "voting district", "pct"));
        aliases.put(CanonicalField.PARTY, List.of(
                "political party", "party affiliation", "party code", "affiliation"));
        aliases.put(CanonicalField.GENDER, List.of(
                "sex", "sex code", "gender code"));
        aliases.put(CanonicalField.STATUS_CODE, List.of(
                "status", "status cd", "voter status", "voter status code", "registration status"));
        aliases.put(CanonicalField.LEGISLATIVE_DISTRICT, List.of(
                "leg district", "leg dist", "legislative dist", "state house", "state house district",
                "house district", "state senate district", "senate district"));
        aliases.put(CanonicalField.CONGRESSIONAL_DISTRICT, List.of(
                "cong district", "cong dist", "congressional dist", "us house", "us house district", "cd"));
        aliases.put(CanonicalField.BIRTH_DATE, List.of(
                "dob", "date of birth", "birthday", "birth dt"));
        aliases.put(CanonicalField.REGISTRATION_DATE, List.of(
                "reg date", "registered date", "date of registration", "registration dt", "regdate"));
        aliases.put(CanonicalField.LAST_VOTED_DATE, List.of(
                "last voted", "last vote date", "last voted dt", "date last voted"));
        aliases.put(CanonicalField.MAILING_ADDRESS, List.of(
                "mail1", "mail addr", "mail addr1", "mail address", "mail address1", "mailing addr1",
                "mailing address1", "mailing address line 1", "mail street"));
        aliases.put(CanonicalField.MAILING_ADDRESS2, List.of(
                "mail2", "mail addr2", "mail address2", "mailing addr2", "mailing address line 2"));
        aliases.put(CanonicalField.MAILING_ADDRESS3, List.of(
                "mail3", "mail addr3", "mail address3", "mailing addr3", "mailing address line 3"));
        aliases.put(CanonicalField.MAILING_CITY, List.of(
                "mail city", "mailing city name"));
        aliases.put(CanonicalField.MAILING_STATE, List.of(
                "mail state", "mail st", "mailing state code"));
        aliases.put(CanonicalField.MAILING_ZIP, List.of(
                "mail zip", "mail zip code", "mailing zip code", "mail postal", "mailing postal code"));
        aliases.put(CanonicalField.MAILING_COUNTRY, List.of(
                "mail country", "mailing country code"));
        return aliases;
    }
}
