package com.voterimport.voterimport.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Target attributes of the common voter-record schema.
 */
public enum CanonicalField {
    VOTER_ID("voter_id", FieldType.IDENTIFIER),
    FIRST_NAME("first_name", FieldType.NAME),
    MIDDLE_NAME("middle_name", FieldType.NAME),
    LAST_NAME("last_name", FieldType.NAME),
    SUFFIX("suffix", FieldType.NAME),
    ADDRESS_LINE("address_line", FieldType.STREET),
    STREET_NUMBER("street_number", FieldType.HOUSE_NUMBER),
    STREET_FRACTION("street_fraction", FieldType.HOUSE_NUMBER),
    STREET_PRE_DIRECTION("street_pre_direction", FieldType.STREET),
    STREET_NAME("street_name", FieldType.STREET),
    STREET_TYPE("street_type", FieldType.STREET),
    STREET_POST_DIRECTION("street_post_direction", FieldType.STREET),
    UNIT_TYPE("unit_type", FieldType.UNIT),
    UNIT("unit", FieldType.UNIT),
    CITY("city", FieldType.PLACE),
    STATE("state", FieldType.STATE),
    ZIP("zip", FieldType.ZIP),
    COUNTY("county", FieldType.PLACE),
    PRECINCT("precinct", FieldType.CODE),
    PARTY("party", FieldType.CODE),
    GENDER("gender", FieldType.CODE),
    STATUS_CODE("status_code", FieldType.CODE),
    LEGISLATIVE_DISTRICT("legislative_district", FieldType.CODE),
    CONGRESSIONAL_DISTRICT("congressional_district", FieldType.CODE),
    BIRTH_DATE("birth_date", FieldType.DATE),
    REGISTRATION_DATE("registration_date", FieldType.DATE),
    LAST_VOTED_DATE("last_voted_date", FieldType.DATE),
    MAILING_ADDRESS("mailing_address", FieldType.STREET),
    MAILING_ADDRESS2("mailing_address2", FieldType.STREET),
    MAILING_ADDRESS3("mailing_address3", FieldType.STREET),
    MAILING_CITY("mailing_city", FieldType.PLACE),
    MAILING_STATE("mailing_state", FieldType.STATE),
    MAILING_ZIP("mailing_zip", FieldType.ZIP),
    MAILING_COUNTRY("mailing_country", FieldType.PLACE);

    /**
     * Street components that together form the split address representation.
     */
    public static final Set<CanonicalField> SPLIT_STREET_FIELDS = EnumSet.of(
            STREET_NUMBER, STREET_FRACTION, STREET_PRE_DIRECTION, STREET_NAME, STREET_TYPE, STREET_POST_DIRECTION
    );

    /**
     * Fields describing the residential address; mailing-address headers never map to these by containment.
     */
    public static final Set<CanonicalField> RESIDENTIAL_ADDRESS_FIELDS = EnumSet.of(
            ADDRESS_LINE, STREET_NUMBER, STREET_FRACTION, STREET_PRE_DIRECTION, STREET_NAME, STREET_TYPE,
            STREET_POST_DIRECTION, UNIT_TYPE, UNIT, CITY, STATE, ZIP
    );

    /**
     * Fields whose normalization failure rejects the row. Any other field that cannot be normalized is
     * stored blank and reported as a field warning.
     */
    public static final Set<CanonicalField> ROW_CRITICAL_FIELDS = EnumSet.of(
            VOTER_ID, FIRST_NAME, MIDDLE_NAME, LAST_NAME, SUFFIX,
            ADDRESS_LINE, STREET_NUMBER, STREET_FRACTION, STREET_PRE_DIRECTION, STREET_NAME, STREET_TYPE,
            STREET_POST_DIRECTION, UNIT_TYPE, UNIT, CITY, STATE, ZIP
    );

    private final String key;
    private final FieldType type;

    CanonicalField(String key, FieldType type) {
        this.key = key;
        this.type = type;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public FieldType type() {
        return type;
    }

    public boolean isRowCritical() {
        return ROW_CRITICAL_FIELDS.contains(this);
    }

    @JsonCreator
    public static CanonicalField fromKey(String key) {
        if (key != null) {
            String wanted = key.trim().toLowerCase(Locale.ROOT);
            for (CanonicalField field : values()) {
                if (field.key.equals(wanted)) {
                    return field;
                }
            }
        }
        throw new IllegalArgumentException("Unknown canonical field: " + key);
    }
}
