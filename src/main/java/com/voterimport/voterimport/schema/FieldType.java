package com.voterimport.voterimport.schema;

/**
 * Value category of a canonical field; selects the normalization rule applied to it.
 */
public enum FieldType {
    IDENTIFIER,
    NAME,
    STREET,
    HOUSE_NUMBER,
    UNIT,
    PLACE,
    STATE,
    ZIP,
    CODE,
    DATE
}
