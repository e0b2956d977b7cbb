package com.voterimport.voterimport.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Mapping coverage a state config needs before it can be imported against.
 */
public enum MappingRequirement {
    VOTER_ID("voter_id", CanonicalField.VOTER_ID),
    ADDRESS("address_line or street_number+street_name", CanonicalField.ADDRESS_LINE);

    private final String description;
    private final CanonicalField suggestedField;

    MappingRequirement(String description, CanonicalField suggestedField) {
        this.description = description;
        this.suggestedField = suggestedField;
    }

    public String description() {
        return description;
    }

    /**
     * The single field whose mapping satisfies this requirement.
     */
    public CanonicalField suggestedField() {
        return suggestedField;
    }

    public boolean isSatisfiedBy(Collection<CanonicalField> mappedFields) {
        return switch (this) {
            case VOTER_ID -> mappedFields.contains(CanonicalField.VOTER_ID);
            case ADDRESS -> mappedFields.contains(CanonicalField.ADDRESS_LINE)
                    || (mappedFields.contains(CanonicalField.STREET_NUMBER)
                    && mappedFields.contains(CanonicalField.STREET_NAME));
        };
    }

    /**
     * Returns the requirements not met by the given mapped fields, in declaration order.
     */
    public static List<MappingRequirement> unmet(Collection<CanonicalField> mappedFields) {
        List<MappingRequirement> unmet = new ArrayList<>();
        for (MappingRequirement requirement : values()) {
            if (!requirement.isSatisfiedBy(mappedFields)) {
                unmet.add(requirement);
            }
        }
        return unmet;
    }
}
