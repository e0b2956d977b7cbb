package com.voterimport.voterimport.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Association of one source column with one canonical field.
 */
public record FieldMapping(
        @JsonProperty("source_column") String sourceColumn,
        @JsonProperty("canonical_field") CanonicalField canonicalField,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("method") DetectionMethod method
) {

    public FieldMapping {
        if (sourceColumn == null || sourceColumn.isBlank()) {
            throw new IllegalArgumentException("Source column is required");
        }
        if (canonicalField == null || method == null) {
            throw new IllegalArgumentException("Canonical field and method are required");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0,1]: " + confidence);
        }
    }
}
