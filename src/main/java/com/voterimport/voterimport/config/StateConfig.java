package com.voterimport.voterimport.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.voterimport.voterimport.schema.CanonicalField;
import com.voterimport.voterimport.schema.FieldMapping;
import com.voterimport.voterimport.schema.MappingRequirement;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Persisted column mapping for one state's export format. Immutable; onboarding produces new instances.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StateConfig(
        @JsonProperty("state_code") String stateCode,
        @JsonProperty("version") int version,
        @JsonProperty("delimiter") String delimiter,
        @JsonProperty("column_names") List<String> columnNames,
        @JsonProperty("field_mappings") List<FieldMapping> fieldMappings,
        @JsonProperty("needs_confirmation") List<CanonicalField> needsConfirmation,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {

    public StateConfig {
        if (stateCode == null || stateCode.isBlank()) {
            throw new IllegalArgumentException("State code is required");
        }
        stateCode = stateCode.trim().toUpperCase(Locale.ROOT);
        columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
        fieldMappings = fieldMappings == null ? List.of() : List.copyOf(fieldMappings);
        needsConfirmation = needsConfirmation == null ? List.of() : List.copyOf(needsConfirmation);
    }

    @JsonIgnore
    public Set<CanonicalField> mappedFields() {
        return fieldMappings.stream().map(FieldMapping::canonicalField).collect(Collectors.toUnmodifiableSet());
    }

    Optional<FieldMapping> mappingFor(CanonicalField field) {
        return fieldMappings.stream().filter(m -> m.canonicalField() == field).findFirst();
    }

    @JsonIgnore
    public List<MappingRequirement> missingRequirements() {
        return MappingRequirement.unmet(mappedFields());
    }

    @JsonIgnore
    public boolean isComplete() {
        return missingRequirements().isEmpty();
    }

    /**
     * Throws {@link ConfigIncompleteException} unless every required field is mapped.
     */
    public void requireComplete() {
        List<MappingRequirement> missing = missingRequirements();
        if (!missing.isEmpty()) {
            throw new ConfigIncompleteException(stateCode, missing);
        }
    }

    public StateConfig withDelimiter(String newDelimiter) {
        return new StateConfig(stateCode, version, newDelimiter, columnNames, fieldMappings,
                needsConfirmation, createdAt, updatedAt);
    }
}
