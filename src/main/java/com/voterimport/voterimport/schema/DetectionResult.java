package com.voterimport.voterimport.schema;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Outcome of schema detection over one extract's headers and sample rows.
 */
public record DetectionResult(
        List<FieldMapping> mappings,
        List<MappingRequirement> unmappedRequirements,
        List<CanonicalField> unmappedFields,
        List<String> unmappedColumns,
        List<String> warnings
) {

    public DetectionResult {
        mappings = List.copyOf(mappings);
        unmappedRequirements = List.copyOf(unmappedRequirements);
        unmappedFields = List.copyOf(unmappedFields);
        unmappedColumns = List.copyOf(unmappedColumns);
        warnings = List.copyOf(warnings);
    }

    public boolean isComplete() {
        return unmappedRequirements.isEmpty();
    }

    public Set<CanonicalField> mappedFields() {
        return mappings.stream().map(FieldMapping::canonicalField).collect(Collectors.toUnmodifiableSet());
    }
}
