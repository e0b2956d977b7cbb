package com.voterimport.voterimport.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row of a source extract: column name to raw value, in source column order.
 * Row numbers are 1-based and do not count the header row.
 */
public record RawRow(long rowNumber, Map<String, String> values) {

    public RawRow {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the raw value of a column, or {@code null} when the row has no such column.
     */
    public String get(String column) {
        return values.get(column);
    }
}
