package org.moviegraph.models.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a raw relation exactly as read from its source: a natural id plus the raw string
 * value of every column.
 */
public record RawRow(String relation, Object naturalId, Map<String, String> values) {

    public RawRow {
        Objects.requireNonNull(relation, "relation");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String value(String column) {
        return values.get(column);
    }
}
