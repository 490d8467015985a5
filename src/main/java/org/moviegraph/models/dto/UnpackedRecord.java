package org.moviegraph.models.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One element of a nested list field, flattened. Sub-fields the element does not carry read as
 * {@code null}.
 */
public record UnpackedRecord(Object parentId, int position, Map<String, Object> attributes) {

    public UnpackedRecord {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Object value(String name) {
        return attributes.get(name);
    }

    public String text(String name) {
        Object value = attributes.get(name);
        return value == null ? null : value.toString();
    }

    public Integer integer(String name) {
        Object value = attributes.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : Integer.valueOf(text);
    }
}
