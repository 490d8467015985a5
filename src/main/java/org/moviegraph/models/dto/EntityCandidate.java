package org.moviegraph.models.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A flat (natural id, name, attributes) observation of an entity, before deduplication.
 * Attribute keys are output column names.
 */
public record EntityCandidate(Object naturalId, String name, Map<String, Object> attributes) {

    public EntityCandidate {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static EntityCandidate of(Object naturalId, String name) {
        return new EntityCandidate(naturalId, name, Map.of());
    }
}
