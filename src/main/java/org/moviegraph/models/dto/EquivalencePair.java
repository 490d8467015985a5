package org.moviegraph.models.dto;

import java.util.Objects;

/**
 * One entry of a duplicate-entity equivalence map, in natural ids of the source data.
 */
public record EquivalencePair(Object supersededId, Object canonicalId) {

    public EquivalencePair {
        Objects.requireNonNull(supersededId, "supersededId");
        Objects.requireNonNull(canonicalId, "canonicalId");
        if (supersededId.equals(canonicalId)) {
            throw new IllegalArgumentException("Entity " + supersededId + " cannot supersede itself");
        }
    }
}
