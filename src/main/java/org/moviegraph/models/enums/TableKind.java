package org.moviegraph.models.enums;

public enum TableKind {
    /** Fixed code table generated from an enum. */
    LOOKUP,
    /** Deduplicated real-world objects with their own key. */
    ENTITY,
    /** Association rows keyed by their full composite key. */
    LINK
}
