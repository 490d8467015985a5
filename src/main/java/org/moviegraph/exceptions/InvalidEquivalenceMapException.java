package org.moviegraph.exceptions;

import lombok.Getter;

/**
 * The equivalence map itself is unusable: an id that cannot be read as the entity's key type,
 * or pairs that loop back on themselves.
 */
@Getter
public class InvalidEquivalenceMapException extends SchemaBuildException {

    private final String entityTable;

    public InvalidEquivalenceMapException(String entityTable, String detail) {
        super(ErrorCode.INVALID_EQUIVALENCE_MAP, "Equivalence map for " + entityTable + " is invalid: " + detail);
        this.entityTable = entityTable;
    }

    public InvalidEquivalenceMapException(String entityTable, String detail, Throwable cause) {
        super(ErrorCode.INVALID_EQUIVALENCE_MAP, "Equivalence map for " + entityTable + " is invalid: " + detail, cause);
        this.entityTable = entityTable;
    }
}
