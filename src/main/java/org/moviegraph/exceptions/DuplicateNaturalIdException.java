package org.moviegraph.exceptions;

import lombok.Getter;

@Getter
public class DuplicateNaturalIdException extends SchemaBuildException {

    private final String entityTable;
    private final Object naturalId;

    public DuplicateNaturalIdException(String entityTable, Object naturalId, String detail) {
        super(ErrorCode.DUPLICATE_NATURAL_ID,
                "Natural id " + naturalId + " of " + entityTable + " is ambiguous: " + detail);
        this.entityTable = entityTable;
        this.naturalId = naturalId;
    }
}
