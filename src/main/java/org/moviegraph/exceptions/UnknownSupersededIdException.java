package org.moviegraph.exceptions;

import lombok.Getter;

@Getter
public class UnknownSupersededIdException extends SchemaBuildException {

    private final String entityTable;
    private final Object naturalId;

    public UnknownSupersededIdException(String entityTable, Object naturalId) {
        super(ErrorCode.UNKNOWN_SUPERSEDED_ID,
                "Equivalence map names " + naturalId + " which does not exist in " + entityTable);
        this.entityTable = entityTable;
        this.naturalId = naturalId;
    }
}
