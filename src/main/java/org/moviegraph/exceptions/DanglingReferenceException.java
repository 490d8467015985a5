package org.moviegraph.exceptions;

import lombok.Getter;

@Getter
public class DanglingReferenceException extends SchemaBuildException {

    private final String linkTable;
    private final String column;
    private final Object naturalId;

    public DanglingReferenceException(String linkTable, String column, Object naturalId) {
        super(ErrorCode.DANGLING_REFERENCE,
                "Link table " + linkTable + " references unknown " + column + " " + naturalId);
        this.linkTable = linkTable;
        this.column = column;
        this.naturalId = naturalId;
    }
}
