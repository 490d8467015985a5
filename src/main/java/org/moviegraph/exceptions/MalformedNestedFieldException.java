package org.moviegraph.exceptions;

import lombok.Getter;

@Getter
public class MalformedNestedFieldException extends SchemaBuildException {

    private final Object parentId;
    private final String field;

    public MalformedNestedFieldException(Object parentId, String field, String detail) {
        this(parentId, field, detail, null);
    }

    public MalformedNestedFieldException(Object parentId, String field, String detail, Throwable cause) {
        super(ErrorCode.MALFORMED_NESTED_FIELD,
                "Malformed nested field '" + field + "' in row " + parentId + ": " + detail, cause);
        this.parentId = parentId;
        this.field = field;
    }
}
