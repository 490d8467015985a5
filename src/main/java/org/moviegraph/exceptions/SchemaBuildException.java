package org.moviegraph.exceptions;

import lombok.Getter;

/**
 * Base type for every condition that aborts a schema rebuild. A rebuild has no partial
 * success, so none of these are recoverable by the caller.
 */
@Getter
public abstract class SchemaBuildException extends RuntimeException {

    private final ErrorCode code;

    protected SchemaBuildException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected SchemaBuildException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
