package org.moviegraph.exceptions;

public class IntegrityViolationException extends SchemaBuildException {

    public IntegrityViolationException(String message) {
        super(ErrorCode.INTEGRITY_VIOLATION, message);
    }

    public IntegrityViolationException(String message, Throwable cause) {
        super(ErrorCode.INTEGRITY_VIOLATION, message, cause);
    }
}
