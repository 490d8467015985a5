package org.moviegraph.exceptions;

public enum ErrorCode {
    MALFORMED_NESTED_FIELD,
    DUPLICATE_NATURAL_ID,
    ROLE_CLASSIFICATION,
    DANGLING_REFERENCE,
    UNKNOWN_SUPERSEDED_ID,
    INVALID_EQUIVALENCE_MAP,
    INTEGRITY_VIOLATION
}
