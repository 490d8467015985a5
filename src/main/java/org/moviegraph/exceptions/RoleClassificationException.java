package org.moviegraph.exceptions;

public class RoleClassificationException extends SchemaBuildException {

    public RoleClassificationException(Object personId) {
        super(ErrorCode.ROLE_CLASSIFICATION,
                "Person " + personId + " was observed neither as cast nor as crew");
    }
}
