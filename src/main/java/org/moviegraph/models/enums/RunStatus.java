package org.moviegraph.models.enums;

public enum RunStatus {
    QUEUED,
    RUNNING,
    SUCCESS,
    FAILED
}
