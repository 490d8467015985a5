package org.moviegraph.models.dto;

import org.moviegraph.models.enums.RunStatus;

import java.time.Instant;

public record BuildRunStatusDTO(
        String runUid,
        RunStatus status,
        Integer rowsIn,
        Integer rowsOut,
        Integer tablesWritten,
        String errorCode,
        String errorMessage,
        Instant startedAt,
        Instant endedAt
) {
}
