package org.moviegraph.service;

import lombok.RequiredArgsConstructor;
import org.moviegraph.models.entity.BuildRun;
import org.moviegraph.models.enums.RunStatus;
import org.moviegraph.repository.BuildRunRepository;
import org.moviegraph.utils.AppUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
@RequiredArgsConstructor
public class BuildRunService {

    private static final int MAX_MESSAGE_LENGTH = 4000;

    private final BuildRunRepository buildRunRepository;

    public BuildRun start() {
        BuildRun run = new BuildRun();
        run.setRunUid(AppUtils.generateUUID());
        run.setRunStatus(RunStatus.QUEUED);
        run.setStartedAt(Instant.now());
        run.setRowsIn(0);
        run.setRowsOut(0);
        run.setTablesWritten(0);
        return buildRunRepository.save(run);
    }

    public BuildRun markRunning(BuildRun run) {
        run.setRunStatus(RunStatus.RUNNING);
        run.setStartedAt(run.getStartedAt() == null ? Instant.now() : run.getStartedAt());
        return buildRunRepository.save(run);
    }

    public BuildRun markSuccess(BuildRun run, int rowsIn, int rowsOut, int tablesWritten) {
        run.setRunStatus(RunStatus.SUCCESS);
        run.setRowsIn(rowsIn);
        run.setRowsOut(rowsOut);
        run.setTablesWritten(tablesWritten);
        run.setEndedAt(Instant.now());
        run.setErrorCode(null);
        run.setErrorMessage(null);
        return buildRunRepository.save(run);
    }

    public BuildRun markFailure(BuildRun run, int rowsIn, String errorCode, String message) {
        run.setRunStatus(RunStatus.FAILED);
        run.setRowsIn(rowsIn);
        run.setEndedAt(Instant.now());
        run.setErrorCode(errorCode);
        run.setErrorMessage(message != null && message.length() > MAX_MESSAGE_LENGTH
                ? message.substring(0, MAX_MESSAGE_LENGTH) : message);
        return buildRunRepository.save(run);
    }
}
