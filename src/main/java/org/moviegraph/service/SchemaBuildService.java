package org.moviegraph.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moviegraph.configuration.BuildProperties;
import org.moviegraph.exceptions.BuildInProgressException;
import org.moviegraph.exceptions.SchemaBuildException;
import org.moviegraph.models.dto.BuildRunStatusDTO;
import org.moviegraph.models.dto.RawRow;
import org.moviegraph.models.dto.ReferenceData;
import org.moviegraph.models.entity.BuildRun;
import org.moviegraph.models.table.NormalizedSchema;
import org.moviegraph.repository.BuildRunRepository;
import org.moviegraph.service.ingestion.RawDataService;
import org.moviegraph.service.ingestion.ReferenceDataLoader;
import org.moviegraph.service.schema.SchemaAssembler;
import org.moviegraph.service.schema.SchemaWriter;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs a full rebuild of the normalized schema: extract, assemble, write. Only one rebuild
 * runs at a time; a rebuild either replaces the whole schema or leaves a FAILED run behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaBuildService {

    private final ReentrantLock writerLock = new ReentrantLock();

    private final BuildProperties properties;
    private final RawDataService rawDataService;
    private final ReferenceDataLoader referenceDataLoader;
    private final SchemaAssembler schemaAssembler;
    private final SchemaWriter schemaWriter;
    private final BuildRunService buildRunService;
    private final BuildRunRepository buildRunRepository;

    /**
     * @throws BuildInProgressException when another rebuild is running
     * @throws SchemaBuildException     when the data cannot be normalized; the run is marked FAILED
     */
    public BuildRun rebuild() {
        if (!writerLock.tryLock()) {
            throw new BuildInProgressException();
        }
        try {
            BuildRun run = buildRunService.markRunning(buildRunService.start());
            log.info("[build] Starting schema build {}", run.getRunUid());
            int rowsIn = 0;
            try {
                List<RawRow> infos = rawDataService.read(RawDataService.INFOS, properties.getInfos());
                List<RawRow> credits = rawDataService.read(RawDataService.CREDITS, properties.getCredits());
                rowsIn = infos.size() + credits.size();
                ReferenceData referenceData = referenceDataLoader.load();

                NormalizedSchema schema = schemaAssembler.assemble(infos, credits, referenceData);
                int rowsOut = schemaWriter.write(schema);

                log.info("[build] Completed schema build {} with rowsIn={} rowsOut={} tables={}",
                        run.getRunUid(), rowsIn, rowsOut, schema.tables().size());
                return buildRunService.markSuccess(run, rowsIn, rowsOut, schema.tables().size());
            } catch (SchemaBuildException exception) {
                log.error("Schema build {} failed [{}]: {}", run.getRunUid(), exception.getCode(), exception.getMessage());
                buildRunService.markFailure(run, rowsIn, exception.getCode().name(), exception.getMessage());
                throw exception;
            } catch (RuntimeException exception) {
                log.error("Schema build {} failed", run.getRunUid(), exception);
                buildRunService.markFailure(run, rowsIn, null, exception.getMessage());
                throw exception;
            }
        } finally {
            writerLock.unlock();
        }
    }

    public boolean isRunning() {
        return writerLock.isLocked();
    }

    public Optional<BuildRunStatusDTO> findRun(String runUid) {
        return buildRunRepository.findByRunUid(runUid).map(this::toStatus);
    }

    public Optional<BuildRunStatusDTO> latest() {
        return buildRunRepository.findTopByOrderByStartedAtDesc().map(this::toStatus);
    }

    public List<BuildRunStatusDTO> list() {
        return buildRunRepository.findAllByOrderByStartedAtDesc().stream().map(this::toStatus).toList();
    }

    public BuildRunStatusDTO toStatus(BuildRun run) {
        return new BuildRunStatusDTO(
                run.getRunUid(),
                run.getRunStatus(),
                run.getRowsIn(),
                run.getRowsOut(),
                run.getTablesWritten(),
                run.getErrorCode(),
                run.getErrorMessage(),
                run.getStartedAt(),
                run.getEndedAt()
        );
    }
}
