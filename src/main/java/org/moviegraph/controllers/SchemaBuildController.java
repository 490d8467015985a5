package org.moviegraph.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moviegraph.exceptions.BuildInProgressException;
import org.moviegraph.exceptions.SchemaBuildException;
import org.moviegraph.models.dto.BuildRunStatusDTO;
import org.moviegraph.models.entity.BuildRun;
import org.moviegraph.service.SchemaBuildService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/builds")
@RequiredArgsConstructor
public class SchemaBuildController {

    private final SchemaBuildService schemaBuildService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> rebuild() {
        try {
            BuildRun run = schemaBuildService.rebuild();
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("runUid", run.getRunUid());
            response.put("status", run.getRunStatus());
            response.put("rowsIn", run.getRowsIn());
            response.put("rowsOut", run.getRowsOut());
            response.put("tablesWritten", run.getTablesWritten());
            return ResponseEntity.ok(response);
        } catch (BuildInProgressException e) {
            log.warn("Rejected schema build: {}", e.getMessage());
            return error(HttpStatus.CONFLICT, e.getMessage(), null);
        } catch (SchemaBuildException e) {
            return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e.getCode().name());
        } catch (Exception e) {
            log.error("Error during schema build: {}", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), null);
        }
    }

    @GetMapping
    public List<BuildRunStatusDTO> listRuns() {
        return schemaBuildService.list();
    }

    @GetMapping("/latest")
    public BuildRunStatusDTO latestRun() {
        return schemaBuildService.latest()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No schema build has run yet"));
    }

    @GetMapping("/{runUid}")
    public BuildRunStatusDTO getRun(@PathVariable String runUid) {
        return schemaBuildService.findRun(runUid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Build run not found"));
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, String code) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        errorResponse.put("error", message);
        errorResponse.put("code", code);
        return ResponseEntity.status(status).body(errorResponse);
    }
}
