package com.tribrid.studio.api.controller;

import com.tribrid.studio.api.dto.ApiResponse;
import com.tribrid.studio.api.dto.StartRunBody;
import com.tribrid.studio.control.model.Run;
import com.tribrid.studio.control.model.RunScope;
import com.tribrid.studio.control.model.StartRunRequest;
import com.tribrid.studio.registry.RunRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Controller for training runs.
 *
 * Lists and starts runs, selects the run the studio follows and performs
 * the guarded cancel and promote actions.
 */
@Slf4j
@RestController
@RequestMapping("/runs")
@Tag(name = "Runs", description = "Endpoints for listing, selecting and controlling training runs")
@RequiredArgsConstructor
public class RunController {

    private final RunRegistry runRegistry;

    @GetMapping
    @Operation(
            summary = "List runs",
            description = "Returns the runs of a corpus, or all runs, newest first"
    )
    public ResponseEntity<ApiResponse<List<Run>>> listRuns(
            @Parameter(description = "Corpus ID, required for scope 'corpus'")
            @RequestParam(required = false) String corpusId,
            @Parameter(description = "corpus or all")
            @RequestParam(defaultValue = "corpus") String scope) {

        List<Run> runs = runRegistry.listRuns(corpusId, RunScope.fromParam(scope));
        return ResponseEntity.ok(ApiResponse.success(runs));
    }

    @PostMapping
    @Operation(
            summary = "Start a run",
            description = "Starts a training run for a corpus and selects it"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Run started"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Backend failed or rejected the start")
    })
    public ResponseEntity<ApiResponse<Run>> startRun(@Valid @RequestBody StartRunBody body) {
        log.info("Starting run for corpus {}", body.getCorpusId());

        Run run = runRegistry.startRun(StartRunRequest.builder()
                .corpusId(body.getCorpusId())
                .primaryMetric(body.getPrimaryMetric())
                .primaryK(body.getPrimaryK())
                .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(run));
    }

    @PostMapping("/{runId}/select")
    @Operation(
            summary = "Select a run",
            description = "Follows a run: its history and live stream load asynchronously"
    )
    public ResponseEntity<ApiResponse<Map<String, Object>>> selectRun(
            @Parameter(description = "Run ID") @PathVariable String runId) {

        runRegistry.selectRun(runId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(Map.of("runId", runId, "selected", true)));
    }

    @PostMapping("/{runId}/cancel")
    @Operation(
            summary = "Cancel the selected run",
            description = "Requests cancellation. The status changes only when the backend reports it"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Cancellation requested"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Run is not selected"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Run already finished"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Backend failed or rejected the request")
    })
    public ResponseEntity<ApiResponse<Map<String, Object>>> cancelRun(
            @Parameter(description = "Run ID") @PathVariable String runId) {

        runRegistry.cancel(runId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(Map.of("runId", runId, "cancelRequested", true)));
    }

    @PostMapping("/{runId}/promote")
    @Operation(
            summary = "Promote the selected run",
            description = "Promotes the artifact of a completed run"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Run promoted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Run is not selected"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Run has not completed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Backend failed or rejected the request")
    })
    public ResponseEntity<ApiResponse<Map<String, Object>>> promoteRun(
            @Parameter(description = "Run ID") @PathVariable String runId) {

        runRegistry.promote(runId);
        return ResponseEntity.ok(ApiResponse.success(Map.of("runId", runId, "promoted", true)));
    }
}
