package com.tribrid.studio.api.controller;

import com.tribrid.studio.api.dto.ApiResponse;
import com.tribrid.studio.api.dto.TelemetryResponse;
import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.Run;
import com.tribrid.studio.export.MetricEventExporter;
import com.tribrid.studio.registry.RunHud;
import com.tribrid.studio.registry.RunRegistry;
import com.tribrid.studio.telemetry.TelemetrySnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Controller for the studio view of the selected run.
 */
@Slf4j
@RestController
@RequestMapping("/studio")
@Tag(name = "Studio", description = "Telemetry, HUD and event log of the selected run")
@RequiredArgsConstructor
public class StudioController {

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final RunRegistry runRegistry;

    @GetMapping("/selection")
    @Operation(summary = "Get the selected run")
    public ResponseEntity<ApiResponse<Run>> getSelection() {
        return runRegistry.currentRun()
                .map(run -> ResponseEntity.ok(ApiResponse.success(run)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error("No run selected", "RUN_NOT_SELECTED")));
    }

    @DeleteMapping("/selection")
    @Operation(summary = "Stop following the selected run")
    public ResponseEntity<Void> clearSelection() {
        runRegistry.clearSelection();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/hud")
    @Operation(summary = "Get the HUD of the selected run")
    public ResponseEntity<ApiResponse<RunHud>> getHud() {
        return ResponseEntity.ok(ApiResponse.success(runRegistry.hud()));
    }

    @GetMapping("/telemetry")
    @Operation(
            summary = "Get visualization points",
            description = "Returns the buffered telemetry points of the selected run, oldest first"
    )
    public ResponseEntity<ApiResponse<TelemetryResponse>> getTelemetry() {
        TelemetrySnapshot snapshot = runRegistry.telemetry();
        return ResponseEntity.ok(ApiResponse.success(TelemetryResponse.builder()
                .runId(snapshot.runId())
                .status(snapshot.status())
                .streamOpen(snapshot.streamOpen())
                .count(snapshot.points().size())
                .capacity(snapshot.capacity())
                .retainedEvents(snapshot.retainedEvents())
                .points(snapshot.points())
                .build()));
    }

    @GetMapping("/events")
    @Operation(
            summary = "Search retained events",
            description = "Returns events whose message or type contains the query, ignoring case"
    )
    public ResponseEntity<ApiResponse<List<MetricEvent>>> getEvents(
            @Parameter(description = "Search text, all events when blank")
            @RequestParam(name = "q", required = false) String query) {
        return ResponseEntity.ok(ApiResponse.success(runRegistry.events(query)));
    }

    @GetMapping("/logs")
    @Operation(summary = "Get log, error, state and complete events")
    public ResponseEntity<ApiResponse<List<MetricEvent>>> getLogs() {
        return ResponseEntity.ok(ApiResponse.success(runRegistry.logEvents()));
    }

    @DeleteMapping("/logs")
    @Operation(summary = "Clear the log view", description = "Hides earlier log lines; retained events are kept")
    public ResponseEntity<Void> clearLogs() {
        runRegistry.clearLogs();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/events/download")
    @Operation(
            summary = "Download retained events",
            description = "Returns the retained events of the selected run as NDJSON"
    )
    public ResponseEntity<byte[]> downloadEvents() {
        MetricEventExporter.MetricExport export = runRegistry.download();
        log.debug("Downloading {} events as {}", export.eventCount(), export.fileName());

        return ResponseEntity.ok()
                .contentType(NDJSON)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(export.fileName())
                        .build()
                        .toString())
                .body(export.body().getBytes(StandardCharsets.UTF_8));
    }
}
