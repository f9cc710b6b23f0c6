package com.tribrid.studio.control;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tribrid.studio.config.ControlApiConfig;
import com.tribrid.studio.config.MetricsConfig;
import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.OkResponse;
import com.tribrid.studio.control.model.Run;
import com.tribrid.studio.control.model.RunScope;
import com.tribrid.studio.control.model.StartRunRequest;
import com.tribrid.studio.control.model.StartRunResponse;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Training Control API client over HTTP, with the live stream read as
 * Server-Sent Events.
 */
@Slf4j
@Component
public class WebClientTrainingControlApi implements TrainingControlApi {

    static final String CONNECTION_LOST = "Connection lost";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final ControlApiConfig config;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;
    private final Duration responseTimeout;

    public WebClientTrainingControlApi(
            WebClient trainingControlWebClient,
            ControlApiConfig config,
            MetricsConfig metricsConfig,
            ObjectMapper objectMapper) {
        this.webClient = trainingControlWebClient;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.objectMapper = objectMapper;
        this.responseTimeout = Duration.ofMillis(config.getResponseTimeoutMs());
    }

    @Override
    public CompletableFuture<List<Run>> listRuns(String corpusId, RunScope scope, int limit) {
        return webClient.get()
                .uri(uri -> {
                    uri.path(config.getBasePath() + "/runs")
                            .queryParam("scope", scope.getWireName())
                            .queryParam("limit", limit);
                    if (corpusId != null && !corpusId.isBlank()) {
                        uri.queryParam("corpus_id", corpusId);
                    }
                    return uri.build();
                })
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, null))
                .bodyToMono(RunsResponse.class)
                .map(body -> body.getRuns() != null ? body.getRuns() : List.<Run>of())
                .timeout(responseTimeout)
                .onErrorMap(e -> !(e instanceof TrainingControlException),
                        e -> new TrainingControlException("Failed to list runs: " + describe(e), e))
                .toFuture();
    }

    @Override
    public CompletableFuture<Run> getRun(String runId) {
        return webClient.get()
                .uri(config.getBasePath() + "/run/{runId}", runId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, runId))
                .bodyToMono(Run.class)
                .timeout(responseTimeout)
                .onErrorMap(e -> !(e instanceof TrainingControlException), e -> wrap("load run", runId, e))
                .toFuture();
    }

    @Override
    public CompletableFuture<List<MetricEvent>> getMetrics(String runId, int limit) {
        return webClient.get()
                .uri(uri -> uri.path(config.getBasePath() + "/run/{runId}/metrics")
                        .queryParam("limit", limit)
                        .build(runId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, runId))
                .bodyToMono(MetricsResponse.class)
                .map(body -> body.getEvents() != null ? body.getEvents() : List.<MetricEvent>of())
                .timeout(responseTimeout)
                .onErrorMap(e -> !(e instanceof TrainingControlException), e -> wrap("load metrics of", runId, e))
                .toFuture();
    }

    @Override
    public StreamHandle streamRun(String runId, MetricEventSink sink) {
        AtomicBoolean finished = new AtomicBoolean();
        log.debug("Opening metric stream: runId={}", runId);

        Disposable subscription = webClient.get()
                .uri(config.getBasePath() + "/run/{runId}/stream", runId)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, runId))
                .bodyToFlux(SSE_TYPE)
                .subscribe(
                        frame -> {
                            MetricEvent event = parse(runId, frame.data());
                            if (event != null) {
                                sink.onEvent(event);
                            }
                        },
                        error -> {
                            if (finished.compareAndSet(false, true)) {
                                sink.onError(describe(error));
                            }
                        },
                        () -> {
                            if (finished.compareAndSet(false, true)) {
                                sink.onError(CONNECTION_LOST);
                            }
                        }
                );

        return () -> {
            finished.set(true);
            subscription.dispose();
        };
    }

    @Override
    public CompletableFuture<OkResponse> cancelRun(String runId) {
        return post(config.getBasePath() + "/run/{runId}/cancel", runId, "cancel");
    }

    @Override
    public CompletableFuture<OkResponse> promoteRun(String runId) {
        return post(config.getBasePath() + "/run/{runId}/promote", runId, "promote");
    }

    @Override
    public CompletableFuture<StartRunResponse> startRun(StartRunRequest request) {
        return webClient.post()
                .uri(config.getBasePath() + "/start")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, null))
                .bodyToMono(StartRunResponse.class)
                .timeout(responseTimeout)
                .onErrorMap(e -> !(e instanceof TrainingControlException),
                        e -> new TrainingControlException("Failed to start run: " + describe(e), e))
                .toFuture();
    }

    private CompletableFuture<OkResponse> post(String path, String runId, String action) {
        return webClient.post()
                .uri(path, runId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, runId))
                .bodyToMono(OkResponse.class)
                .timeout(responseTimeout)
                .onErrorMap(e -> !(e instanceof TrainingControlException), e -> wrap(action, runId, e))
                .toFuture();
    }

    /**
     * Parses one stream payload. Payloads that are not a JSON object are dropped.
     */
    MetricEvent parse(String runId, String data) {
        if (data == null || data.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(data, MetricEvent.class);
        } catch (JsonProcessingException e) {
            dropMalformed(runId, e.getOriginalMessage());
            return null;
        }
    }

    private void dropMalformed(String runId, String reason) {
        metricsConfig.getMalformedEvents().increment();
        log.debug("Dropping malformed stream payload: runId={}, reason={}", runId, reason);
    }

    private Mono<Throwable> toException(ClientResponse response, String runId) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new TrainingControlException(
                        "Training Control API returned " + status + ": " + detail(body),
                        runId,
                        TrainingControlException.CONTROL_API_ERROR,
                        status,
                        null
                ));
    }

    private String detail(String body) {
        if (body.isBlank()) {
            return "no body";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode detail = node.get("detail");
            if (detail != null && detail.isTextual()) {
                return detail.asText();
            }
        } catch (JsonProcessingException e) {
            log.trace("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return body;
    }

    private static TrainingControlException wrap(String action, String runId, Throwable e) {
        return new TrainingControlException(
                "Failed to " + action + " run " + runId + ": " + describe(e),
                runId,
                TrainingControlException.CONTROL_API_ERROR,
                0,
                e
        );
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    @Data
    @NoArgsConstructor
    static class RunsResponse {
        private boolean ok;
        private List<Run> runs;
    }

    @Data
    @NoArgsConstructor
    static class MetricsResponse {
        private boolean ok;
        private List<MetricEvent> events;
    }
}
