package com.linlay.streamrunner.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.streamrunner.model.StreamUpdate;
import com.linlay.streamrunner.model.api.ApiResponse;
import com.linlay.streamrunner.model.api.FallbackRequest;
import com.linlay.streamrunner.model.api.FallbackResponse;
import com.linlay.streamrunner.model.api.StartStreamRequest;
import com.linlay.streamrunner.model.api.StreamDetailResponse;
import com.linlay.streamrunner.model.api.StreamListResponse;
import com.linlay.streamrunner.model.api.StreamSummaryResponse;
import com.linlay.streamrunner.service.HttpEventStreamSourceFactory;
import com.linlay.streamrunner.service.StreamUpdateBroadcaster;
import com.linlay.streamrunner.stream.model.ConnectionStatus;
import com.linlay.streamrunner.stream.model.StreamError;
import com.linlay.streamrunner.stream.service.StreamConnection;
import com.linlay.streamrunner.stream.service.StreamConnectionRegistry;
import com.linlay.streamrunner.stream.service.StreamFailure;
import com.linlay.streamrunner.stream.service.StreamNotFoundException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/streams")
public class StreamController {

    private static final Logger log = LoggerFactory.getLogger(StreamController.class);
    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(15);
    private static final Set<String> TERMINAL_STATUSES = Arrays.stream(ConnectionStatus.values())
            .filter(ConnectionStatus::isTerminal)
            .map(ConnectionStatus::value)
            .collect(Collectors.toUnmodifiableSet());

    private final StreamConnectionRegistry registry;
    private final HttpEventStreamSourceFactory sourceFactory;
    private final StreamUpdateBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    public StreamController(
            StreamConnectionRegistry registry,
            HttpEventStreamSourceFactory sourceFactory,
            StreamUpdateBroadcaster broadcaster,
            ObjectMapper objectMapper
    ) {
        this.registry = registry;
        this.sourceFactory = sourceFactory;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
    }

    @PostMapping
    public ApiResponse<StreamSummaryResponse> start(@Valid @RequestBody StartStreamRequest request) {
        StreamConnection connection = registry.start(
                request.streamId(),
                sourceFactory.forUrl(request.sourceUrl()),
                request.messageId()
        );
        log.info("Started stream streamId={}, messageId={}, sourceUrl={}",
                connection.id(), connection.messageId(), request.sourceUrl());
        return ApiResponse.success(toSummary(connection));
    }

    @GetMapping
    public ApiResponse<StreamListResponse> streams() {
        List<StreamSummaryResponse> summaries = registry.streamIds().stream()
                .map(registry::getConnection)
                .filter(Objects::nonNull)
                .map(this::toSummary)
                .sorted(Comparator.comparing(StreamSummaryResponse::startedAt))
                .toList();
        List<String> fallbackIds = registry.fallbackMessageIds().stream().sorted().toList();
        return ApiResponse.success(new StreamListResponse(registry.metrics(), summaries, fallbackIds));
    }

    @GetMapping("/errors")
    public ApiResponse<List<StreamFailure>> errors() {
        return ApiResponse.success(registry.errors());
    }

    @PostMapping("/errors/clear")
    public ApiResponse<Map<String, Object>> clearErrors() {
        registry.clearErrors();
        return ApiResponse.success(Map.of("cleared", true));
    }

    @GetMapping("/{streamId}")
    public ApiResponse<StreamDetailResponse> stream(@PathVariable String streamId) {
        StreamConnection connection = requireConnection(streamId);
        Throwable failure = connection.failure();
        return ApiResponse.success(new StreamDetailResponse(
                toSummary(connection),
                connection.state(),
                failure == null ? null : StreamError.from(failure).message()
        ));
    }

    /**
     * Live updates for one stream. The first event is a snapshot taken after the subscription to
     * the broadcaster is in place, so a transition racing the request is either in the snapshot or
     * delivered afterwards. The feed ends when the stream reaches a final state or is stopped.
     */
    @GetMapping(value = "/{streamId}/updates", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> updates(@PathVariable String streamId) {
        requireConnection(streamId);
        Flux<StreamUpdate> feed = Flux.merge(
                        broadcaster.updates(streamId),
                        Flux.defer(() -> Flux.just(currentSnapshot(streamId))))
                .takeUntil(this::isFinalUpdate);
        ServerSentEvent<String> heartbeat = ServerSentEvent.<String>builder().comment("heartbeat").build();
        return feed.publish(shared -> Flux.merge(
                shared.map(this::toServerSentEvent),
                Flux.interval(HEARTBEAT_INTERVAL).map(tick -> heartbeat).takeUntilOther(shared.then())
        ));
    }

    @PostMapping("/{streamId}/stop")
    public ApiResponse<Map<String, Object>> stop(@PathVariable String streamId) {
        boolean stopped = registry.stop(streamId);
        return ApiResponse.success(Map.of("streamId", streamId, "stopped", stopped));
    }

    @PostMapping("/stop-all")
    public ApiResponse<Map<String, Object>> stopAll() {
        int tracked = registry.streamIds().size();
        registry.stopAll();
        log.info("Stopped all streams, count={}", tracked);
        return ApiResponse.success(Map.of("stopped", tracked));
    }

    @PostMapping("/{streamId}/retry")
    public ApiResponse<StreamSummaryResponse> retry(@PathVariable String streamId) {
        StreamConnection connection = registry.retry(streamId);
        return ApiResponse.success(toSummary(connection));
    }

    @PostMapping("/fallback")
    public ApiResponse<FallbackResponse> enableFallback(@Valid @RequestBody FallbackRequest request) {
        boolean created = registry.enableFallback(request.messageId(), request.endpoint());
        return ApiResponse.success(new FallbackResponse(
                request.messageId(),
                registry.isFallbackEnabled(request.messageId()),
                created
        ));
    }

    @DeleteMapping("/fallback/{messageId}")
    public ApiResponse<FallbackResponse> disableFallback(@PathVariable String messageId) {
        boolean removed = registry.disableFallback(messageId);
        return ApiResponse.success(new FallbackResponse(messageId, false, removed));
    }

    private StreamConnection requireConnection(String streamId) {
        StreamConnection connection = registry.getConnection(streamId);
        if (connection == null) {
            throw new StreamNotFoundException(streamId);
        }
        return connection;
    }

    private StreamSummaryResponse toSummary(StreamConnection connection) {
        return new StreamSummaryResponse(
                connection.id(),
                connection.messageId(),
                connection.status(),
                registry.getAttempts(connection.id()),
                registry.isRetryPending(connection.id()),
                registry.getStreamProgress(connection.id()),
                connection.state().tokenCount(),
                connection.startedAt()
        );
    }

    private StreamUpdate currentSnapshot(String streamId) {
        StreamConnection connection = registry.getConnection(streamId);
        Map<String, Object> payload = new LinkedHashMap<>();
        if (connection == null) {
            // stopped between the request and the subscription
            payload.put("status", ConnectionStatus.ABORTED.value());
            payload.put("retryPending", false);
            return broadcaster.snapshot(streamId, payload);
        }
        payload.put("status", connection.status().value());
        payload.put("attempt", registry.getAttempts(streamId));
        payload.put("retryPending", registry.isRetryPending(streamId));
        payload.put("progress", registry.getStreamProgress(streamId));
        payload.put("tokenCount", connection.state().tokenCount());
        payload.put("text", connection.state().text());
        return broadcaster.snapshot(streamId, payload);
    }

    private ServerSentEvent<String> toServerSentEvent(StreamUpdate update) {
        String data;
        try {
            data = objectMapper.writeValueAsString(update);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize stream update", ex);
        }
        return ServerSentEvent.<String>builder()
                .id(Long.toString(update.seq()))
                .event(update.type())
                .data(data)
                .build();
    }

    private boolean isFinalUpdate(StreamUpdate update) {
        switch (update.type()) {
            case StreamUpdate.TYPE_COMPLETE:
            case StreamUpdate.TYPE_ERROR:
                return true;
            case StreamUpdate.TYPE_STATUS:
                // a manual retry also aborts the running attempt but keeps the stream registered
                return ConnectionStatus.ABORTED.value().equals(update.payload().get("status"))
                        && registry.getConnection(update.streamId()) == null;
            case StreamUpdate.TYPE_SNAPSHOT:
                return TERMINAL_STATUSES.contains(update.payload().get("status"))
                        && Boolean.FALSE.equals(update.payload().get("retryPending"));
            default:
                return false;
        }
    }
}
