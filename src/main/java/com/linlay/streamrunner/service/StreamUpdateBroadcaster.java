package com.linlay.streamrunner.service;

import com.linlay.streamrunner.model.StreamUpdate;
import com.linlay.streamrunner.stream.model.ConnectionStatus;
import com.linlay.streamrunner.stream.model.FinalMessage;
import com.linlay.streamrunner.stream.model.StreamError;
import com.linlay.streamrunner.stream.service.StreamCallbacks;
import com.linlay.streamrunner.stream.service.StreamEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Republishes registry callbacks as a hot {@link Flux} of {@link StreamUpdate}s. Subscribers only
 * see updates emitted after they subscribe; slow subscribers drop updates instead of stalling
 * consume loops.
 */
@Service
public class StreamUpdateBroadcaster implements StreamCallbacks {

    private static final Logger log = LoggerFactory.getLogger(StreamUpdateBroadcaster.class);

    private final Sinks.Many<StreamUpdate> sink = Sinks.many().multicast().directBestEffort();
    private final AtomicLong seq = new AtomicLong(0);
    private final Clock clock;

    public StreamUpdateBroadcaster(Clock streamingClock) {
        this.clock = streamingClock;
    }

    public Flux<StreamUpdate> updates() {
        return sink.asFlux();
    }

    public Flux<StreamUpdate> updates(String streamId) {
        return sink.asFlux().filter(update -> update.streamId().equals(streamId));
    }

    /**
     * Builds an update describing the stream as it is now, for subscribers that join late. It is
     * not published.
     */
    public StreamUpdate snapshot(String streamId, Map<String, Object> payload) {
        return new StreamUpdate(seq.get(), streamId, StreamUpdate.TYPE_SNAPSHOT, clock.millis(), payload);
    }

    @Override
    public void onProgress(String streamId, double percent, long tokenCount) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("progress", percent);
        payload.put("tokenCount", tokenCount);
        emit(streamId, StreamUpdate.TYPE_PROGRESS, payload);
    }

    @Override
    public void onComplete(String streamId, FinalMessage finalMessage) {
        emit(streamId, StreamUpdate.TYPE_COMPLETE, Map.of("message", finalMessage));
    }

    @Override
    public void onError(String streamId, Throwable error) {
        StreamError streamError = error instanceof StreamEventException eventError && eventError.getError() != null
                ? eventError.getError()
                : StreamError.from(error);
        emit(streamId, StreamUpdate.TYPE_ERROR, Map.of("error", streamError));
    }

    @Override
    public void onStatusChange(String streamId, ConnectionStatus status) {
        emit(streamId, StreamUpdate.TYPE_STATUS, Map.of("status", status.value()));
    }

    @Override
    public void onRetryScheduled(String streamId, int attempt, Duration delay) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("attempt", attempt);
        payload.put("delayMs", delay.toMillis());
        emit(streamId, StreamUpdate.TYPE_RETRY, payload);
    }

    private synchronized void emit(String streamId, String type, Map<String, Object> payload) {
        StreamUpdate update = new StreamUpdate(seq.incrementAndGet(), streamId, type, clock.millis(), payload);
        Sinks.EmitResult result = sink.tryEmitNext(update);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.trace("stream update emit result={} streamId={} type={}", result, streamId, type);
        }
    }
}
