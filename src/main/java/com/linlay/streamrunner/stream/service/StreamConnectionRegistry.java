package com.linlay.streamrunner.stream.service;

import com.linlay.streamrunner.config.StreamingProperties;
import com.linlay.streamrunner.stream.model.ConnectionStatus;
import com.linlay.streamrunner.stream.model.FinalMessage;
import com.linlay.streamrunner.stream.model.StreamError;
import com.linlay.streamrunner.stream.model.StreamEvent;
import com.linlay.streamrunner.stream.model.StreamState;
import com.linlay.streamrunner.stream.source.StreamSource;
import com.linlay.streamrunner.stream.source.StreamSourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Multiplexes stream connections: admission control, lifecycle, retries, fallback polling and
 * aggregate metrics.
 *
 * <p>Each connection consumes its source on the work scheduler; retry, poll, watchdog and
 * retention timers run on the timer scheduler. Admission, restart and removal are serialized on
 * this registry.</p>
 */
public class StreamConnectionRegistry implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(StreamConnectionRegistry.class);

    private static final double MAX_ESTIMATED_PROGRESS = 90.0;
    private static final double MAX_TEXT_PROGRESS = 95.0;
    private static final double EXPECTED_TEXT_LENGTH = 1000.0;

    private final StreamingProperties properties;
    private final StreamEventReducer reducer;
    private final StreamRetryCoordinator retryCoordinator;
    private final FallbackPoller fallbackPoller;
    private final Scheduler workScheduler;
    private final Scheduler timerScheduler;
    private final Clock clock;

    private final Map<String, ManagedStream> streams = new ConcurrentHashMap<>();
    private final List<StreamCallbacks> callbacks = new CopyOnWriteArrayList<>();
    private final Deque<StreamFailure> failures = new ArrayDeque<>();
    private final AtomicLong totalTokens = new AtomicLong(0);
    private final ConnectionEvents connectionEvents = new ConnectionEvents();
    private final Object metricsLock = new Object();

    private volatile StreamingMetrics metrics = StreamingMetrics.empty();

    public StreamConnectionRegistry(
            StreamingProperties properties,
            StreamEventReducer reducer,
            StreamRetryCoordinator retryCoordinator,
            FallbackPoller fallbackPoller,
            Scheduler workScheduler,
            Scheduler timerScheduler,
            Clock clock
    ) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.reducer = Objects.requireNonNull(reducer, "reducer must not be null");
        this.retryCoordinator = Objects.requireNonNull(retryCoordinator, "retryCoordinator must not be null");
        this.fallbackPoller = Objects.requireNonNull(fallbackPoller, "fallbackPoller must not be null");
        this.workScheduler = Objects.requireNonNull(workScheduler, "workScheduler must not be null");
        this.timerScheduler = Objects.requireNonNull(timerScheduler, "timerScheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void addCallbacks(StreamCallbacks listener) {
        callbacks.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeCallbacks(StreamCallbacks listener) {
        callbacks.remove(listener);
    }

    public StreamConnection start(String streamId, StreamSource source, String messageId) {
        return start(streamId, StreamSourceFactory.of(source), messageId);
    }

    /**
     * Starts consuming a new stream. The connection is already {@code streaming} when this
     * returns.
     *
     * @throws StreamAdmissionException when {@code maxConcurrentStreams} connections are streaming;
     *                                  nothing is created in that case
     * @throws IllegalStateException    when the id already has a non-terminal connection
     */
    public StreamConnection start(String streamId, StreamSourceFactory sourceFactory, String messageId) {
        requireStreamId(streamId);
        Objects.requireNonNull(sourceFactory, "sourceFactory must not be null");
        StreamConnection connection;
        synchronized (this) {
            ManagedStream existing = streams.get(streamId);
            if (existing != null && !existing.connection.status().isTerminal()) {
                throw new IllegalStateException("stream already active: " + streamId);
            }
            ensureCapacity();
            StreamSource source = sourceFactory.create();
            if (existing != null) {
                existing.disposeTimers();
            }
            retryCoordinator.reset(streamId);
            ManagedStream managed = new ManagedStream(streamId, normalize(messageId), sourceFactory);
            connection = launch(managed, source, 0);
        }
        log.info("stream {} started message={}", streamId, connection.messageId());
        dispatch(connection);
        return connection;
    }

    /**
     * Aborts the stream, cancels its pending retry and fallback timer, and forgets it.
     *
     * @return {@code false} if the id was unknown
     */
    public boolean stop(String streamId) {
        ManagedStream managed;
        synchronized (this) {
            managed = streams.remove(streamId);
        }
        if (managed == null) {
            return false;
        }
        retryCoordinator.reset(streamId);
        managed.disposeTimers();
        fallbackPoller.disable(managed.messageId);
        if (managed.connection.abort()) {
            log.info("stream {} stopped", streamId);
        }
        refreshMetrics();
        return true;
    }

    public void stopAll() {
        for (String streamId : Set.copyOf(streams.keySet())) {
            stop(streamId);
        }
        retryCoordinator.cancelAll();
        fallbackPoller.disableAll();
        refreshMetrics();
    }

    /**
     * Manual retry: zeroes the attempt counter, abandons the current attempt if it is still running
     * and starts a new one from a fresh source. When admission or source creation fails the current
     * attempt is left untouched.
     */
    public StreamConnection retry(String streamId) {
        StreamConnection connection;
        synchronized (this) {
            ManagedStream managed = streams.get(streamId);
            if (managed == null) {
                throw new StreamNotFoundException(streamId);
            }
            StreamConnection previous = managed.connection;
            ensureCapacity(previous);
            StreamSource source = managed.sourceFactory.create();
            // the running attempt is only abandoned once a fresh source is in hand
            retryCoordinator.reset(streamId);
            managed.disposeTimers();
            previous.abort();
            connection = launch(managed, source, 0);
        }
        log.info("stream {} manually retried", streamId);
        dispatch(connection);
        return connection;
    }

    public boolean enableFallback(String messageId, String endpoint) {
        return fallbackPoller.enable(messageId, endpoint, events -> injectFallbackEvents(messageId, events));
    }

    public boolean disableFallback(String messageId) {
        return fallbackPoller.disable(messageId);
    }

    public boolean isFallbackEnabled(String messageId) {
        return fallbackPoller.isEnabled(messageId);
    }

    public Set<String> fallbackMessageIds() {
        return fallbackPoller.activeMessageIds();
    }

    /**
     * Folds polled events into every streaming connection that carries the message id.
     *
     * @return number of connections updated
     */
    public int injectFallbackEvents(String messageId, List<StreamEvent> events) {
        if (messageId == null || events == null || events.isEmpty()) {
            return 0;
        }
        int updated = 0;
        for (ManagedStream managed : streams.values()) {
            if (!messageId.equals(managed.messageId)) {
                continue;
            }
            StreamConnection connection = managed.connection;
            if (connection.status() != ConnectionStatus.STREAMING) {
                continue;
            }
            boolean applied = false;
            for (StreamEvent event : events) {
                applied |= connection.inject(event);
            }
            if (applied) {
                updated++;
            }
        }
        if (updated > 0) {
            log.debug("fallback update for message {} applied to {} connection(s)", messageId, updated);
        }
        return updated;
    }

    public boolean isStreamActive(String streamId) {
        return getStreamStatus(streamId) == ConnectionStatus.STREAMING;
    }

    public ConnectionStatus getStreamStatus(String streamId) {
        StreamConnection connection = connection(streamId);
        return connection == null ? null : connection.status();
    }

    public StreamState getStreamState(String streamId) {
        StreamConnection connection = connection(streamId);
        return connection == null ? null : connection.state();
    }

    public StreamConnection getConnection(String streamId) {
        return connection(streamId);
    }

    /**
     * Rough completion estimate. Capped at 90 while active so nothing reads 100 before the stream
     * really completes.
     */
    public double getStreamProgress(String streamId) {
        StreamConnection connection = connection(streamId);
        if (connection == null) {
            return 0;
        }
        ConnectionStatus status = connection.status();
        if (status == ConnectionStatus.COMPLETED) {
            return 100;
        }
        if (status == ConnectionStatus.ERROR || status == ConnectionStatus.ABORTED) {
            return 0;
        }
        long elapsed = Math.max(0L, clock.millis() - connection.startedAt().toEpochMilli());
        double timeout = Math.max(1L, properties.getConnectionTimeoutMs());
        return Math.min(MAX_ESTIMATED_PROGRESS, elapsed / timeout * 100.0);
    }

    public int getAttempts(String streamId) {
        return retryCoordinator.attempts(streamId);
    }

    public boolean isRetryPending(String streamId) {
        return retryCoordinator.isRetryPending(streamId);
    }

    public Set<String> streamIds() {
        return Set.copyOf(streams.keySet());
    }

    public StreamingMetrics metrics() {
        return metrics;
    }

    public List<StreamFailure> errors() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    public void clearErrors() {
        synchronized (failures) {
            failures.clear();
        }
    }

    @Override
    public void destroy() {
        stopAll();
    }

    private StreamConnection connection(String streamId) {
        if (streamId == null) {
            return null;
        }
        ManagedStream managed = streams.get(streamId);
        return managed == null ? null : managed.connection;
    }

    private void ensureCapacity() {
        ensureCapacity(null);
    }

    private void ensureCapacity(StreamConnection replacing) {
        long active = streams.values().stream()
                .map(managed -> managed.connection)
                .filter(connection -> connection != replacing && connection.status() == ConnectionStatus.STREAMING)
                .count();
        if (active >= properties.getMaxConcurrentStreams()) {
            log.warn("stream admission rejected active={} max={}", active, properties.getMaxConcurrentStreams());
            throw new StreamAdmissionException(properties.getMaxConcurrentStreams());
        }
    }

    private StreamConnection launch(ManagedStream managed, StreamSource source, int attempt) {
        StreamConnection connection = new StreamConnection(
                managed.streamId,
                managed.messageId,
                attempt,
                clock.instant(),
                source,
                reducer,
                connectionEvents
        );
        managed.connection = connection;
        // registered before begin() so the streaming transition is counted; a no-op on restarts
        streams.put(managed.streamId, managed);
        connection.begin();
        armWatchdog(managed, connection);
        return connection;
    }

    private void dispatch(StreamConnection connection) {
        try {
            workScheduler.schedule(connection::consume);
        } catch (RejectedExecutionException ex) {
            connection.fail(ex);
        }
    }

    /**
     * Automatic restart fired by the retry coordinator. Skipped if the stream was stopped or
     * restarted in the meantime.
     */
    private void restart(String streamId) {
        StreamConnection connection;
        synchronized (this) {
            ManagedStream managed = streams.get(streamId);
            if (managed == null || managed.connection.status() != ConnectionStatus.ERROR) {
                return;
            }
            StreamConnection failed = managed.connection;
            try {
                ensureCapacity();
                StreamSource source = managed.sourceFactory.create();
                connection = launch(managed, source, retryCoordinator.attempts(streamId));
            } catch (RuntimeException ex) {
                log.warn("stream {} restart failed: {}", streamId, ex.toString());
                handleFailure(managed, failed, ex);
                return;
            }
        }
        log.info("stream {} restarting attempt {}", streamId, connection.attempt());
        dispatch(connection);
    }

    private void handleFailure(ManagedStream managed, StreamConnection connection, Throwable error) {
        recordFailure(connection, error);
        RetryDecision decision = retryCoordinator.onFailure(managed.streamId, error, () -> restart(managed.streamId));
        if (decision.scheduled()) {
            fireCallbacks(listener -> listener.onRetryScheduled(managed.streamId, decision.attempt(), decision.delay()));
            return;
        }
        fireCallbacks(listener -> listener.onError(managed.streamId, error));
        scheduleRetention(managed, connection);
    }

    private void recordFailure(StreamConnection connection, Throwable error) {
        StreamError streamError = error instanceof StreamEventException eventError && eventError.getError() != null
                ? eventError.getError()
                : StreamError.from(error);
        synchronized (failures) {
            failures.addLast(new StreamFailure(connection.id(), connection.attempt(), streamError, clock.instant()));
            while (failures.size() > properties.getMaxRecordedErrors()) {
                failures.removeFirst();
            }
        }
    }

    private void armWatchdog(ManagedStream managed, StreamConnection connection) {
        if (!properties.isEnforceConnectionTimeout()) {
            return;
        }
        Duration timeout = Duration.ofMillis(Math.max(1L, properties.getConnectionTimeoutMs()));
        managed.replaceWatchdog(timerScheduler.schedule(() -> {
            if (managed.connection == connection && connection.status() == ConnectionStatus.STREAMING) {
                log.warn("stream {} exceeded connection timeout {}ms", connection.id(), timeout.toMillis());
                connection.expire(timeout);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void scheduleRetention(ManagedStream managed, StreamConnection connection) {
        long retentionMs = properties.getCompletedRetentionMs();
        if (retentionMs <= 0) {
            return;
        }
        managed.replaceRetention(timerScheduler.schedule(() -> {
            boolean removed;
            synchronized (this) {
                removed = managed.connection == connection
                        && !retryCoordinator.isRetryPending(managed.streamId)
                        && streams.remove(managed.streamId, managed);
            }
            if (removed) {
                log.debug("stream {} expired after {}ms retention", managed.streamId, retentionMs);
                refreshMetrics();
            }
        }, retentionMs, TimeUnit.MILLISECONDS));
    }

    private double progressFor(StreamConnection connection, StreamEvent event, StreamState state) {
        if (event instanceof StreamEvent.Finish) {
            return 100.0;
        }
        if (event instanceof StreamEvent.TextDelta) {
            return Math.min(MAX_TEXT_PROGRESS, state.text().length() / EXPECTED_TEXT_LENGTH * 100.0);
        }
        return connection.lastProgress();
    }

    private void refreshMetrics() {
        synchronized (metricsLock) {
            metrics = countMetrics();
        }
    }

    private StreamingMetrics countMetrics() {
        int active = 0;
        int completed = 0;
        for (ManagedStream managed : streams.values()) {
            ConnectionStatus status = managed.connection.status();
            if (status == ConnectionStatus.STREAMING) {
                active++;
            } else if (status == ConnectionStatus.COMPLETED) {
                completed++;
            }
        }
        return new StreamingMetrics(active > 0, active, completed, streams.size(), totalTokens.get());
    }

    private ManagedStream currentOwner(StreamConnection connection) {
        ManagedStream managed = streams.get(connection.id());
        return managed != null && managed.connection == connection ? managed : null;
    }

    private void fireCallbacks(Consumer<StreamCallbacks> action) {
        for (StreamCallbacks listener : callbacks) {
            try {
                action.accept(listener);
            } catch (RuntimeException ex) {
                log.warn("stream callback {} failed", listener.getClass().getSimpleName(), ex);
            }
        }
    }

    private static void requireStreamId(String streamId) {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId is required");
        }
    }

    private static String normalize(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private final class ConnectionEvents implements StreamConnection.Listener {

        @Override
        public void onStatusChange(StreamConnection connection, ConnectionStatus status) {
            refreshMetrics();
            log.debug("stream {} attempt {} -> {}", connection.id(), connection.attempt(), status.value());
            fireCallbacks(listener -> listener.onStatusChange(connection.id(), status));
        }

        @Override
        public void onEvent(StreamConnection connection, StreamEvent event, StreamState before, StreamState after) {
            long delta = after.tokenCount() - before.tokenCount();
            if (delta > 0) {
                totalTokens.addAndGet(delta);
                refreshMetrics();
            }
            double percent = progressFor(connection, event, after);
            connection.lastProgress(percent);
            fireCallbacks(listener -> listener.onProgress(connection.id(), percent, after.tokenCount()));
        }

        @Override
        public void onCompleted(StreamConnection connection) {
            ManagedStream managed = currentOwner(connection);
            if (managed == null) {
                return;
            }
            retryCoordinator.markSucceeded(connection.id());
            managed.disposeWatchdog();
            fallbackPoller.disable(managed.messageId);
            String messageId = managed.messageId != null ? managed.messageId : managed.streamId;
            FinalMessage message = connection.state().toFinalMessage(messageId, clock.instant());
            fireCallbacks(listener -> listener.onComplete(connection.id(), message));
            scheduleRetention(managed, connection);
        }

        @Override
        public void onFailed(StreamConnection connection, Throwable error) {
            ManagedStream managed = currentOwner(connection);
            if (managed == null) {
                return;
            }
            managed.disposeWatchdog();
            handleFailure(managed, connection, error);
        }
    }

    private static final class ManagedStream {

        private final String streamId;
        private final String messageId;
        private final StreamSourceFactory sourceFactory;

        private volatile StreamConnection connection;
        private Disposable watchdog;
        private Disposable retention;

        private ManagedStream(String streamId, String messageId, StreamSourceFactory sourceFactory) {
            this.streamId = streamId;
            this.messageId = messageId;
            this.sourceFactory = sourceFactory;
        }

        private synchronized void replaceWatchdog(Disposable next) {
            if (watchdog != null) {
                watchdog.dispose();
            }
            watchdog = next;
        }

        private synchronized void replaceRetention(Disposable next) {
            if (retention != null) {
                retention.dispose();
            }
            retention = next;
        }

        private synchronized void disposeWatchdog() {
            replaceWatchdog(null);
        }

        private synchronized void disposeTimers() {
            replaceWatchdog(null);
            replaceRetention(null);
        }
    }
}
