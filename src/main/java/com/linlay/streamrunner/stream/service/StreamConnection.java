package com.linlay.streamrunner.stream.service;

import com.linlay.streamrunner.stream.model.ConnectionStatus;
import com.linlay.streamrunner.stream.model.StreamEvent;
import com.linlay.streamrunner.stream.model.StreamState;
import com.linlay.streamrunner.stream.source.StreamReader;
import com.linlay.streamrunner.stream.source.StreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One attempt at consuming a stream. Moves {@code connecting -> streaming} synchronously in
 * {@link #begin()} and then to exactly one of {@code completed}, {@code error} or {@code aborted}.
 * Terminal states are final; events arriving afterwards are dropped.
 *
 * <p>Cancellation is cooperative: {@link #abort()} raises a flag that the consume loop checks
 * between events. A read already waiting on the source is not interrupted, but the read handle is
 * always released when the loop exits.</p>
 */
public class StreamConnection {

    private static final Logger log = LoggerFactory.getLogger(StreamConnection.class);

    interface Listener {

        void onStatusChange(StreamConnection connection, ConnectionStatus status);

        void onEvent(StreamConnection connection, StreamEvent event, StreamState before, StreamState after);

        void onCompleted(StreamConnection connection);

        void onFailed(StreamConnection connection, Throwable error);
    }

    private final String id;
    private final String messageId;
    private final int attempt;
    private final Instant startedAt;
    private final StreamSource source;
    private final StreamEventReducer reducer;
    private final Listener listener;

    private final AtomicReference<ConnectionStatus> status = new AtomicReference<>(ConnectionStatus.CONNECTING);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    private volatile StreamState state = StreamState.initial();
    private volatile Throwable failure;
    private volatile double lastProgress;

    StreamConnection(
            String id,
            String messageId,
            int attempt,
            Instant startedAt,
            StreamSource source,
            StreamEventReducer reducer,
            Listener listener
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.messageId = messageId;
        this.attempt = attempt;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.reducer = Objects.requireNonNull(reducer, "reducer must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    public String id() {
        return id;
    }

    public String messageId() {
        return messageId;
    }

    public int attempt() {
        return attempt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public ConnectionStatus status() {
        return status.get();
    }

    public StreamState state() {
        return state;
    }

    public Throwable failure() {
        return failure;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    double lastProgress() {
        return lastProgress;
    }

    void lastProgress(double value) {
        this.lastProgress = value;
    }

    void begin() {
        if (!transition(ConnectionStatus.STREAMING)) {
            throw new IllegalStateException("connection " + id + " cannot begin from status " + status.get());
        }
    }

    /**
     * Drains the source until it is exhausted, fails, or the connection is cancelled.
     */
    void consume() {
        if (status.get() != ConnectionStatus.STREAMING) {
            return;
        }
        log.debug("stream {} attempt {} consuming", id, attempt);
        try (StreamReader reader = source.open()) {
            while (!cancelled.get()) {
                StreamEvent event = reader.next();
                if (event == null || cancelled.get()) {
                    break;
                }
                if (!apply(event)) {
                    break;
                }
                if (event instanceof StreamEvent.Error value) {
                    throw new StreamEventException(id, value.error());
                }
            }
        } catch (Exception ex) {
            fail(ex);
            return;
        }
        if (cancelled.get()) {
            abort();
            return;
        }
        complete();
    }

    /**
     * Folds an event delivered outside the consume loop, e.g. by fallback polling. Error events
     * are recorded but do not fail the connection.
     */
    boolean inject(StreamEvent event) {
        return apply(event);
    }

    boolean abort() {
        cancelled.set(true);
        return transition(ConnectionStatus.ABORTED);
    }

    boolean fail(Throwable error) {
        if (!transition(ConnectionStatus.ERROR)) {
            log.debug("stream {} failure after terminal status ignored: {}", id, error.toString());
            return false;
        }
        this.failure = error;
        log.warn("stream {} attempt {} failed: {}", id, attempt, error.toString());
        listener.onFailed(this, error);
        return true;
    }

    boolean expire(Duration timeout) {
        cancelled.set(true);
        return fail(new StreamTimeoutException(id, timeout));
    }

    private boolean complete() {
        if (!transition(ConnectionStatus.COMPLETED)) {
            return false;
        }
        log.debug("stream {} attempt {} completed tokens={}", id, attempt, state.tokenCount());
        listener.onCompleted(this);
        return true;
    }

    private boolean apply(StreamEvent event) {
        StreamState before;
        StreamState after;
        synchronized (stateLock) {
            if (status.get().isTerminal()) {
                return false;
            }
            before = state;
            after = reducer.reduce(before, event);
            state = after;
        }
        listener.onEvent(this, event, before, after);
        return true;
    }

    private boolean transition(ConnectionStatus target) {
        while (true) {
            ConnectionStatus current = status.get();
            if (current.isTerminal() || current == target) {
                return false;
            }
            if (target == ConnectionStatus.STREAMING && current != ConnectionStatus.CONNECTING) {
                return false;
            }
            if (status.compareAndSet(current, target)) {
                listener.onStatusChange(this, target);
                return true;
            }
        }
    }
}
