package com.linlay.streamrunner.stream.service;

import com.linlay.streamrunner.config.StreamingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Decides whether a failed stream is restarted. Attempt {@code n} (zero based) waits
 * {@code reconnectDelay * 2^n}; once {@code reconnectAttempts} retries have been scheduled the
 * failure is final.
 */
public class StreamRetryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(StreamRetryCoordinator.class);
    private static final int MAX_BACKOFF_SHIFT = 20;

    private final StreamingProperties properties;
    private final Scheduler timerScheduler;
    private final Map<String, Integer> attempts = new ConcurrentHashMap<>();
    private final Map<String, Disposable.Swap> pending = new ConcurrentHashMap<>();

    public StreamRetryCoordinator(StreamingProperties properties, Scheduler timerScheduler) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.timerScheduler = Objects.requireNonNull(timerScheduler, "timerScheduler must not be null");
    }

    public synchronized RetryDecision onFailure(String streamId, Throwable error, Runnable restart) {
        int attempt = attempts(streamId);
        if (!properties.isEnableAutoRetry()) {
            return RetryDecision.exhausted(attempt);
        }
        if (attempt >= properties.getReconnectAttempts()) {
            log.info("stream {} retries exhausted after {} attempts", streamId, attempt);
            return RetryDecision.exhausted(attempt);
        }
        Duration delay = backoff(attempt);
        attempts.put(streamId, attempt + 1);

        Disposable.Swap slot = Disposables.swap();
        Disposable.Swap previous = pending.put(streamId, slot);
        if (previous != null) {
            previous.dispose();
        }
        try {
            slot.update(timerScheduler.schedule(() -> {
                if (pending.remove(streamId, slot)) {
                    restart.run();
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException ex) {
            pending.remove(streamId, slot);
            log.warn("stream {} retry could not be scheduled", streamId, ex);
            return RetryDecision.exhausted(attempt + 1);
        }
        log.info("stream {} retry {} scheduled in {}ms after: {}", streamId, attempt + 1, delay.toMillis(),
                error == null ? "unknown error" : error.toString());
        return RetryDecision.scheduled(attempt + 1, delay);
    }

    public Duration backoff(int attempt) {
        int shift = Math.min(Math.max(attempt, 0), MAX_BACKOFF_SHIFT);
        long delayMs = properties.getReconnectDelayMs();
        if (delayMs > (Long.MAX_VALUE >> shift)) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        return Duration.ofMillis(delayMs << shift);
    }

    public int attempts(String streamId) {
        return attempts.getOrDefault(streamId, 0);
    }

    public boolean isRetryPending(String streamId) {
        return pending.containsKey(streamId);
    }

    /**
     * Cancels the pending retry and zeroes the counter, as a manual retry or a fresh start does.
     */
    public synchronized void reset(String streamId) {
        cancel(streamId);
        attempts.remove(streamId);
    }

    public void markSucceeded(String streamId) {
        attempts.remove(streamId);
    }

    public boolean cancel(String streamId) {
        Disposable.Swap slot = pending.remove(streamId);
        if (slot == null) {
            return false;
        }
        slot.dispose();
        return true;
    }

    public void cancelAll() {
        pending.keySet().forEach(this::cancel);
    }
}
