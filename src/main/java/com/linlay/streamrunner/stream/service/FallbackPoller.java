package com.linlay.streamrunner.stream.service;

import com.linlay.streamrunner.config.StreamingProperties;
import com.linlay.streamrunner.stream.model.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Polls an out-of-band endpoint at a fixed interval for each enabled message id and hands the
 * returned events to a sink. At most one timer exists per message id, and a tick is skipped while
 * the previous request is still in flight.
 */
public class FallbackPoller {

    private static final Logger log = LoggerFactory.getLogger(FallbackPoller.class);

    private final StreamingProperties properties;
    private final FallbackUpdateClient client;
    private final Scheduler timerScheduler;
    private final Map<String, Disposable> timers = new ConcurrentHashMap<>();

    public FallbackPoller(StreamingProperties properties, FallbackUpdateClient client, Scheduler timerScheduler) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.timerScheduler = Objects.requireNonNull(timerScheduler, "timerScheduler must not be null");
    }

    /**
     * @return {@code true} if a new timer was created, {@code false} when fallback is disabled or
     * the message id already has one
     */
    public boolean enable(String messageId, String endpoint, Consumer<List<StreamEvent>> sink) {
        if (!properties.isEnableFallback()) {
            log.debug("fallback polling disabled, ignoring enable for message {}", messageId);
            return false;
        }
        if (messageId == null || messageId.isBlank() || endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("messageId and endpoint are required");
        }
        Objects.requireNonNull(sink, "sink must not be null");
        AtomicBoolean created = new AtomicBoolean(false);
        timers.computeIfAbsent(messageId, key -> {
            created.set(true);
            return schedule(key, endpoint.trim(), sink);
        });
        if (created.get()) {
            log.info("fallback polling enabled message={} endpoint={} intervalMs={}",
                    messageId, endpoint, properties.getFallbackPollingIntervalMs());
        }
        return created.get();
    }

    public boolean disable(String messageId) {
        if (messageId == null) {
            return false;
        }
        Disposable timer = timers.remove(messageId);
        if (timer == null) {
            return false;
        }
        timer.dispose();
        log.info("fallback polling disabled message={}", messageId);
        return true;
    }

    public void disableAll() {
        timers.keySet().forEach(this::disable);
    }

    public boolean isEnabled(String messageId) {
        return messageId != null && timers.containsKey(messageId);
    }

    public Set<String> activeMessageIds() {
        return Set.copyOf(timers.keySet());
    }

    private Disposable schedule(String messageId, String endpoint, Consumer<List<StreamEvent>> sink) {
        long intervalMs = Math.max(1L, properties.getFallbackPollingIntervalMs());
        AtomicBoolean inFlight = new AtomicBoolean(false);
        return timerScheduler.schedulePeriodically(
                () -> poll(messageId, endpoint, sink, inFlight),
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS
        );
    }

    private void poll(String messageId, String endpoint, Consumer<List<StreamEvent>> sink, AtomicBoolean inFlight) {
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("fallback poll for message {} still in flight, skipping tick", messageId);
            return;
        }
        try {
            client.fetch(endpoint, messageId).subscribe(
                    events -> deliver(messageId, events, sink),
                    ex -> {
                        inFlight.set(false);
                        log.warn("fallback poll failed message={} endpoint={}: {}", messageId, endpoint, ex.toString());
                    },
                    () -> inFlight.set(false)
            );
        } catch (RuntimeException ex) {
            inFlight.set(false);
            log.warn("fallback poll could not start message={} endpoint={}", messageId, endpoint, ex);
        }
    }

    private void deliver(String messageId, List<StreamEvent> events, Consumer<List<StreamEvent>> sink) {
        if (events == null || events.isEmpty() || !timers.containsKey(messageId)) {
            return;
        }
        try {
            sink.accept(events);
        } catch (RuntimeException ex) {
            log.warn("fallback update for message {} could not be applied", messageId, ex);
        }
    }
}
