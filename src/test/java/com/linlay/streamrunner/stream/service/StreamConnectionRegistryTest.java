package com.linlay.streamrunner.stream.service;

import com.linlay.streamrunner.config.StreamingProperties;
import com.linlay.streamrunner.stream.model.ConnectionStatus;
import com.linlay.streamrunner.stream.model.FinalMessage;
import com.linlay.streamrunner.stream.model.StreamEvent;
import com.linlay.streamrunner.stream.model.StreamError;
import com.linlay.streamrunner.stream.model.TokenUsage;
import com.linlay.streamrunner.stream.source.FluxStreamSource;
import com.linlay.streamrunner.stream.source.IterableStreamSource;
import com.linlay.streamrunner.stream.source.SourceNotReplayableException;
import com.linlay.streamrunner.stream.source.StreamReader;
import com.linlay.streamrunner.stream.source.StreamSource;
import com.linlay.streamrunner.stream.source.StreamSourceFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StreamConnectionRegistryTest {

    private final VirtualTimeScheduler timer = VirtualTimeScheduler.create();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final RecordingCallbacks callbacks = new RecordingCallbacks();
    private final List<StreamEvent> polled = new CopyOnWriteArrayList<>();

    private StreamConnectionRegistry registry;

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.destroy();
        }
        timer.dispose();
    }

    @Test
    void admissionShouldRejectBeyondCapAndAdmitAgainAfterCompletion() {
        QueuedScheduler work = new QueuedScheduler();
        registry = newRegistry(properties(), work);

        for (int i = 1; i <= 5; i++) {
            registry.start("s" + i, completingSource("hello"), null);
        }
        assertThat(registry.metrics().activeStreams()).isEqualTo(5);

        assertThatThrownBy(() -> registry.start("s6", completingSource("x"), null))
                .isInstanceOf(StreamAdmissionException.class)
                .hasMessage("Maximum concurrent streams (5) exceeded");
        assertThat(registry.streamIds()).hasSize(5).doesNotContain("s6");
        assertThat(work.pending()).isEqualTo(5);

        work.runNext();
        assertThat(registry.getStreamStatus("s1")).isEqualTo(ConnectionStatus.COMPLETED);

        StreamConnection seventh = registry.start("s7", completingSource("x"), null);
        assertThat(seventh.status()).isEqualTo(ConnectionStatus.STREAMING);
        assertThat(registry.metrics().activeStreams()).isEqualTo(5);
        assertThat(registry.metrics().completedStreams()).isEqualTo(1);
    }

    @Test
    void startShouldRejectDuplicateActiveIdButAllowRestartOfFinishedId() {
        QueuedScheduler work = new QueuedScheduler();
        registry = newRegistry(properties(), work);

        registry.start("s1", completingSource("a"), "m1");
        assertThatThrownBy(() -> registry.start("s1", completingSource("b"), "m1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already active");

        work.runAll();
        StreamConnection again = registry.start("s1", completingSource("b"), "m1");
        work.runAll();

        assertThat(again.status()).isEqualTo(ConnectionStatus.COMPLETED);
        assertThat(registry.getStreamState("s1").text()).isEqualTo("b");
    }

    @Test
    void completedStreamShouldReportFinalMessageAndFullProgress() {
        registry = newRegistry(properties(), Schedulers.immediate());

        registry.start("s1", IterableStreamSource.of(
                new StreamEvent.TextDelta("Hel"),
                new StreamEvent.TextDelta("lo"),
                new StreamEvent.Finish("stop", new TokenUsage(2L, null, null, null, null))
        ), null);

        assertThat(registry.getStreamStatus("s1")).isEqualTo(ConnectionStatus.COMPLETED);
        assertThat(registry.getStreamProgress("s1")).isEqualTo(100.0);
        assertThat(registry.getStreamState("s1").tokenCount()).isEqualTo(2L);
        assertThat(registry.isStreamActive("s1")).isFalse();
        assertThat(callbacks.completed).hasSize(1);
        FinalMessage message = callbacks.completed.get(0);
        assertThat(message.id()).isEqualTo("s1");
        assertThat(message.text()).isEqualTo("Hello");
        assertThat(callbacks.progress).last().isEqualTo(100.0);
        assertThat(callbacks.statuses).containsExactly(ConnectionStatus.STREAMING, ConnectionStatus.COMPLETED);
    }

    @Test
    void progressShouldEstimateFromElapsedTimeWhileStreaming() {
        QueuedScheduler work = new QueuedScheduler();
        registry = newRegistry(properties(), work);

        registry.start("s1", completingSource("x"), null);
        clock.advance(Duration.ofSeconds(3));
        assertThat(registry.getStreamProgress("s1")).isCloseTo(10.0, within(1e-9));

        clock.advance(Duration.ofMinutes(5));
        assertThat(registry.getStreamProgress("s1")).isEqualTo(90.0);
        assertThat(registry.getStreamProgress("missing")).isZero();

        registry.stop("s1");
        assertThat(registry.getStreamProgress("s1")).isZero();
    }

    @Test
    void failingStreamShouldBackOffExponentiallyThenReportError() {
        registry = newRegistry(properties(), Schedulers.immediate());

        registry.start("s1", alwaysFailing(), "m1");
        assertThat(registry.getAttempts("s1")).isEqualTo(1);
        assertThat(registry.isRetryPending("s1")).isTrue();
        assertThat(callbacks.errors).isEmpty();

        timer.advanceTimeBy(Duration.ofMillis(1000));
        assertThat(registry.getAttempts("s1")).isEqualTo(2);
        timer.advanceTimeBy(Duration.ofMillis(2000));
        assertThat(registry.getAttempts("s1")).isEqualTo(3);
        timer.advanceTimeBy(Duration.ofMillis(4000));

        assertThat(callbacks.retryDelays).containsExactly(
                Duration.ofMillis(1000),
                Duration.ofMillis(2000),
                Duration.ofMillis(4000)
        );
        assertThat(callbacks.errors).hasSize(1);
        assertThat(callbacks.errors.get(0)).isInstanceOf(IOException.class);
        assertThat(registry.getAttempts("s1")).isEqualTo(3);
        assertThat(registry.isRetryPending("s1")).isFalse();
        assertThat(registry.getStreamStatus("s1")).isEqualTo(ConnectionStatus.ERROR);
        assertThat(registry.getStreamProgress("s1")).isZero();
        assertThat(registry.errors()).hasSize(4)
                .extracting(StreamFailure::attempt)
                .containsExactly(0, 1, 2, 3);

        timer.advanceTimeBy(Duration.ofMinutes(1));
        assertThat(callbacks.errors).hasSize(1);
    }

    @Test
    void manualRetryShouldResetAttemptsAndUseFreshSource() {
        registry = newRegistry(properties(), Schedulers.immediate());
        AtomicInteger created = new AtomicInteger();
        StreamSourceFactory factory = () -> created.incrementAndGet() <= 3
                ? failingSource()
                : IterableStreamSource.of(new StreamEvent.TextDelta("recovered"));

        registry.start("s1", factory, null);
        timer.advanceTimeBy(Duration.ofMillis(1000));
        assertThat(registry.getAttempts("s1")).isEqualTo(2);

        StreamConnection retried = registry.retry("s1");
        assertThat(retried.attempt()).isZero();
        assertThat(registry.getAttempts("s1")).isEqualTo(1);

        timer.advanceTimeBy(Duration.ofMillis(1000));

        assertThat(created.get()).isEqualTo(4);
        assertThat(registry.getStreamStatus("s1")).isEqualTo(ConnectionStatus.COMPLETED);
        assertThat(registry.getStreamState("s1").text()).isEqualTo("recovered");
        assertThat(registry.getAttempts("s1")).isZero();
        assertThat(callbacks.errors).isEmpty();
    }

    @Test
    void retryOfUnknownStreamShouldFail() {
        registry = newRegistry(properties(), Schedulers.immediate());

        assertThatThrownBy(() -> registry.retry("missing")).isInstanceOf(StreamNotFoundException.class);
    }

    @Test
    void consumedNonReplayableSourceShouldCountAsFailedAttempt() {
        StreamingProperties properties = properties();
        properties.setReconnectAttempts(1);
        registry = newRegistry(properties, Schedulers.immediate());

        registry.start("s1", new FluxStreamSource(Flux.error(new IllegalStateException("reset"))), null);
        timer.advanceTimeBy(Duration.ofMillis(1000));

        assertThat(callbacks.errors).hasSize(1);
        assertThat(callbacks.errors.get(0)).isInstanceOf(SourceNotReplayableException.class);
        assertThatThrownBy(() -> registry.retry("s1")).isInstanceOf(SourceNotReplayableException.class);
    }

    @Test
    void rejectedRetryShouldLeaveRunningAttemptUntouched() {
        QueuedScheduler work = new QueuedScheduler();
        registry = newRegistry(properties(), work);

        StreamConnection running = registry.start("s1", new FluxStreamSource(Flux.just(new StreamEvent.TextDelta("x"))), null);

        assertThatThrownBy(() -> registry.retry("s1")).isInstanceOf(SourceNotReplayableException.class);
        assertThat(running.status()).isEqualTo(ConnectionStatus.STREAMING);
        assertThat(registry.getConnection("s1")).isSameAs(running);

        work.runAll();
        assertThat(registry.getStreamStatus("s1")).isEqualTo(ConnectionStatus.COMPLETED);
        assertThat(registry.getStreamState("s1").text()).isEqualTo("x");
    }

    @Test
    void retryAtCapacityShouldReplaceOwnAttempt() {
        StreamingProperties properties = properties();
        properties.setMaxConcurrentStreams(1);
        QueuedScheduler work = new QueuedScheduler();
        registry = newRegistry(properties, work);

        StreamConnection first = registry.start("s1", completingSource("again"), null);
        StreamConnection second = registry.retry("s1");

        assertThat(first.status()).isEqualTo(ConnectionStatus.ABORTED);
        assertThat(second.status()).isEqualTo(ConnectionStatus.STREAMING);
        assertThat(registry.metrics().activeStreams()).isEqualTo(1);
        assertThatThrownBy(() -> registry.start("s2", completingSource("y"), null))
                .isInstanceOf(StreamAdmissionException.class);
    }

    @Test
    void abortShouldReleaseReadHandle() {
        registry = newRegistry(properties(), Schedulers.immediate());
        registry.addCallbacks(new StreamCallbacks() {
            @Override
            public void onProgress(String streamId, double percent, long tokenCount) {
                registry.stop(streamId);
            }
        });
        FluxStreamSource source = new FluxStreamSource(Flux.just(
                new StreamEvent.TextDelta("a"),
                new StreamEvent.TextDelta("b"),
                new StreamEvent.TextDelta("c")
        ));

        StreamConnection connection = registry.start("s1", source, null);

        assertThat(connection.status()).isEqualTo(ConnectionStatus.ABORTED);
        assertThat(connection.state().text()).isEqualTo("a");
        assertThat(source.isLocked()).isFalse();
        assertThat(callbacks.completed).isEmpty();
    }

    @Test
    void thrownSourceErrorShouldReleaseReadHandle() {
        StreamingProperties properties = properties();
        properties.setEnableAutoRetry(false);
        registry = newRegistry(properties, Schedulers.immediate());
        FluxStreamSource source = new FluxStreamSource(Flux.<StreamEvent>concat(
                Flux.just(new StreamEvent.TextDelta("partial")),
                Flux.error(new IllegalStateException("upstream closed"))
        ));

        StreamConnection connection = registry.start("s1", source, null);

        assertThat(connection.status()).isEqualTo(ConnectionStatus.ERROR);
        assertThat(connection.failure()).hasMessageContaining("upstream closed");
        assertThat(source.isLocked()).isFalse();
    }

    @Test
    void errorEventShouldReleaseReadHandle() {
        StreamingProperties properties = properties();
        properties.setEnableAutoRetry(false);
        registry = newRegistry(properties, Schedulers.immediate());
        FluxStreamSource source = new FluxStreamSource(Flux.just(
                new StreamEvent.TextDelta("partial"),
                new StreamEvent.Error(new StreamError("overloaded", "503")),
                new StreamEvent.TextDelta("never")
        ));

        StreamConnection connection = registry.start("s1", source, null);

        assertThat(connection.status()).isEqualTo(ConnectionStatus.ERROR);
        assertThat(connection.failure()).isInstanceOf(StreamEventException.class);
        assertThat(source.isLocked()).isFalse();
    }

    @Test
    void errorEventShouldFailConnectionWithReportedError() {
        StreamingProperties properties = properties();
        properties.setEnableAutoRetry(false);
        registry = newRegistry(properties, Schedulers.immediate());

        registry.start("s1", IterableStreamSource.of(
                new StreamEvent.TextDelta("partial"),
                new StreamEvent.Error(new StreamError("quota exceeded", "429")),
                new StreamEvent.TextDelta("never")
        ), null);

        assertThat(registry.getStreamStatus("s1")).isEqualTo(ConnectionStatus.ERROR);
        assertThat(registry.getStreamState("s1").text()).isEqualTo("partial");
        assertThat(callbacks.errors).hasSize(1);
        assertThat(callbacks.errors.get(0)).isInstanceOf(StreamEventException.class);
        assertThat(registry.errors()).extracting(failure -> failure.error().code()).containsExactly("429");

        registry.clearErrors();
        assertThat(registry.errors()).isEmpty();
    }

    @Test
    void stopAllShouldLeaveNoStreamingConnectionsOrFallbackTimers() {
        QueuedScheduler work = new QueuedScheduler();
        registry = newRegistry(properties(), work);

        registry.start("s1", completingSource("a"), "m1");
        registry.start("s2", completingSource("b"), "m2");
        registry.start("s3", completingSource("c"), null);
        assertThat(registry.enableFallback("m1", "http://localhost/updates")).isTrue();
        assertThat(registry.enableFallback("m2", "http://localhost/updates")).isTrue();

        registry.stopAll();
        work.runAll();

        assertThat(registry.metrics().activeStreams()).isZero();
        assertThat(registry.metrics().streaming()).isFalse();
        assertThat(registry.streamIds()).isEmpty();
        assertThat(registry.fallbackMessageIds()).isEmpty();
        assertThat(registry.stop("s1")).isFalse();
        assertThat(callbacks.completed).isEmpty();
    }

    @Test
    void fallbackEventsShouldFoldIntoStreamingConnection() {
        QueuedScheduler work = new QueuedScheduler();
        registry = newRegistry(properties(), work);
        polled.add(new StreamEvent.TextDelta("from poll"));

        registry.start("s1", completingSource(" and stream"), "m1");
        assertThat(registry.enableFallback("m1", "http://localhost/updates")).isTrue();
        assertThat(registry.enableFallback("m1", "http://localhost/other")).isFalse();

        timer.advanceTimeBy(Duration.ofMillis(2000));
        assertThat(registry.getStreamState("s1").text()).isEqualTo("from poll");

        polled.clear();
        work.runAll();

        assertThat(registry.getStreamState("s1").text()).isEqualTo("from poll and stream");
        assertThat(registry.isFallbackEnabled("m1")).isFalse();
    }

    @Test
    void watchdogShouldFailStalledStreamWhenEnforced() {
        StreamingProperties properties = properties();
        properties.setEnforceConnectionTimeout(true);
        properties.setConnectionTimeoutMs(5000);
        properties.setReconnectAttempts(0);
        QueuedScheduler work = new QueuedScheduler();
        registry = newRegistry(properties, work);

        registry.start("s1", completingSource("late"), null);
        timer.advanceTimeBy(Duration.ofMillis(5000));

        assertThat(registry.getStreamStatus("s1")).isEqualTo(ConnectionStatus.ERROR);
        assertThat(callbacks.errors).hasSize(1);
        assertThat(callbacks.errors.get(0)).isInstanceOf(StreamTimeoutException.class);

        work.runAll();
        assertThat(registry.getStreamState("s1").text()).isEmpty();
    }

    @Test
    void finishedStreamShouldExpireAfterRetention() {
        StreamingProperties properties = properties();
        properties.setCompletedRetentionMs(1000);
        registry = newRegistry(properties, Schedulers.immediate());

        registry.start("s1", completingSource("done"), null);
        assertThat(registry.streamIds()).containsExactly("s1");

        timer.advanceTimeBy(Duration.ofMillis(1000));

        assertThat(registry.streamIds()).isEmpty();
        assertThat(registry.metrics().trackedStreams()).isZero();
    }

    @Test
    void totalTokensShouldAccumulateAcrossStreams() {
        registry = newRegistry(properties(), Schedulers.immediate());

        for (String id : List.of("s1", "s2")) {
            registry.start(id, IterableStreamSource.of(
                    new StreamEvent.TextDelta("a b"),
                    new StreamEvent.Finish("stop", new TokenUsage(10L, 4L, 6L, null, null))
            ), null);
        }

        assertThat(registry.metrics().totalTokens()).isEqualTo(20L);
        assertThat(registry.metrics().completedStreams()).isEqualTo(2);
    }

    @Test
    void metricsShouldSettleAfterConcurrentCompletions() throws InterruptedException {
        StreamingProperties properties = properties();
        properties.setMaxConcurrentStreams(64);
        Scheduler work = Schedulers.newParallel("registry-test-work", 4);
        try {
            registry = newRegistry(properties, work);
            for (int i = 0; i < 40; i++) {
                registry.start("s" + i, completingSource("token " + i), null);
            }

            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (callbacks.completed.size() < 40 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertThat(callbacks.completed).hasSize(40);
            assertThat(registry.metrics().activeStreams()).isZero();
            assertThat(registry.metrics().streaming()).isFalse();
            assertThat(registry.metrics().completedStreams()).isEqualTo(40);
        } finally {
            work.dispose();
        }
    }

    @Test
    void failingCallbackShouldNotBreakConsumeLoop() {
        registry = newRegistry(properties(), Schedulers.immediate());
        registry.addCallbacks(new StreamCallbacks() {
            @Override
            public void onProgress(String streamId, double percent, long tokenCount) {
                throw new IllegalStateException("listener bug");
            }
        });

        registry.start("s1", completingSource("still fine"), null);

        assertThat(registry.getStreamStatus("s1")).isEqualTo(ConnectionStatus.COMPLETED);
        assertThat(callbacks.completed).hasSize(1);
    }

    private StreamConnectionRegistry newRegistry(StreamingProperties properties, Scheduler work) {
        StreamRetryCoordinator coordinator = new StreamRetryCoordinator(properties, timer);
        FallbackPoller poller = new FallbackPoller(
                properties,
                (endpoint, messageId) -> Mono.just(List.copyOf(polled)),
                timer
        );
        StreamConnectionRegistry created = new StreamConnectionRegistry(
                properties,
                new StreamEventReducer(),
                coordinator,
                poller,
                work,
                timer,
                clock
        );
        created.addCallbacks(callbacks);
        return created;
    }

    private StreamingProperties properties() {
        StreamingProperties properties = new StreamingProperties();
        properties.setCompletedRetentionMs(0);
        return properties;
    }

    private static StreamSource completingSource(String text) {
        return IterableStreamSource.of(new StreamEvent.TextDelta(text));
    }

    private static StreamSourceFactory alwaysFailing() {
        return StreamConnectionRegistryTest::failingSource;
    }

    private static StreamSource failingSource() {
        return new StreamSource() {
            @Override
            public StreamReader open() throws IOException {
                throw new IOException("connection reset");
            }
        };
    }

    private static final class RecordingCallbacks implements StreamCallbacks {

        private final List<FinalMessage> completed = new CopyOnWriteArrayList<>();
        private final List<Throwable> errors = new CopyOnWriteArrayList<>();
        private final List<Duration> retryDelays = new CopyOnWriteArrayList<>();
        private final List<Double> progress = new CopyOnWriteArrayList<>();
        private final List<ConnectionStatus> statuses = new CopyOnWriteArrayList<>();

        @Override
        public void onProgress(String streamId, double percent, long tokenCount) {
            progress.add(percent);
        }

        @Override
        public void onComplete(String streamId, FinalMessage finalMessage) {
            completed.add(finalMessage);
        }

        @Override
        public void onError(String streamId, Throwable error) {
            errors.add(error);
        }

        @Override
        public void onStatusChange(String streamId, ConnectionStatus status) {
            statuses.add(status);
        }

        @Override
        public void onRetryScheduled(String streamId, int attempt, Duration delay) {
            retryDelays.add(delay);
        }
    }
}
