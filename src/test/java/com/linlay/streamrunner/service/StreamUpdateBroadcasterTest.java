package com.linlay.streamrunner.service;

import com.linlay.streamrunner.model.StreamUpdate;
import com.linlay.streamrunner.stream.model.ConnectionStatus;
import com.linlay.streamrunner.stream.model.StreamError;
import com.linlay.streamrunner.stream.service.StreamEventException;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class StreamUpdateBroadcasterTest {

    private final StreamUpdateBroadcaster broadcaster = new StreamUpdateBroadcaster(
            Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC)
    );

    @Test
    void updatesShouldBeFilteredByStreamAndSequenced() {
        StepVerifier.create(broadcaster.updates("s1").take(3))
                .then(() -> {
                    broadcaster.onStatusChange("s1", ConnectionStatus.STREAMING);
                    broadcaster.onProgress("s2", 50.0, 10L);
                    broadcaster.onProgress("s1", 12.5, 3L);
                    broadcaster.onRetryScheduled("s1", 1, Duration.ofMillis(1000));
                })
                .assertNext(update -> {
                    assertThat(update.type()).isEqualTo(StreamUpdate.TYPE_STATUS);
                    assertThat(update.payload()).containsEntry("status", "streaming");
                    assertThat(update.timestamp()).isEqualTo(1_700_000_000_000L);
                })
                .assertNext(update -> {
                    assertThat(update.type()).isEqualTo(StreamUpdate.TYPE_PROGRESS);
                    assertThat(update.payload()).containsEntry("progress", 12.5).containsEntry("tokenCount", 3L);
                    assertThat(update.seq()).isEqualTo(3L);
                })
                .assertNext(update -> assertThat(update.payload()).containsEntry("delayMs", 1000L))
                .verifyComplete();
    }

    @Test
    void errorUpdateShouldCarryReportedStreamError() {
        StepVerifier.create(broadcaster.updates("s1").take(1))
                .then(() -> broadcaster.onError("s1",
                        new StreamEventException("s1", new StreamError("quota exceeded", "429"))))
                .assertNext(update -> {
                    assertThat(update.type()).isEqualTo(StreamUpdate.TYPE_ERROR);
                    assertThat(update.payload().get("error")).isEqualTo(new StreamError("quota exceeded", "429"));
                })
                .verifyComplete();
    }

    @Test
    void emitWithoutSubscribersShouldNotFail() {
        broadcaster.onStatusChange("s1", ConnectionStatus.COMPLETED);

        StepVerifier.create(broadcaster.updates().take(1))
                .then(() -> broadcaster.onStatusChange("s1", ConnectionStatus.ABORTED))
                .assertNext(update -> assertThat(update.seq()).isEqualTo(2L))
                .verifyComplete();
    }
}
