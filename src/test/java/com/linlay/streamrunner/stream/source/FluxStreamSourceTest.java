package com.linlay.streamrunner.stream.source;

import com.linlay.streamrunner.stream.model.StreamEvent;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FluxStreamSourceTest {

    @Test
    void readerShouldDrainEventsAndReleaseLockOnClose() throws Exception {
        FluxStreamSource source = new FluxStreamSource(Flux.just(
                new StreamEvent.TextDelta("a"),
                new StreamEvent.TextDelta("b")
        ));

        List<StreamEvent> received = new ArrayList<>();
        try (StreamReader reader = source.open()) {
            assertThat(source.isLocked()).isTrue();
            StreamEvent event;
            while ((event = reader.next()) != null) {
                received.add(event);
            }
        }

        assertThat(received).containsExactly(new StreamEvent.TextDelta("a"), new StreamEvent.TextDelta("b"));
        assertThat(source.isLocked()).isFalse();
    }

    @Test
    void secondReaderShouldBeRejectedWhileLocked() throws Exception {
        Sinks.Many<StreamEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
        FluxStreamSource source = new FluxStreamSource(sink.asFlux());

        StreamReader reader = source.open();
        try {
            assertThatThrownBy(source::open)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already locked");
        } finally {
            reader.close();
        }

        assertThat(source.isLocked()).isFalse();
    }

    @Test
    void lockShouldBeReleasedWhenUpstreamFails() {
        FluxStreamSource source = new FluxStreamSource(Flux.concat(
                Flux.just(new StreamEvent.TextDelta("a")),
                Flux.error(new IllegalStateException("upstream reset"))
        ));

        assertThatThrownBy(() -> {
            try (StreamReader reader = source.open()) {
                while (reader.next() != null) {
                    // drain
                }
            }
        }).hasMessageContaining("upstream reset");

        assertThat(source.isLocked()).isFalse();
    }

    @Test
    void closeShouldBeIdempotent() throws Exception {
        FluxStreamSource source = new FluxStreamSource(Flux.never());

        StreamReader reader = source.open();
        reader.close();
        reader.close();

        assertThat(source.isLocked()).isFalse();
        source.open().close();
    }

    @Test
    void factoryShouldHandOutNonReplayableSourceOnce() {
        FluxStreamSource source = new FluxStreamSource(Flux.empty());
        StreamSourceFactory factory = StreamSourceFactory.of(source);

        assertThat(factory.create()).isSameAs(source);
        assertThatThrownBy(factory::create).isInstanceOf(SourceNotReplayableException.class);
    }

    @Test
    void factoryShouldReuseReplayableSource() {
        IterableStreamSource source = IterableStreamSource.of(new StreamEvent.TextDelta("x"));
        StreamSourceFactory factory = StreamSourceFactory.of(source);

        assertThat(source.isReplayable()).isTrue();
        assertThat(factory.create()).isSameAs(source);
        assertThat(factory.create()).isSameAs(source);
    }
}
