package com.linlay.streamrunner.stream.source;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Produces the source for one connection attempt. Retries always go through the factory so a
 * partially consumed source is never reused.
 */
@FunctionalInterface
public interface StreamSourceFactory {

    StreamSource create();

    /**
     * Wraps an already constructed source. The first call hands it out; later calls succeed only
     * when the source is replayable.
     */
    static StreamSourceFactory of(StreamSource source) {
        Objects.requireNonNull(source, "source must not be null");
        AtomicBoolean handedOut = new AtomicBoolean(false);
        return () -> {
            if (handedOut.compareAndSet(false, true) || source.isReplayable()) {
                return source;
            }
            throw new SourceNotReplayableException();
        };
    }
}
