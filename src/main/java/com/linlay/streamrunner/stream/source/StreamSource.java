package com.linlay.streamrunner.stream.source;

import java.io.IOException;

/**
 * A source of stream events. Iterator-style sources hand out an independent reader per
 * {@link #open()}; lock-style sources allow a single reader at a time and release the lock when
 * that reader is closed.
 */
public interface StreamSource {

    StreamReader open() throws IOException;

    /**
     * Whether {@link #open()} may be called again after a previous reader was closed and yield the
     * events from the beginning.
     */
    default boolean isReplayable() {
        return false;
    }
}
