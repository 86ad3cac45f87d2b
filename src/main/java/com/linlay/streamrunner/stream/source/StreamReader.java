package com.linlay.streamrunner.stream.source;

import com.linlay.streamrunner.stream.model.StreamEvent;

import java.io.IOException;

/**
 * Read handle acquired by {@link StreamSource#open()}. Closing releases the handle and must be
 * safe to call more than once.
 */
public interface StreamReader extends AutoCloseable {

    /**
     * Blocks until the next event is available.
     *
     * @return the next event, or {@code null} once the source is exhausted
     */
    StreamEvent next() throws IOException;

    @Override
    void close();
}
