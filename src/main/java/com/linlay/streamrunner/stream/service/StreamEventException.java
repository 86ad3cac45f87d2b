package com.linlay.streamrunner.stream.service;

import com.linlay.streamrunner.stream.model.StreamError;

/**
 * Raised by a connection when the backend reports an {@code error} event.
 */
public class StreamEventException extends RuntimeException {

    private final StreamError error;

    public StreamEventException(String streamId, StreamError error) {
        super("stream " + streamId + " reported error: " + (error == null ? "unknown error" : error.message()));
        this.error = error;
    }

    public StreamError getError() {
        return error;
    }
}
