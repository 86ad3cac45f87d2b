package com.linlay.streamrunner.stream.service;

import java.time.Duration;

public class StreamTimeoutException extends RuntimeException {

    public StreamTimeoutException(String streamId, Duration timeout) {
        super("stream " + streamId + " still streaming after " + timeout.toMillis() + "ms");
    }
}
