package com.linlay.streamrunner.stream.service;

public class StreamNotFoundException extends RuntimeException {

    public StreamNotFoundException(String streamId) {
        super("stream not found: " + streamId);
    }
}
