package com.linlay.streamrunner.stream.service;

public class StreamAdmissionException extends RuntimeException {

    private final int maxConcurrentStreams;

    public StreamAdmissionException(int maxConcurrentStreams) {
        super("Maximum concurrent streams (" + maxConcurrentStreams + ") exceeded");
        this.maxConcurrentStreams = maxConcurrentStreams;
    }

    public int getMaxConcurrentStreams() {
        return maxConcurrentStreams;
    }
}
