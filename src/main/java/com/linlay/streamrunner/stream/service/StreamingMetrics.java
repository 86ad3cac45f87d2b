package com.linlay.streamrunner.stream.service;

public record StreamingMetrics(
        boolean streaming,
        int activeStreams,
        int completedStreams,
        int trackedStreams,
        long totalTokens
) {

    public static StreamingMetrics empty() {
        return new StreamingMetrics(false, 0, 0, 0, 0L);
    }
}
