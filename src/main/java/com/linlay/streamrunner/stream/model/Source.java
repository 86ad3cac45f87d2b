package com.linlay.streamrunner.stream.model;

public record Source(
        String id,
        String title,
        String url,
        String snippet,
        Double relevance,
        String type
) {
}
