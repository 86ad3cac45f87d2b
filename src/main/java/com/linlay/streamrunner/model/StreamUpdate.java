package com.linlay.streamrunner.model;

import java.util.Map;

public record StreamUpdate(
        long seq,
        String streamId,
        String type,
        long timestamp,
        Map<String, Object> payload
) {

    public static final String TYPE_SNAPSHOT = "stream.snapshot";
    public static final String TYPE_STATUS = "stream.status";
    public static final String TYPE_PROGRESS = "stream.progress";
    public static final String TYPE_COMPLETE = "stream.complete";
    public static final String TYPE_ERROR = "stream.error";
    public static final String TYPE_RETRY = "stream.retry";

    public StreamUpdate {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId must not be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (payload == null) {
            payload = Map.of();
        }
    }
}
