package com.linlay.streamrunner.stream.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record TokenUsage(
        Long totalTokens,
        Long promptTokens,
        Long completionTokens,
        Long cachedTokens,
        Long reasoningTokens
) {

    public static TokenUsage total(long totalTokens) {
        return new TokenUsage(totalTokens, null, null, null, null);
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfNonNull(metadata, "totalTokens", totalTokens);
        putIfNonNull(metadata, "promptTokens", promptTokens);
        putIfNonNull(metadata, "completionTokens", completionTokens);
        putIfNonNull(metadata, "cachedTokens", cachedTokens);
        putIfNonNull(metadata, "reasoningTokens", reasoningTokens);
        return metadata;
    }

    private static void putIfNonNull(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
