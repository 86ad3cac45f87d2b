package com.linlay.streamrunner.model.api;

public record FallbackResponse(
        String messageId,
        boolean enabled,
        boolean changed
) {
}
