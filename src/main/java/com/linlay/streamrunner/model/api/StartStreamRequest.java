package com.linlay.streamrunner.model.api;

import jakarta.validation.constraints.NotBlank;

public record StartStreamRequest(
        @NotBlank
        String streamId,
        String messageId,
        @NotBlank
        String sourceUrl
) {
}
