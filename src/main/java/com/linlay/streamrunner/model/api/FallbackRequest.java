package com.linlay.streamrunner.model.api;

import jakarta.validation.constraints.NotBlank;

public record FallbackRequest(
        @NotBlank
        String messageId,
        @NotBlank
        String endpoint
) {
}
