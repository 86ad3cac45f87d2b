package com.linlay.streamrunner.stream.service;

import com.linlay.streamrunner.stream.model.StreamError;

import java.time.Instant;

public record StreamFailure(
        String streamId,
        int attempt,
        StreamError error,
        Instant failedAt
) {
}
