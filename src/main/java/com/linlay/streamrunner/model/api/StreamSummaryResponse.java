package com.linlay.streamrunner.model.api;

import com.linlay.streamrunner.stream.model.ConnectionStatus;

import java.time.Instant;

public record StreamSummaryResponse(
        String streamId,
        String messageId,
        ConnectionStatus status,
        int attempt,
        boolean retryPending,
        double progress,
        long tokenCount,
        Instant startedAt
) {
}
