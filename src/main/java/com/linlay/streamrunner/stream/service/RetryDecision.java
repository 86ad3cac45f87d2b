package com.linlay.streamrunner.stream.service;

import java.time.Duration;

public record RetryDecision(
        boolean scheduled,
        int attempt,
        Duration delay
) {

    public static RetryDecision scheduled(int attempt, Duration delay) {
        return new RetryDecision(true, attempt, delay);
    }

    public static RetryDecision exhausted(int attempt) {
        return new RetryDecision(false, attempt, Duration.ZERO);
    }
}
