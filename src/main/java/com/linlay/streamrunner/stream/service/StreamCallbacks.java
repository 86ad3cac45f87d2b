package com.linlay.streamrunner.stream.service;

import com.linlay.streamrunner.stream.model.ConnectionStatus;
import com.linlay.streamrunner.stream.model.FinalMessage;

import java.time.Duration;

/**
 * Notifications delivered to presentation collaborators. Invoked on the thread that observed the
 * change; implementations should return quickly.
 */
public interface StreamCallbacks {

    default void onProgress(String streamId, double percent, long tokenCount) {
    }

    default void onComplete(String streamId, FinalMessage finalMessage) {
    }

    /**
     * Fired once a failure is final, i.e. no automatic retry is scheduled for it.
     */
    default void onError(String streamId, Throwable error) {
    }

    default void onStatusChange(String streamId, ConnectionStatus status) {
    }

    default void onRetryScheduled(String streamId, int attempt, Duration delay) {
    }
}
