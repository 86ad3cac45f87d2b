package com.linlay.streamrunner.stream.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConnectionStatus {
    CONNECTING,
    STREAMING,
    COMPLETED,
    ERROR,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == ABORTED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
