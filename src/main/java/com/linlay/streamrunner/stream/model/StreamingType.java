package com.linlay.streamrunner.stream.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StreamingType {
    TEXT,
    REASONING,
    TOOL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
