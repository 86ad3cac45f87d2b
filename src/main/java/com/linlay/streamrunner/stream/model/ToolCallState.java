package com.linlay.streamrunner.stream.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolCallState {
    CALL("call"),
    STREAMING_START("streaming-start"),
    RESULT("result");

    private final String value;

    ToolCallState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
