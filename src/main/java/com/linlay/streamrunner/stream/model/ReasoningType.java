package com.linlay.streamrunner.stream.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReasoningType {
    THINKING,
    ANALYSIS,
    CONCLUSION,
    HYPOTHESIS,
    VERIFICATION,
    SYNTHESIS,
    REFLECTION,
    PLANNING,
    EVALUATION,
    CRITIQUE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
