package com.linlay.streamrunner.stream.model;

public record ReasoningStep(
        int step,
        String content,
        ReasoningType type,
        Double confidence,
        String signature,
        boolean redacted,
        String data
) {

    public static ReasoningStep thinking(int step, String content) {
        return new ReasoningStep(step, content, ReasoningType.THINKING, null, null, false, null);
    }

    public static ReasoningStep redacted(int step, String data) {
        return new ReasoningStep(step, "", ReasoningType.THINKING, null, null, true, data);
    }

    public ReasoningStep withSignature(String value) {
        return new ReasoningStep(step, content, type, confidence, value, redacted, data);
    }
}
