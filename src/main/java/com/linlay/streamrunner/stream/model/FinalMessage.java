package com.linlay.streamrunner.stream.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

public record FinalMessage(
        String id,
        String role,
        String text,
        List<Part> parts,
        Instant createdAt
) {

    public static final String ROLE_ASSISTANT = "assistant";

    public FinalMessage {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = TextPart.class, name = "text"),
            @JsonSubTypes.Type(value = ReasoningPart.class, name = "reasoning"),
            @JsonSubTypes.Type(value = SourcePart.class, name = "source"),
            @JsonSubTypes.Type(value = ToolInvocationPart.class, name = "tool-invocation")
    })
    public sealed interface Part permits TextPart, ReasoningPart, SourcePart, ToolInvocationPart {
    }

    public record TextPart(String text) implements Part {
    }

    public record ReasoningPart(String reasoning, String signature, boolean redacted) implements Part {
    }

    public record SourcePart(Source source) implements Part {
    }

    public record ToolInvocationPart(ToolCallRecord toolInvocation) implements Part {
    }
}
