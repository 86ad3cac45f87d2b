package com.linlay.streamrunner.stream.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materialized view of everything received on one connection. Immutable: every transition yields a
 * new instance, so snapshots can be handed to other threads without copying.
 *
 * <p>{@code tokenCount} is a word-count estimate until a {@code finish} event supplies the
 * authoritative total.</p>
 */
public record StreamState(
        String text,
        List<ReasoningStep> reasoning,
        Map<String, ToolCallRecord> toolCalls,
        List<Source> sources,
        Map<String, Object> metadata,
        List<StreamError> errors,
        long tokenCount,
        StreamingType streamingType,
        boolean streaming
) {

    private static final StreamState INITIAL = new StreamState(
            "",
            List.of(),
            Map.of(),
            List.of(),
            Map.of(),
            List.of(),
            0L,
            StreamingType.TEXT,
            true
    );

    public StreamState {
        text = text == null ? "" : text;
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
        toolCalls = toolCalls == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(toolCalls));
        sources = sources == null ? List.of() : List.copyOf(sources);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        errors = errors == null ? List.of() : List.copyOf(errors);
        streamingType = streamingType == null ? StreamingType.TEXT : streamingType;
    }

    public static StreamState initial() {
        return INITIAL;
    }

    public StreamState withText(String value, long tokens, StreamingType type) {
        return new StreamState(value, reasoning, toolCalls, sources, metadata, errors, tokens, type, streaming);
    }

    public StreamState withReasoning(List<ReasoningStep> value, StreamingType type) {
        return new StreamState(text, value, toolCalls, sources, metadata, errors, tokenCount, type, streaming);
    }

    public StreamState withToolCalls(Map<String, ToolCallRecord> value, StreamingType type) {
        return new StreamState(text, reasoning, value, sources, metadata, errors, tokenCount, type, streaming);
    }

    public StreamState withSources(List<Source> value, StreamingType type) {
        return new StreamState(text, reasoning, toolCalls, value, metadata, errors, tokenCount, type, streaming);
    }

    public StreamState withStreamingType(StreamingType type) {
        return new StreamState(text, reasoning, toolCalls, sources, metadata, errors, tokenCount, type, streaming);
    }

    public StreamState finished(Map<String, Object> mergedMetadata, long tokens) {
        return new StreamState(text, reasoning, toolCalls, sources, mergedMetadata, errors, tokens, StreamingType.TEXT, false);
    }

    public StreamState withError(StreamError error) {
        List<StreamError> next = new ArrayList<>(errors);
        next.add(error);
        return new StreamState(text, reasoning, toolCalls, sources, metadata, next, tokenCount, streamingType, false);
    }

    public ReasoningStep lastReasoningStep() {
        return reasoning.isEmpty() ? null : reasoning.get(reasoning.size() - 1);
    }

    /**
     * Flattens the state into the message handed to presentation collaborators. Parts are ordered
     * text, reasoning, sources, tool invocations regardless of arrival order.
     */
    public FinalMessage toFinalMessage(String messageId, Instant createdAt) {
        List<FinalMessage.Part> parts = new ArrayList<>();
        parts.add(new FinalMessage.TextPart(text));
        for (ReasoningStep step : reasoning) {
            parts.add(new FinalMessage.ReasoningPart(step.content(), step.signature(), step.redacted()));
        }
        for (Source source : sources) {
            parts.add(new FinalMessage.SourcePart(source));
        }
        for (ToolCallRecord toolCall : toolCalls.values()) {
            parts.add(new FinalMessage.ToolInvocationPart(toolCall));
        }
        return new FinalMessage(messageId, FinalMessage.ROLE_ASSISTANT, text, parts, createdAt);
    }
}
