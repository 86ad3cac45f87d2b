package com.linlay.streamrunner.stream.service;

import com.linlay.streamrunner.stream.model.ReasoningStep;
import com.linlay.streamrunner.stream.model.Source;
import com.linlay.streamrunner.stream.model.StreamEvent;
import com.linlay.streamrunner.stream.model.StreamState;
import com.linlay.streamrunner.stream.model.StreamingType;
import com.linlay.streamrunner.stream.model.TokenUsage;
import com.linlay.streamrunner.stream.model.ToolCallRecord;
import com.linlay.streamrunner.stream.model.ToolCallState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds one {@link StreamEvent} into a {@link StreamState}. Pure and total: the same input always
 * produces an equal output, and no event (including unknown ones) makes it throw.
 *
 * <p>Token counting before {@code finish} is an estimate: every text fragment contributes its
 * whitespace-separated word count. It is not a tokenizer and will drift from the backend's count;
 * {@code finish} replaces it with the authoritative total when one is reported.</p>
 */
public class StreamEventReducer {

    private static final Logger log = LoggerFactory.getLogger(StreamEventReducer.class);

    public StreamState reduce(StreamState state, StreamEvent event) {
        StreamState current = state == null ? StreamState.initial() : state;
        if (event == null) {
            return current;
        }
        if (event instanceof StreamEvent.TextDelta value) {
            return textDelta(current, value);
        }
        if (event instanceof StreamEvent.Reasoning value) {
            return reasoning(current, value);
        }
        if (event instanceof StreamEvent.ReasoningSignature value) {
            return reasoningSignature(current, value);
        }
        if (event instanceof StreamEvent.RedactedReasoning value) {
            return redactedReasoning(current, value);
        }
        if (event instanceof StreamEvent.SourceCitation value) {
            return source(current, value.source());
        }
        if (event instanceof StreamEvent.ToolCall value) {
            return toolCall(current, value.toolCallId(), value.toolName(), value.args(), ToolCallState.CALL);
        }
        if (event instanceof StreamEvent.ToolCallStreamingStart value) {
            return toolCall(current, value.toolCallId(), value.toolName(), null, ToolCallState.STREAMING_START);
        }
        if (event instanceof StreamEvent.ToolCallDelta value) {
            return toolCallDelta(current, value);
        }
        if (event instanceof StreamEvent.ToolResult value) {
            return toolResult(current, value);
        }
        if (event instanceof StreamEvent.Finish value) {
            return finish(current, value.usage());
        }
        if (event instanceof StreamEvent.Error value) {
            return value.error() == null ? current : current.withError(value.error());
        }
        log.warn("Ignoring stream event of unknown type: {}", event.type());
        return current;
    }

    public StreamState replay(StreamState state, List<StreamEvent> events) {
        StreamState current = state == null ? StreamState.initial() : state;
        if (events == null) {
            return current;
        }
        for (StreamEvent event : events) {
            current = reduce(current, event);
        }
        return current;
    }

    static long estimateWords(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            return 0L;
        }
        return fragment.trim().split("\\s+").length;
    }

    private StreamState textDelta(StreamState state, StreamEvent.TextDelta event) {
        String delta = event.textDelta();
        if (!hasContent(delta)) {
            return state;
        }
        return state.withText(state.text() + delta, state.tokenCount() + estimateWords(delta), StreamingType.TEXT);
    }

    private StreamState reasoning(StreamState state, StreamEvent.Reasoning event) {
        String delta = event.textDelta();
        if (!hasContent(delta)) {
            return state;
        }
        List<ReasoningStep> steps = new ArrayList<>(state.reasoning());
        steps.add(ReasoningStep.thinking(steps.size() + 1, delta));
        return state.withReasoning(steps, StreamingType.REASONING);
    }

    private StreamState reasoningSignature(StreamState state, StreamEvent.ReasoningSignature event) {
        ReasoningStep last = state.lastReasoningStep();
        if (last == null || !hasContent(event.signature())) {
            return state;
        }
        List<ReasoningStep> steps = new ArrayList<>(state.reasoning());
        steps.set(steps.size() - 1, last.withSignature(event.signature()));
        return state.withReasoning(steps, state.streamingType());
    }

    private StreamState redactedReasoning(StreamState state, StreamEvent.RedactedReasoning event) {
        if (!hasContent(event.data())) {
            return state;
        }
        List<ReasoningStep> steps = new ArrayList<>(state.reasoning());
        steps.add(ReasoningStep.redacted(steps.size() + 1, event.data()));
        return state.withReasoning(steps, state.streamingType());
    }

    private StreamState source(StreamState state, Source source) {
        if (source == null) {
            return state;
        }
        List<Source> sources = new ArrayList<>(state.sources());
        sources.add(source);
        // citations are inline with text, not a phase of their own
        return state.withSources(sources, StreamingType.TEXT);
    }

    private StreamState toolCall(StreamState state, String id, String name, Object args, ToolCallState callState) {
        if (!hasContent(id) || !hasContent(name)) {
            return state.withStreamingType(StreamingType.TOOL);
        }
        Map<String, ToolCallRecord> toolCalls = new LinkedHashMap<>(state.toolCalls());
        ToolCallRecord existing = toolCalls.get(id);
        if (existing != null) {
            toolCalls.put(id, existing.redeclare(name, args, callState));
        } else {
            toolCalls.put(id, new ToolCallRecord(id, name, args, "", null, callState));
        }
        return state.withToolCalls(toolCalls, StreamingType.TOOL);
    }

    private StreamState toolCallDelta(StreamState state, StreamEvent.ToolCallDelta event) {
        if (!hasContent(event.toolCallId()) || !hasContent(event.argsTextDelta())) {
            return state;
        }
        ToolCallRecord existing = state.toolCalls().get(event.toolCallId());
        if (existing == null || existing.state() == ToolCallState.RESULT) {
            return state;
        }
        Map<String, ToolCallRecord> toolCalls = new LinkedHashMap<>(state.toolCalls());
        toolCalls.put(existing.id(), existing.appendArgs(event.argsTextDelta()));
        return state.withToolCalls(toolCalls, state.streamingType());
    }

    private StreamState toolResult(StreamState state, StreamEvent.ToolResult event) {
        ToolCallRecord existing = event.toolCallId() == null ? null : state.toolCalls().get(event.toolCallId());
        if (existing == null) {
            return state.withStreamingType(StreamingType.TEXT);
        }
        Map<String, ToolCallRecord> toolCalls = new LinkedHashMap<>(state.toolCalls());
        toolCalls.put(existing.id(), existing.withResult(event.result()));
        return state.withToolCalls(toolCalls, StreamingType.TEXT);
    }

    private StreamState finish(StreamState state, TokenUsage usage) {
        if (usage == null) {
            return state.finished(state.metadata(), state.tokenCount());
        }
        Map<String, Object> metadata = new LinkedHashMap<>(state.metadata());
        metadata.putAll(usage.toMetadata());
        long tokens = usage.totalTokens() != null ? usage.totalTokens() : state.tokenCount();
        return state.finished(metadata, tokens);
    }

    private boolean hasContent(String value) {
        return value != null && !value.isEmpty();
    }
}
