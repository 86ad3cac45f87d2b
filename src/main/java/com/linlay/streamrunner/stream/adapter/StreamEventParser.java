package com.linlay.streamrunner.stream.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.streamrunner.stream.model.Source;
import com.linlay.streamrunner.stream.model.StreamError;
import com.linlay.streamrunner.stream.model.StreamEvent;
import com.linlay.streamrunner.stream.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes the JSON event protocol, one object per event. Accepts raw SSE lines ({@code data:}
 * prefix, {@code [DONE]} marker). Types outside the vocabulary become {@link StreamEvent.Unknown}.
 */
public class StreamEventParser {

    private static final Logger log = LoggerFactory.getLogger(StreamEventParser.class);

    private final ObjectMapper objectMapper;

    public StreamEventParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public StreamEvent parseOrNull(String rawChunk) {
        String payload = normalizePayload(rawChunk);
        if (payload == null) {
            return null;
        }
        try {
            return parse(objectMapper.readTree(payload));
        } catch (Exception ex) {
            log.warn("Failed to parse stream event chunk: {}", rawChunk, ex);
            return null;
        }
    }

    /**
     * Parses a batch: either a JSON array of events or an object with an {@code events} array.
     */
    public List<StreamEvent> parseBatch(String body) {
        List<StreamEvent> events = new ArrayList<>();
        if (!hasText(body)) {
            return events;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode items = root.isArray() ? root : root.path("events");
            if (!items.isArray()) {
                return events;
            }
            for (JsonNode item : items) {
                StreamEvent event = parse(item);
                if (event != null) {
                    events.add(event);
                }
            }
        } catch (Exception ex) {
            log.warn("Failed to parse stream event batch", ex);
        }
        return events;
    }

    public StreamEvent parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String type = optionalText(node.get("type"));
        if (!hasText(type)) {
            return null;
        }
        return switch (type) {
            case StreamEvent.TYPE_TEXT_DELTA -> new StreamEvent.TextDelta(optionalText(node.get("textDelta")));
            case StreamEvent.TYPE_REASONING -> new StreamEvent.Reasoning(firstText(node, "textDelta", "reasoning"));
            case StreamEvent.TYPE_REASONING_SIGNATURE -> new StreamEvent.ReasoningSignature(optionalText(node.get("signature")));
            case StreamEvent.TYPE_REDACTED_REASONING -> new StreamEvent.RedactedReasoning(optionalText(node.get("data")));
            case StreamEvent.TYPE_SOURCE -> new StreamEvent.SourceCitation(parseSource(node.get("source")));
            case StreamEvent.TYPE_TOOL_CALL -> new StreamEvent.ToolCall(
                    optionalText(node.get("toolCallId")),
                    optionalText(node.get("toolName")),
                    toValue(node.get("args"))
            );
            case StreamEvent.TYPE_TOOL_CALL_STREAMING_START -> new StreamEvent.ToolCallStreamingStart(
                    optionalText(node.get("toolCallId")),
                    optionalText(node.get("toolName"))
            );
            case StreamEvent.TYPE_TOOL_CALL_DELTA -> new StreamEvent.ToolCallDelta(
                    optionalText(node.get("toolCallId")),
                    optionalText(node.get("argsTextDelta"))
            );
            case StreamEvent.TYPE_TOOL_RESULT -> new StreamEvent.ToolResult(
                    optionalText(node.get("toolCallId")),
                    toValue(node.get("result"))
            );
            case StreamEvent.TYPE_FINISH -> new StreamEvent.Finish(
                    optionalText(node.get("finishReason")),
                    parseUsage(node.get("usage"))
            );
            case StreamEvent.TYPE_ERROR -> new StreamEvent.Error(parseError(node.get("error")));
            default -> new StreamEvent.Unknown(type, toMap(node));
        };
    }

    private Source parseSource(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode relevance = node.get("relevance");
        return new Source(
                optionalText(node.get("id")),
                optionalText(node.get("title")),
                optionalText(node.get("url")),
                optionalText(node.get("snippet")),
                relevance != null && relevance.isNumber() ? relevance.doubleValue() : null,
                optionalText(node.get("type"))
        );
    }

    private TokenUsage parseUsage(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new TokenUsage(
                optionalLong(node.get("totalTokens")),
                optionalLong(node.get("promptTokens")),
                optionalLong(node.get("completionTokens")),
                optionalLong(node.get("cachedTokens")),
                optionalLong(node.get("reasoningTokens"))
        );
    }

    private StreamError parseError(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            return new StreamError(optionalText(node.get("message")), optionalText(node.get("code")));
        }
        return StreamError.of(optionalText(node));
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }

    private Map<String, Object> toMap(JsonNode node) {
        Map<String, Object> payload = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            if (!"type".equals(entry.getKey())) {
                payload.put(entry.getKey(), toValue(entry.getValue()));
            }
        });
        return payload;
    }

    private String normalizePayload(String rawChunk) {
        if (!hasText(rawChunk)) {
            return null;
        }
        String payload = rawChunk.trim();
        if (payload.startsWith("data:")) {
            payload = payload.substring(5).trim();
        }
        if (!hasText(payload) || "[DONE]".equals(payload)) {
            return null;
        }
        return payload;
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = optionalText(node.get(field));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    private Long optionalLong(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
