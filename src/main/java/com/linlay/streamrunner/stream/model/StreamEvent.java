package com.linlay.streamrunner.stream.model;

import java.util.Map;

/**
 * One incremental unit emitted by the inference backend. Events are consumed in arrival order;
 * optional payload fields may be {@code null} and are tolerated by the reducer.
 */
public sealed interface StreamEvent permits
        StreamEvent.TextDelta,
        StreamEvent.Reasoning,
        StreamEvent.ReasoningSignature,
        StreamEvent.RedactedReasoning,
        StreamEvent.SourceCitation,
        StreamEvent.ToolCall,
        StreamEvent.ToolCallStreamingStart,
        StreamEvent.ToolCallDelta,
        StreamEvent.ToolResult,
        StreamEvent.Finish,
        StreamEvent.Error,
        StreamEvent.Unknown {

    String TYPE_TEXT_DELTA = "text-delta";
    String TYPE_REASONING = "reasoning";
    String TYPE_REASONING_SIGNATURE = "reasoning-signature";
    String TYPE_REDACTED_REASONING = "redacted-reasoning";
    String TYPE_SOURCE = "source";
    String TYPE_TOOL_CALL = "tool-call";
    String TYPE_TOOL_CALL_STREAMING_START = "tool-call-streaming-start";
    String TYPE_TOOL_CALL_DELTA = "tool-call-delta";
    String TYPE_TOOL_RESULT = "tool-result";
    String TYPE_FINISH = "finish";
    String TYPE_ERROR = "error";

    String type();

    record TextDelta(String textDelta) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_TEXT_DELTA;
        }
    }

    record Reasoning(String textDelta) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_REASONING;
        }
    }

    record ReasoningSignature(String signature) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_REASONING_SIGNATURE;
        }
    }

    record RedactedReasoning(String data) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_REDACTED_REASONING;
        }
    }

    record SourceCitation(Source source) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_SOURCE;
        }
    }

    record ToolCall(String toolCallId, String toolName, Object args) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_TOOL_CALL;
        }
    }

    record ToolCallStreamingStart(String toolCallId, String toolName) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_TOOL_CALL_STREAMING_START;
        }
    }

    record ToolCallDelta(String toolCallId, String argsTextDelta) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_TOOL_CALL_DELTA;
        }
    }

    record ToolResult(String toolCallId, Object result) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_TOOL_RESULT;
        }
    }

    record Finish(String finishReason, TokenUsage usage) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_FINISH;
        }
    }

    record Error(StreamError error) implements StreamEvent {
        @Override
        public String type() {
            return TYPE_ERROR;
        }
    }

    /**
     * An event whose type is outside the known vocabulary. Kept so newer producers never break
     * older consumers.
     */
    record Unknown(String rawType, Map<String, Object> payload) implements StreamEvent {
        public Unknown {
            payload = payload == null ? Map.of() : payload;
        }

        @Override
        public String type() {
            return rawType;
        }
    }
}
