package com.linlay.streamrunner.stream.model;

/**
 * One tool invocation observed on a stream. {@code argsText} only grows until a result arrives.
 */
public record ToolCallRecord(
        String id,
        String name,
        Object args,
        String argsText,
        Object result,
        ToolCallState state
) {

    public ToolCallRecord {
        argsText = argsText == null ? "" : argsText;
    }

    public ToolCallRecord appendArgs(String delta) {
        return new ToolCallRecord(id, name, args, argsText + delta, result, state);
    }

    public ToolCallRecord withResult(Object value) {
        return new ToolCallRecord(id, name, args, argsText, value, ToolCallState.RESULT);
    }

    public ToolCallRecord redeclare(String newName, Object newArgs, ToolCallState newState) {
        return new ToolCallRecord(id, newName, newArgs != null ? newArgs : args, argsText, result, newState);
    }
}
