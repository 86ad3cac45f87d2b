package com.linlay.streamrunner.stream.model;

public record StreamError(
        String message,
        String code
) {

    public StreamError {
        if (message == null || message.isBlank()) {
            message = "unknown error";
        }
    }

    public static StreamError of(String message) {
        return new StreamError(message, null);
    }

    public static StreamError from(Throwable ex) {
        if (ex == null) {
            return of(null);
        }
        String message = ex.getMessage();
        return new StreamError(message == null ? ex.getClass().getSimpleName() : message, ex.getClass().getSimpleName());
    }
}
