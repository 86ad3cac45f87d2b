package com.linlay.streamrunner.stream.source;

public class SourceNotReplayableException extends IllegalStateException {

    public SourceNotReplayableException() {
        super("stream source was already consumed and cannot be replayed; start with a source factory to allow retries");
    }
}
