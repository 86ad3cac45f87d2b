package com.linlay.streamrunner.model.api;

import com.linlay.streamrunner.stream.model.StreamState;

public record StreamDetailResponse(
        StreamSummaryResponse summary,
        StreamState state,
        String failure
) {
}
