package com.linlay.streamrunner.model.api;

import com.linlay.streamrunner.stream.service.StreamingMetrics;

import java.util.List;

public record StreamListResponse(
        StreamingMetrics metrics,
        List<StreamSummaryResponse> streams,
        List<String> fallbackMessageIds
) {
}
