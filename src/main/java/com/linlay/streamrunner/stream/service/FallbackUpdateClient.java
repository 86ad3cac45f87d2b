package com.linlay.streamrunner.stream.service;

import com.linlay.streamrunner.stream.model.StreamEvent;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Out-of-band request used by {@link FallbackPoller}. Completing empty means nothing new.
 */
@FunctionalInterface
public interface FallbackUpdateClient {

    Mono<List<StreamEvent>> fetch(String endpoint, String messageId);
}
