package com.linlay.streamrunner.service;

import com.linlay.streamrunner.config.StreamingProperties;
import com.linlay.streamrunner.stream.adapter.StreamEventParser;
import com.linlay.streamrunner.stream.model.StreamEvent;
import com.linlay.streamrunner.stream.service.FallbackUpdateClient;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Polls {@code GET {endpoint}?messageId=...}; the body is a JSON array of events or an object
 * with an {@code events} array.
 */
@Service
public class WebClientFallbackUpdateClient implements FallbackUpdateClient {

    private final WebClient webClient;
    private final StreamEventParser parser;
    private final StreamingProperties properties;

    public WebClientFallbackUpdateClient(
            WebClient.Builder streamWebClientBuilder,
            StreamEventParser parser,
            StreamingProperties properties
    ) {
        this.webClient = streamWebClientBuilder.build();
        this.parser = parser;
        this.properties = properties;
    }

    @Override
    public Mono<List<StreamEvent>> fetch(String endpoint, String messageId) {
        URI uri = UriComponentsBuilder.fromUriString(endpoint)
                .queryParam("messageId", messageId)
                .build()
                .encode()
                .toUri();
        return webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(Math.max(1L, properties.getFallbackPollingIntervalMs())))
                .map(parser::parseBatch)
                .filter(events -> !events.isEmpty());
    }
}
