package com.linlay.streamrunner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.streamrunner.config.StreamingProperties;
import com.linlay.streamrunner.stream.adapter.StreamEventParser;
import com.linlay.streamrunner.stream.model.StreamEvent;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientFallbackUpdateClientTest {

    private final StreamEventParser parser = new StreamEventParser(new ObjectMapper());

    @Test
    void fetchShouldQueryByMessageIdAndParseEventsWrapper() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            captured.set(request);
            return Mono.just(json(HttpStatus.OK, """
                    {"events":[{"type":"text-delta","textDelta":"late"},{"type":"finish","finishReason":"stop"}]}
                    """));
        });
        WebClientFallbackUpdateClient client = new WebClientFallbackUpdateClient(builder, parser, new StreamingProperties());

        StepVerifier.create(client.fetch("http://localhost/updates", "msg 1"))
                .assertNext(events -> {
                    assertThat(events).hasSize(2);
                    assertThat(events.get(0)).isEqualTo(new StreamEvent.TextDelta("late"));
                })
                .verifyComplete();

        assertThat(captured.get().url().toString()).isEqualTo("http://localhost/updates?messageId=msg%201");
    }

    @Test
    void emptyBatchShouldCompleteWithoutValue() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> Mono.just(json(HttpStatus.OK, "[]")));
        WebClientFallbackUpdateClient client = new WebClientFallbackUpdateClient(builder, parser, new StreamingProperties());

        StepVerifier.create(client.fetch("http://localhost/updates", "m1"))
                .verifyComplete();
    }

    @Test
    void errorStatusShouldSurfaceAsError() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{}")));
        WebClientFallbackUpdateClient client = new WebClientFallbackUpdateClient(builder, parser, new StreamingProperties());

        StepVerifier.create(client.fetch("http://localhost/updates", "m1"))
                .expectError(WebClientResponseException.class)
                .verify();
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
