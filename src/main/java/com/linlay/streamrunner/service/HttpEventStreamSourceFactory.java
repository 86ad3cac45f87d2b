package com.linlay.streamrunner.service;

import com.linlay.streamrunner.stream.adapter.StreamEventParser;
import com.linlay.streamrunner.stream.model.StreamEvent;
import com.linlay.streamrunner.stream.source.FluxStreamSource;
import com.linlay.streamrunner.stream.source.StreamSourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.net.URI;

/**
 * Builds sources that read the event protocol from an upstream SSE endpoint. Every
 * {@link StreamSourceFactory#create()} issues a new HTTP request, so retries start from a fresh
 * response rather than a half-read one.
 */
@Service
public class HttpEventStreamSourceFactory {

    private static final Logger log = LoggerFactory.getLogger(HttpEventStreamSourceFactory.class);

    private final WebClient webClient;
    private final StreamEventParser parser;

    public HttpEventStreamSourceFactory(WebClient.Builder streamWebClientBuilder, StreamEventParser parser) {
        this.webClient = streamWebClientBuilder.build();
        this.parser = parser;
    }

    public StreamSourceFactory forUrl(String sourceUrl) {
        URI uri = resolveUri(sourceUrl);
        return () -> new FluxStreamSource(events(uri), true);
    }

    Flux<StreamEvent> events(URI uri) {
        return Flux.defer(() -> {
            log.debug("opening upstream event stream {}", uri);
            return webClient.get()
                    .uri(uri)
                    .accept(MediaType.TEXT_EVENT_STREAM, MediaType.APPLICATION_NDJSON)
                    .retrieve()
                    .bodyToFlux(String.class)
                    .<StreamEvent>handle((rawChunk, sink) -> {
                        StreamEvent event = parser.parseOrNull(rawChunk);
                        if (event != null) {
                            sink.next(event);
                        }
                    });
        });
    }

    private URI resolveUri(String sourceUrl) {
        if (!StringUtils.hasText(sourceUrl)) {
            throw new IllegalArgumentException("sourceUrl is required");
        }
        URI uri;
        try {
            uri = URI.create(sourceUrl.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("invalid sourceUrl: " + sourceUrl, ex);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("sourceUrl must be http or https: " + sourceUrl);
        }
        return uri;
    }
}
