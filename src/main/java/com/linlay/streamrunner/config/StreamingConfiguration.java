package com.linlay.streamrunner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.streamrunner.stream.adapter.StreamEventParser;
import com.linlay.streamrunner.stream.service.FallbackPoller;
import com.linlay.streamrunner.stream.service.FallbackUpdateClient;
import com.linlay.streamrunner.stream.service.StreamCallbacks;
import com.linlay.streamrunner.stream.service.StreamConnectionRegistry;
import com.linlay.streamrunner.stream.service.StreamEventReducer;
import com.linlay.streamrunner.stream.service.StreamRetryCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class StreamingConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StreamingConfiguration.class);

    @Bean
    public Clock streamingClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler streamWorkScheduler(StreamingProperties properties) {
        // consume loops block on their source, one thread per active stream plus headroom
        return Schedulers.newBoundedElastic(
                Math.max(4, properties.getMaxConcurrentStreams() * 2),
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                "stream-worker"
        );
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler streamTimerScheduler() {
        return Schedulers.newParallel("stream-timer", 2);
    }

    @Bean
    public ConnectionProvider streamConnectionProvider() {
        return ConnectionProvider.builder("stream-pool")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public WebClient.Builder streamWebClientBuilder(ConnectionProvider streamConnectionProvider) {
        HttpClient httpClient = HttpClient.create(streamConnectionProvider);
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter((request, next) -> {
                    if (log.isDebugEnabled()) {
                        log.debug("[stream-http] {} {}", request.method(), request.url());
                    }
                    return next.exchange(request);
                });
    }

    @Bean
    public StreamEventParser streamEventParser(ObjectMapper objectMapper) {
        return new StreamEventParser(objectMapper);
    }

    @Bean
    public StreamEventReducer streamEventReducer() {
        return new StreamEventReducer();
    }

    @Bean
    public StreamRetryCoordinator streamRetryCoordinator(
            StreamingProperties properties,
            @Qualifier("streamTimerScheduler") Scheduler streamTimerScheduler
    ) {
        return new StreamRetryCoordinator(properties, streamTimerScheduler);
    }

    @Bean
    public FallbackPoller fallbackPoller(
            StreamingProperties properties,
            FallbackUpdateClient fallbackUpdateClient,
            @Qualifier("streamTimerScheduler") Scheduler streamTimerScheduler
    ) {
        return new FallbackPoller(properties, fallbackUpdateClient, streamTimerScheduler);
    }

    @Bean
    public StreamConnectionRegistry streamConnectionRegistry(
            StreamingProperties properties,
            StreamEventReducer streamEventReducer,
            StreamRetryCoordinator streamRetryCoordinator,
            FallbackPoller fallbackPoller,
            @Qualifier("streamWorkScheduler") Scheduler streamWorkScheduler,
            @Qualifier("streamTimerScheduler") Scheduler streamTimerScheduler,
            Clock streamingClock,
            List<StreamCallbacks> streamCallbacks
    ) {
        StreamConnectionRegistry registry = new StreamConnectionRegistry(
                properties,
                streamEventReducer,
                streamRetryCoordinator,
                fallbackPoller,
                streamWorkScheduler,
                streamTimerScheduler,
                streamingClock
        );
        streamCallbacks.forEach(registry::addCallbacks);
        return registry;
    }
}
