package com.example.mediagen_backend.config;

import com.example.mediagen_backend.engine.GenerationGateway;
import com.example.mediagen_backend.engine.HttpAudioGenerationEngine;
import com.example.mediagen_backend.engine.HttpImageGenerationEngine;
import com.example.mediagen_backend.engine.HttpVideoGenerationEngine;
import com.example.mediagen_backend.engine.Interfaces.AudioGenerationEngine;
import com.example.mediagen_backend.engine.Interfaces.ImageGenerationEngine;
import com.example.mediagen_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.mediagen_backend.engine.SimulatedAudioGenerationEngine;
import com.example.mediagen_backend.engine.SimulatedImageGenerationEngine;
import com.example.mediagen_backend.engine.SimulatedVideoGenerationEngine;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * Generation engines. {@code generation.engine=http} wires the WebClient-backed adapters against
 * the provider gateway; anything else (default {@code simulated}) wires the local stand-ins.
 */
@Configuration
public class GenerationClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final int MAX_CONNECTIONS = 20;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);

    @Bean("generationWebClient")
    @ConditionalOnProperty(prefix = "generation", name = "engine", havingValue = "http")
    WebClient generationWebClient(GenerationProperties props) {
        ConnectionProvider provider = ConnectionProvider.builder("generation-http")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .build();
        HttpClient httpClient = HttpClient.create(provider)
                .responseTimeout(Duration.ofSeconds(props.getTimeoutSeconds()))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);

        LOGGER.info("Configuring generation WebClient baseUrl={} timeout={}s maxConn={}", props.getBaseUrl(),
                props.getTimeoutSeconds(), MAX_CONNECTIONS);

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024));
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey().trim());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "generation", name = "engine", havingValue = "http")
    GenerationGateway generationGateway(@Qualifier("generationWebClient") WebClient client, GenerationProperties props) {
        return new GenerationGateway(client, Duration.ofSeconds(props.getTimeoutSeconds()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "generation", name = "engine", havingValue = "http")
    ImageGenerationEngine httpImageGenerationEngine(GenerationGateway gateway) {
        return new HttpImageGenerationEngine(gateway);
    }

    @Bean
    @ConditionalOnProperty(prefix = "generation", name = "engine", havingValue = "http")
    AudioGenerationEngine httpAudioGenerationEngine(GenerationGateway gateway) {
        return new HttpAudioGenerationEngine(gateway);
    }

    @Bean
    @ConditionalOnProperty(prefix = "generation", name = "engine", havingValue = "http")
    VideoGenerationEngine httpVideoGenerationEngine(GenerationGateway gateway, GenerationProperties props) {
        return new HttpVideoGenerationEngine(gateway, Duration.ofMillis(props.getVideoPollIntervalMs()),
                Duration.ofSeconds(props.getVideoTimeoutSeconds()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "generation", name = "engine", havingValue = "simulated", matchIfMissing = true)
    ImageGenerationEngine simulatedImageGenerationEngine() {
        LOGGER.info("Generation engines=simulated");
        return new SimulatedImageGenerationEngine();
    }

    @Bean
    @ConditionalOnProperty(prefix = "generation", name = "engine", havingValue = "simulated", matchIfMissing = true)
    AudioGenerationEngine simulatedAudioGenerationEngine() {
        return new SimulatedAudioGenerationEngine();
    }

    @Bean
    @ConditionalOnProperty(prefix = "generation", name = "engine", havingValue = "simulated", matchIfMissing = true)
    VideoGenerationEngine simulatedVideoGenerationEngine() {
        return new SimulatedVideoGenerationEngine();
    }
}
