package com.workspace.llm.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * One connector shared by the three outbound call classes: Study RAG {@code /query},
 * Lab Copilot {@code /chat} and Ollama {@code /api/generate}.
 *
 * Each client applies its own deadline per call (60s retrieval, 120s assistant and
 * generation). The connector limits here only catch a backend that never answers.
 */
@Configuration
public class WebClientConfig {

    // Study RAG echoes full chunk text and metadata for up to top_k=50 snippets
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    // Above the slowest per-call deadline so that deadline is what fires
    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(180);

    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .responseTimeout(RESPONSE_TIMEOUT);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                        .build());
    }
}
