package com.workspace.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workspace.common.exception.BackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;

/**
 * Shared blocking JSON POST for the workspace's sibling services.
 * Every failure mode ends up as a {@link BackendException}; nothing is retried.
 */
@Slf4j
public abstract class AbstractBackendClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    protected AbstractBackendClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
    }

    /**
     * Name used in logs and in {@link BackendException#getBackend()}.
     */
    protected abstract String backendName();

    protected JsonNode postJson(String url, Map<String, Object> payload, Duration timeout) {
        long startTime = System.currentTimeMillis();
        String tag = backendName().toUpperCase();

        String body;
        try {
            body = webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            log.error("[{}] HTTP error | url={} | statusCode={} | durationMs={}",
                tag, url, e.getStatusCode().value(), System.currentTimeMillis() - startTime);
            throw new BackendException("HTTP error calling " + url + ": " + e.getStatusCode().value(),
                backendName(), e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            log.error("[{}] Transport error | url={} | durationMs={} | error={}",
                tag, url, System.currentTimeMillis() - startTime, e.getMessage());
            throw new BackendException("HTTP error calling " + url + ": " + e.getMessage(), backendName(), 0, e);
        } catch (Exception e) {
            log.error("[{}] Request failed | url={} | durationMs={} | error={}",
                tag, url, System.currentTimeMillis() - startTime, e.getMessage(), e);
            throw new BackendException("Request to " + url + " failed: " + e.getMessage(), backendName(), 0, e);
        }

        if (body == null || body.isBlank()) {
            throw new BackendException("Non-JSON response from " + url + ": empty body", backendName(), 200);
        }

        try {
            JsonNode json = objectMapper.readTree(body);
            log.debug("[{}] Response received | url={} | durationMs={} | bodyLength={}",
                tag, url, System.currentTimeMillis() - startTime, body.length());
            return json;
        } catch (Exception e) {
            log.error("[{}] Unparseable response | url={} | bodyLength={}", tag, url, body.length());
            throw new BackendException("Non-JSON response from " + url + ": " + e.getMessage(), backendName(), 200, e);
        }
    }
}
