package com.workspace.llm.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workspace.common.exception.BackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Blocking wrapper around Ollama's /api/generate endpoint.
 * One request, no streaming, no retries.
 */
@Component
@Slf4j
public class OllamaClient {

    static final String BACKEND = "ollama";

    private final OllamaConfig config;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public OllamaClient(OllamaConfig config, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.config = config;
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
    }

    /**
     * Generate text with the model configured for the given role.
     */
    public String generate(String prompt, OllamaConfig.ModelRole role, double temperature, int maxTokens) {
        return generate(prompt, config.resolveModel(role), temperature, maxTokens);
    }

    /**
     * Generate text with an explicit model.
     * @return trimmed response text, empty when the backend produced none
     */
    public String generate(String prompt, String model, double temperature, int maxTokens) {
        long startTime = System.currentTimeMillis();
        String url = config.getBaseUrl() + "/api/generate";

        log.info("[OLLAMA] Starting generation | model={} | promptLength={} | temperature={} | maxTokens={}",
            model, prompt.length(), temperature, maxTokens);

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", temperature);
        options.put("num_ctx", config.getContextWindow());
        options.put("num_predict", maxTokens);

        Map<String, Object> request = new HashMap<>();
        request.put("model", model);
        request.put("prompt", prompt);
        request.put("temperature", temperature);
        request.put("num_ctx", config.getContextWindow());
        request.put("stream", false);
        request.put("options", options);

        String body;
        try {
            body = webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .block();
        } catch (WebClientResponseException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("[OLLAMA] HTTP error | model={} | statusCode={} | durationMs={} | body={}",
                model, e.getStatusCode().value(), duration, e.getResponseBodyAsString());
            throw new BackendException("HTTP error calling " + url + ": " + e.getStatusCode().value(),
                BACKEND, e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("[OLLAMA] Transport error | model={} | durationMs={} | error={}", model, duration, e.getMessage());
            throw new BackendException("HTTP error calling " + url + ": " + e.getMessage(), BACKEND, 0, e);
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("[OLLAMA] Request failed | model={} | durationMs={} | error={}", model, duration, e.getMessage(), e);
            throw new BackendException("Request to " + url + " failed: " + e.getMessage(), BACKEND, 0, e);
        }

        String text = extractResponse(body, url);
        log.info("[OLLAMA] Generation completed | model={} | durationMs={} | responseLength={}",
            model, System.currentTimeMillis() - startTime, text.length());
        return text;
    }

    private String extractResponse(String body, String url) {
        if (body == null || body.isBlank()) {
            throw new BackendException("Non-JSON response from " + url + ": empty body", BACKEND, 200);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new BackendException("Non-JSON response from " + url + ": " + e.getMessage(), BACKEND, 200, e);
        }
        JsonNode response = root.path("response");
        if (!response.isTextual()) {
            return "";
        }
        return response.asText().trim();
    }
}
