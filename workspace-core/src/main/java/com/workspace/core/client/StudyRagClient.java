package com.workspace.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workspace.core.config.WorkspaceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Study RAG retrieval backend: POST /query with {question, k}.
 */
@Component
@Slf4j
public class StudyRagClient extends AbstractBackendClient {

    private final WorkspaceProperties properties;

    public StudyRagClient(WorkspaceProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(webClientBuilder, objectMapper);
        this.properties = properties;
    }

    @Override
    protected String backendName() {
        return "study-rag";
    }

    /**
     * @return the raw response, to be passed through {@code RagResponseNormalizer}
     */
    public JsonNode query(String question, int k) {
        WorkspaceProperties.Backends backends = properties.getBackends();
        log.info("[STUDY_RAG] Querying | k={} | questionLength={}", k, question.length());
        return postJson(
            backends.getStudyRagBaseUrl() + "/query",
            Map.of("question", question, "k", k),
            Duration.ofSeconds(backends.getRequestTimeoutSeconds()));
    }
}
