package com.workspace.core.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workspace.core.config.WorkspaceProperties;
import com.workspace.core.query.model.CopilotResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Lab Copilot assistant backend: POST /chat with {question, top_k}.
 * Copilot runs its own retrieval internally; the workspace never looks at it.
 */
@Component
@Slf4j
public class LabCopilotClient extends AbstractBackendClient {

    private final WorkspaceProperties properties;

    public LabCopilotClient(WorkspaceProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(webClientBuilder, objectMapper);
        this.properties = properties;
    }

    @Override
    protected String backendName() {
        return "lab-copilot";
    }

    public CopilotResult chat(String question, int topK) {
        WorkspaceProperties.Backends backends = properties.getBackends();
        log.info("[LAB_COPILOT] Chat request | topK={} | questionLength={}", topK, question.length());
        return new CopilotResult(postJson(
            backends.getLabCopilotBaseUrl() + "/chat",
            Map.of("question", question, "top_k", topK),
            Duration.ofSeconds(backends.getAssistantTimeoutSeconds())));
    }
}
