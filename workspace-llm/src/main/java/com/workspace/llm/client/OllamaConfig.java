package com.workspace.llm.client;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "ollama")
@Getter
@Setter
@Slf4j
public class OllamaConfig {
    private String baseUrl = "http://host.docker.internal:11434";
    private String chatModel = "llama3.1";
    private String managerModel; // Falls back to chatModel when blank
    private String studyModel;   // Falls back to chatModel when blank
    private int contextWindow = 4096;
    private int timeoutSeconds = 120;

    public String resolveModel(ModelRole role) {
        String candidate = switch (role) {
            case CHAT -> chatModel;
            case MANAGER -> managerModel;
            case STUDY -> studyModel;
        };
        if (candidate == null || candidate.isBlank()) {
            return chatModel;
        }
        return candidate.trim();
    }

    /**
     * Which part of the workspace is asking for text.
     */
    public enum ModelRole {
        CHAT,
        MANAGER,
        STUDY
    }
}
