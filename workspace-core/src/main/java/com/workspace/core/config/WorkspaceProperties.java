package com.workspace.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Read-only settings for the orchestrator: backend addresses, per-call timeouts,
 * request bounds, manager loop cap and guide export location.
 */
@Configuration
@ConfigurationProperties(prefix = "workspace")
@Getter
@Setter
public class WorkspaceProperties {

    private Backends backends = new Backends();
    private Query query = new Query();
    private Manager manager = new Manager();
    private Guides guides = new Guides();

    @Getter
    @Setter
    public static class Backends {
        private String studyRagBaseUrl = "http://host.docker.internal:8080";
        private String labCopilotBaseUrl = "http://host.docker.internal:8081";
        private int requestTimeoutSeconds = 60;
        private int assistantTimeoutSeconds = 120;
    }

    @Getter
    @Setter
    public static class Query {
        private int defaultTopK = 8;
        private int maxTopK = 50;
        private int maxChunkChars = 2000;   // Per snippet inside a prompt
        private int maxContextChars = 16000; // Whole snippet block inside a prompt
    }

    @Getter
    @Setter
    public static class Manager {
        private int maxSteps = 4;
    }

    @Getter
    @Setter
    public static class Guides {
        private String directory = "data/study_guides";
        private String urlPrefix = "/guides";
    }
}
