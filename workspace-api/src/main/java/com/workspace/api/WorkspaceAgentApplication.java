package com.workspace.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.workspace")
public class WorkspaceAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkspaceAgentApplication.class, args);
    }
}
