package com.workspace.api.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness probe. Static payload, no backend calls.
 */
@RestController
public class HealthController {

    static final String SERVICE_NAME = "workspace-agent";

    @GetMapping("/healthz")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("service", SERVICE_NAME);
        return ResponseEntity.ok(response);
    }
}
