package com.workspace.core.query.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class QueryRequest {
    private String question;
    private Integer topK; // null means the configured default
    private String mode;  // raw label, resolved leniently by the orchestrator
}
