package com.workspace.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class WorkspaceQueryRequest {

    // Blank is allowed: the orchestrator answers it with an empty envelope
    @Size(max = 4000, message = "Question must be at most 4000 characters")
    private String question;

    @JsonProperty("top_k")
    private Integer topK = 8;

    private String mode = "assisted"; // "rag_only" | "assisted" | "manager_auto" | "study_guide"
}
