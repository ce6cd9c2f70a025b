package com.workspace.core.query.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The envelope every mode returns to the transport layer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {
    private QueryMode mode;
    private String question;
    @JsonProperty("top_k")
    private int topK;
    private String answer;
    private RagResult rag;
    private CopilotResult copilot;
    @JsonProperty("agent_trace")
    @Builder.Default
    private List<TraceStep> agentTrace = new ArrayList<>();
    @JsonProperty("markdown_url")
    private String markdownUrl;
    @JsonProperty("pdf_url")
    private String pdfUrl;

    /**
     * Neutral envelope: nothing was asked, nothing was called.
     */
    public static QueryResult empty(QueryMode mode, int topK) {
        return QueryResult.builder()
            .mode(mode)
            .question("")
            .topK(topK)
            .answer("")
            .agentTrace(new ArrayList<>())
            .build();
    }
}
