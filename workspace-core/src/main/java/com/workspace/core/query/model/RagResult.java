package com.workspace.core.query.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class RagResult {
    private String answer;
    private List<Chunk> chunks;
    private JsonNode raw;

    public boolean hasAnswer() {
        return answer != null && !answer.isEmpty();
    }

    public boolean hasChunks() {
        return chunks != null && !chunks.isEmpty();
    }
}
