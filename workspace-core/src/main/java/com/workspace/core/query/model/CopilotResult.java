package com.workspace.core.query.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Lab Copilot payload, kept exactly as received. Serializes as the original JSON.
 */
public class CopilotResult {

    private final JsonNode payload;

    public CopilotResult(JsonNode payload) {
        this.payload = payload != null ? payload : MissingNode.getInstance();
    }

    @JsonValue
    public JsonNode getPayload() {
        return payload;
    }

    /**
     * @return the {@code answer} field when it is non-empty text, otherwise ""
     */
    public String getAnswer() {
        JsonNode answer = payload.path("answer");
        return answer.isTextual() ? answer.asText() : "";
    }

    public boolean hasAnswer() {
        return !getAnswer().isEmpty();
    }

    @Override
    public String toString() {
        return "CopilotResult" + payload;
    }
}
