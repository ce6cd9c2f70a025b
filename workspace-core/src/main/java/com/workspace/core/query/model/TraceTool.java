package com.workspace.core.query.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TraceTool {

    MANAGER("manager"),
    RAG("rag"),
    COPILOT("copilot"),
    STUDY_GUIDE_LLM("study_guide_llm"),
    FILE_EXPORT("file_export"),
    STUDY_GUIDE_DIRECT("study_guide (direct)");

    @JsonValue
    private final String label;

    @Override
    public String toString() {
        return label;
    }
}
