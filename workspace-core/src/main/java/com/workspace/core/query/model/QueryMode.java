package com.workspace.core.query.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * The four mutually exclusive ways a question can be answered.
 */
@Getter
@RequiredArgsConstructor
public enum QueryMode {

    RAG_ONLY("rag_only"),
    ASSISTED("assisted"),
    MANAGER_AUTO("manager_auto"),
    STUDY_GUIDE("study_guide");

    public static final QueryMode DEFAULT = ASSISTED;

    // Label used by earlier clients for the assisted mode
    private static final String LEGACY_ASSISTED_LABEL = "copilot";

    @JsonValue
    private final String label;

    /**
     * Lenient lookup: case-insensitive, unknown or absent values resolve to {@link #DEFAULT}.
     */
    public static QueryMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (LEGACY_ASSISTED_LABEL.equals(normalized)) {
            return ASSISTED;
        }
        for (QueryMode mode : values()) {
            if (mode.label.equals(normalized)) {
                return mode;
            }
        }
        return DEFAULT;
    }

    @Override
    public String toString() {
        return label;
    }
}
