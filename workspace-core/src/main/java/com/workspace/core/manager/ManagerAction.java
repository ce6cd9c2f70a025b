package com.workspace.core.manager;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;
import java.util.Optional;

/**
 * Tools the manager model may pick.
 */
@Getter
@RequiredArgsConstructor
public enum ManagerAction {

    RAG("rag"),
    COPILOT("copilot"),
    FINAL("final");

    private final String label;

    /**
     * Strict lookup, case-insensitive. Empty for anything outside the vocabulary.
     */
    public static Optional<ManagerAction> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ManagerAction action : values()) {
            if (action.label.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
