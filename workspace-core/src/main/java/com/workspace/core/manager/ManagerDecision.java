package com.workspace.core.manager;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ManagerDecision {

    public static final String FALLBACK_REASON = "Failed to parse; defaulting to final.";

    private ManagerAction action;
    private String reason;

    public static ManagerDecision of(ManagerAction action, String reason) {
        return new ManagerDecision(action, reason != null ? reason.strip() : "");
    }

    /**
     * Safe default when the model's output can't be trusted: stop calling tools.
     */
    public static ManagerDecision fallback() {
        return new ManagerDecision(ManagerAction.FINAL, FALLBACK_REASON);
    }

    public boolean isFinal() {
        return action == ManagerAction.FINAL;
    }
}
