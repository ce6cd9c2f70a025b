package com.workspace.core.manager;

import com.workspace.core.query.model.AgentTrace;
import com.workspace.core.query.model.CopilotResult;
import com.workspace.core.query.model.RagResult;
import com.workspace.core.query.model.TraceTool;
import lombok.Getter;

/**
 * Mutable state of one manager loop: current state, decision budget, the trace
 * and the most recent tool results. Confined to the request thread.
 */
@Getter
public class ManagerRun {

    private final int maxSteps;
    private final AgentTrace trace = new AgentTrace();

    private ManagerState state = ManagerState.DECIDING;
    private int decisionsMade;
    private ManagerDecision pendingDecision;
    private RagResult latestRag;
    private CopilotResult latestCopilot;

    public ManagerRun(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public boolean hasBudget() {
        return decisionsMade < maxSteps;
    }

    /**
     * DECIDING → ACTING for a tool, DECIDING → DONE for a final decision.
     */
    public void accept(ManagerDecision decision) {
        requireState(ManagerState.DECIDING);
        decisionsMade++;
        if (decision.isFinal()) {
            trace.append(TraceTool.MANAGER, "Stop and answer now. Reason: " + decision.getReason());
            pendingDecision = null;
            state = ManagerState.DONE;
        } else {
            pendingDecision = decision;
            state = ManagerState.ACTING;
        }
    }

    public void recordRag(RagResult rag, String summary) {
        requireState(ManagerState.ACTING);
        latestRag = rag;
        trace.append(TraceTool.RAG, summary);
        backToDeciding();
    }

    public void recordCopilot(CopilotResult copilot, String summary) {
        requireState(ManagerState.ACTING);
        latestCopilot = copilot;
        trace.append(TraceTool.COPILOT, summary);
        backToDeciding();
    }

    /**
     * Step cap reached without a final decision.
     */
    public void exhaust() {
        requireState(ManagerState.DECIDING);
        state = ManagerState.DONE;
    }

    private void backToDeciding() {
        pendingDecision = null;
        state = ManagerState.DECIDING;
    }

    private void requireState(ManagerState expected) {
        if (state != expected) {
            throw new IllegalStateException("Manager run is " + state + ", expected " + expected);
        }
    }
}
