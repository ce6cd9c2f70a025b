package com.workspace.core.query.model;

import com.workspace.common.util.TextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only, request-scoped log of tool invocations. Step numbers are assigned
 * here so they always run 1..n without gaps.
 */
public class AgentTrace {

    public static final int MAX_SUMMARY_LENGTH = 400;

    private final List<TraceStep> steps = new ArrayList<>();

    public TraceStep append(TraceTool tool, String summary) {
        TraceStep step = TraceStep.builder()
            .step(steps.size() + 1)
            .tool(tool)
            .summary(TextUtils.truncate(summary, MAX_SUMMARY_LENGTH))
            .build();
        steps.add(step);
        return step;
    }

    /**
     * Copies steps from another trace after the ones already present, renumbering them.
     */
    public AgentTrace appendAll(List<TraceStep> others) {
        for (TraceStep other : others) {
            append(other.getTool(), other.getSummary());
        }
        return this;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    public List<TraceStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * One "Step i via tool: summary" line per step, or the placeholder when nothing ran.
     */
    public String render(String emptyPlaceholder) {
        if (steps.isEmpty()) {
            return emptyPlaceholder;
        }
        return steps.stream().map(TraceStep::render).collect(Collectors.joining("\n"));
    }
}
