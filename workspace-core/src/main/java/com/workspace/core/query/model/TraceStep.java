package com.workspace.core.query.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraceStep {
    private int step;
    private TraceTool tool;
    private String summary;

    public String render() {
        return "Step " + step + " via " + tool.getLabel() + ": " + summary;
    }
}
