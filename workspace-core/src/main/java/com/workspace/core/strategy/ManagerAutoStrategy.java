package com.workspace.core.strategy;

import com.workspace.core.manager.ManagerDecisionEngine;
import com.workspace.core.query.model.AgentTrace;
import com.workspace.core.query.model.QueryMode;
import com.workspace.core.query.model.QueryResult;
import com.workspace.core.query.model.TraceTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Lets the manager model choose tools, except when the user plainly asks for a
 * study guide or plan: that goes straight to {@link StudyGuideStrategy}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ManagerAutoStrategy implements QueryStrategy {

    static final List<String> STUDY_GUIDE_PHRASES = List.of("study guide", "study plan", "learning plan");

    static final String DIRECT_ROUTE_SUMMARY = "User explicitly asked for a study guide/plan, "
        + "so manager delegated directly to the study_guide tool.";

    private final ManagerDecisionEngine decisionEngine;
    private final StudyGuideStrategy studyGuideStrategy;

    @Override
    public QueryMode mode() {
        return QueryMode.MANAGER_AUTO;
    }

    @Override
    public QueryResult execute(String question, int topK) {
        if (!asksForStudyGuide(question)) {
            return decisionEngine.run(question, topK);
        }

        log.info("[MANAGER_AUTO] Study guide requested, bypassing decision loop");
        QueryResult guide = studyGuideStrategy.execute(question, topK);

        AgentTrace trace = new AgentTrace();
        trace.append(TraceTool.STUDY_GUIDE_DIRECT, DIRECT_ROUTE_SUMMARY);
        trace.appendAll(guide.getAgentTrace());

        return guide.toBuilder()
            .mode(QueryMode.MANAGER_AUTO)
            .agentTrace(trace.getSteps())
            .build();
    }

    static boolean asksForStudyGuide(String question) {
        String lower = question.toLowerCase(Locale.ROOT);
        return STUDY_GUIDE_PHRASES.stream().anyMatch(lower::contains);
    }
}
