package com.workspace.core.manager;

import com.workspace.core.client.LabCopilotClient;
import com.workspace.core.client.StudyRagClient;
import com.workspace.core.config.WorkspaceProperties;
import com.workspace.core.query.RagResponseNormalizer;
import com.workspace.core.query.model.CopilotResult;
import com.workspace.core.query.model.QueryMode;
import com.workspace.core.query.model.QueryResult;
import com.workspace.core.query.model.RagResult;
import com.workspace.llm.client.OllamaClient;
import com.workspace.llm.client.OllamaConfig;
import com.workspace.llm.prompt.WorkspacePrompts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Bounded tool-selection loop behind {@code manager_auto}.
 *
 * DECIDING asks the manager model for the next action, ACTING runs the chosen
 * tool and appends its summary to the trace, DONE ends the loop. The loop stops
 * after {@code workspace.manager.max-steps} decisions even without a final one.
 * Tool calls are strictly sequential.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManagerDecisionEngine {

    static final double DECISION_TEMPERATURE = 0.1;
    static final int DECISION_MAX_TOKENS = 256;
    static final double ANSWER_TEMPERATURE = 0.2;
    static final int ANSWER_MAX_TOKENS = 512;

    static final String NO_CHUNKS = "(no chunks)";
    static final String NO_ANSWER = "(no answer)";

    private final OllamaClient ollamaClient;
    private final ManagerDecisionParser decisionParser;
    private final StudyRagClient studyRagClient;
    private final LabCopilotClient labCopilotClient;
    private final RagResponseNormalizer normalizer;
    private final WorkspaceProperties properties;

    public QueryResult run(String question, int topK) {
        long startTime = System.currentTimeMillis();
        ManagerRun run = new ManagerRun(properties.getManager().getMaxSteps());

        while (run.getState() != ManagerState.DONE) {
            if (run.getState() == ManagerState.DECIDING) {
                if (!run.hasBudget()) {
                    log.info("[MANAGER] Step cap reached without final decision | maxSteps={}", run.getMaxSteps());
                    run.exhaust();
                    continue;
                }
                ManagerDecision decision = decide(question, run);
                log.info("[MANAGER] Decision | step={} | action={} | reason={}",
                    run.getDecisionsMade() + 1, decision.getAction().getLabel(), decision.getReason());
                run.accept(decision);
            } else {
                act(run, question, topK);
            }
        }

        String answer = ollamaClient.generate(
            WorkspacePrompts.buildManagerAnswerPrompt(question, run.getTrace().render(WorkspacePrompts.NO_STEPS_EXECUTED)),
            OllamaConfig.ModelRole.MANAGER,
            ANSWER_TEMPERATURE,
            ANSWER_MAX_TOKENS);

        log.info("[MANAGER] Completed | decisions={} | traceSteps={} | answerLength={} | durationMs={}",
            run.getDecisionsMade(), run.getTrace().size(), answer.length(), System.currentTimeMillis() - startTime);

        return QueryResult.builder()
            .mode(QueryMode.MANAGER_AUTO)
            .question(question)
            .topK(topK)
            .answer(answer)
            .rag(run.getLatestRag())
            .copilot(run.getLatestCopilot())
            .agentTrace(run.getTrace().getSteps())
            .build();
    }

    private ManagerDecision decide(String question, ManagerRun run) {
        String raw = ollamaClient.generate(
            WorkspacePrompts.buildManagerDecisionPrompt(question, run.getTrace().render(WorkspacePrompts.NO_PREVIOUS_STEPS)),
            OllamaConfig.ModelRole.MANAGER,
            DECISION_TEMPERATURE,
            DECISION_MAX_TOKENS);
        return decisionParser.parse(raw);
    }

    private void act(ManagerRun run, String question, int topK) {
        switch (run.getPendingDecision().getAction()) {
            case RAG -> {
                RagResult rag = normalizer.normalize(studyRagClient.query(question, topK), topK);
                String summary;
                if (rag.hasAnswer()) {
                    summary = rag.getAnswer();
                } else if (rag.hasChunks()) {
                    summary = rag.getChunks().get(0).getText();
                } else {
                    summary = NO_CHUNKS;
                }
                run.recordRag(rag, summary);
            }
            case COPILOT -> {
                CopilotResult copilot = labCopilotClient.chat(question, topK);
                run.recordCopilot(copilot, copilot.hasAnswer() ? copilot.getAnswer() : NO_ANSWER);
            }
            default -> throw new IllegalStateException("No tool for action " + run.getPendingDecision().getAction());
        }
    }
}
