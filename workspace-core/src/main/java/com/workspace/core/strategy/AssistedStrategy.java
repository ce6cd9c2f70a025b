package com.workspace.core.strategy;

import com.workspace.core.client.LabCopilotClient;
import com.workspace.core.client.StudyRagClient;
import com.workspace.core.query.RagResponseNormalizer;
import com.workspace.core.query.model.CopilotResult;
import com.workspace.core.query.model.QueryMode;
import com.workspace.core.query.model.QueryResult;
import com.workspace.core.query.model.RagResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Study RAG chunks for display plus Lab Copilot's answer. The two calls are
 * independent; Copilot's internal retrieval is never inspected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssistedStrategy implements QueryStrategy {

    private final StudyRagClient studyRagClient;
    private final LabCopilotClient labCopilotClient;
    private final RagResponseNormalizer normalizer;
    private final GroundedAnswerGenerator answerGenerator;

    @Override
    public QueryMode mode() {
        return QueryMode.ASSISTED;
    }

    @Override
    public QueryResult execute(String question, int topK) {
        RagResult rag = normalizer.normalize(studyRagClient.query(question, topK), topK);
        CopilotResult copilot = labCopilotClient.chat(question, topK);

        // Copilot answer, then Study RAG's answer, then a summary of the chunks
        String answer;
        String answerSource;
        if (copilot.hasAnswer()) {
            answer = copilot.getAnswer();
            answerSource = "copilot";
        } else if (rag.hasAnswer()) {
            answer = rag.getAnswer();
            answerSource = "rag";
        } else {
            answer = answerGenerator.answerFromChunks(question, rag.getChunks());
            answerSource = answer.isEmpty() ? "none" : "generated";
        }

        log.info("[ASSISTED] Completed | chunks={} | answerSource={} | answerLength={}",
            rag.getChunks().size(), answerSource, answer.length());

        return QueryResult.builder()
            .mode(QueryMode.ASSISTED)
            .question(question)
            .topK(topK)
            .answer(answer)
            .rag(rag)
            .copilot(copilot)
            .build();
    }
}
