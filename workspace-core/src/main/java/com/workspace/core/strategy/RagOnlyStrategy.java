package com.workspace.core.strategy;

import com.workspace.core.client.StudyRagClient;
import com.workspace.core.query.RagResponseNormalizer;
import com.workspace.core.query.model.QueryMode;
import com.workspace.core.query.model.QueryResult;
import com.workspace.core.query.model.RagResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Retrieval only. Uses Study RAG's own answer when it has one, otherwise
 * summarizes the retrieved chunks.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RagOnlyStrategy implements QueryStrategy {

    private final StudyRagClient studyRagClient;
    private final RagResponseNormalizer normalizer;
    private final GroundedAnswerGenerator answerGenerator;

    @Override
    public QueryMode mode() {
        return QueryMode.RAG_ONLY;
    }

    @Override
    public QueryResult execute(String question, int topK) {
        RagResult rag = normalizer.normalize(studyRagClient.query(question, topK), topK);

        String answer = rag.getAnswer();
        if (!rag.hasAnswer()) {
            answer = answerGenerator.answerFromChunks(question, rag.getChunks());
        }

        log.info("[RAG_ONLY] Completed | chunks={} | backendAnswer={} | answerLength={}",
            rag.getChunks().size(), rag.hasAnswer(), answer.length());

        return QueryResult.builder()
            .mode(QueryMode.RAG_ONLY)
            .question(question)
            .topK(topK)
            .answer(answer)
            .rag(rag)
            .build();
    }
}
