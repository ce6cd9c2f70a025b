package com.workspace.core.query;

import com.workspace.core.config.WorkspaceProperties;
import com.workspace.core.query.model.QueryMode;
import com.workspace.core.query.model.QueryRequest;
import com.workspace.core.query.model.QueryResult;
import com.workspace.core.strategy.QueryStrategyFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single entry point used by both the form and the JSON endpoints.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryOrchestrator {

    private final QueryStrategyFactory strategyFactory;
    private final WorkspaceProperties properties;

    /**
     * Trims the question, resolves mode and top_k, and dispatches to the matching strategy.
     * An empty question returns a neutral envelope without touching any backend.
     * Backend failures propagate as {@link com.workspace.common.exception.BackendException}.
     */
    public QueryResult processQuery(QueryRequest request) {
        String question = request.getQuestion() != null ? request.getQuestion().strip() : "";
        QueryMode mode = QueryMode.fromString(request.getMode());
        int topK = resolveTopK(request.getTopK());

        if (question.isEmpty()) {
            log.debug("[QUERY_ORCH] Empty question, skipping backends | mode={}", mode);
            return QueryResult.empty(mode, topK);
        }

        String queryId = "query-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId();
        long startTime = System.currentTimeMillis();

        log.info("[QUERY_ORCH] Starting query processing | queryId={} | mode={} | topK={} | questionLength={}",
            queryId, mode, topK, question.length());

        try {
            QueryResult result = strategyFactory.getStrategy(mode).execute(question, topK);

            log.info("[QUERY_ORCH] Query completed | queryId={} | mode={} | answerLength={} | traceSteps={} | durationMs={}",
                queryId, result.getMode(), result.getAnswer() != null ? result.getAnswer().length() : 0,
                result.getAgentTrace() != null ? result.getAgentTrace().size() : 0,
                System.currentTimeMillis() - startTime);

            return result;
        } catch (RuntimeException e) {
            log.error("[QUERY_ORCH] Query processing failed | queryId={} | mode={} | durationMs={} | error={}",
                queryId, mode, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        }
    }

    /**
     * Missing → default; otherwise clamped into [1, maxTopK].
     */
    int resolveTopK(Integer requested) {
        WorkspaceProperties.Query limits = properties.getQuery();
        if (requested == null) {
            return limits.getDefaultTopK();
        }
        return Math.max(1, Math.min(requested, limits.getMaxTopK()));
    }
}
