package com.workspace.core.strategy;

import com.workspace.core.query.model.QueryMode;
import com.workspace.core.query.model.QueryResult;

/**
 * One way of answering a question. Implementations are stateless beans;
 * everything they build lives for a single call.
 */
public interface QueryStrategy {

    QueryMode mode();

    /**
     * @param question trimmed, non-empty question
     * @param topK     already clamped to the configured bounds
     */
    QueryResult execute(String question, int topK);
}
