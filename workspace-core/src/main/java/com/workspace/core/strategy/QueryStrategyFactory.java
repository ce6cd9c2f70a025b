package com.workspace.core.strategy;

import com.workspace.core.query.model.QueryMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class QueryStrategyFactory {

    private final List<QueryStrategy> strategies;

    public QueryStrategy getStrategy(QueryMode mode) {
        return strategies.stream()
            .filter(s -> s.mode() == mode)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No strategy registered for mode: " + mode));
    }
}
