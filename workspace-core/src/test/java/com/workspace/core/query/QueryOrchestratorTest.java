package com.workspace.core.query;

import com.workspace.common.exception.BackendException;
import com.workspace.core.config.WorkspaceProperties;
import com.workspace.core.query.model.QueryMode;
import com.workspace.core.query.model.QueryRequest;
import com.workspace.core.query.model.QueryResult;
import com.workspace.core.strategy.QueryStrategy;
import com.workspace.core.strategy.QueryStrategyFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryOrchestratorTest {

    @Mock
    private QueryStrategyFactory strategyFactory;
    @Mock
    private QueryStrategy strategy;

    private QueryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new QueryOrchestrator(strategyFactory, new WorkspaceProperties());
    }

    private static QueryRequest request(String question, Integer topK, String mode) {
        return QueryRequest.builder().question(question).topK(topK).mode(mode).build();
    }

    @ParameterizedTest
    @ValueSource(strings = {"rag_only", "assisted", "manager_auto", "study_guide"})
    void processQuery_shouldReturnNeutralEnvelopeForBlankQuestionWithoutCallingBackends(String mode) {
        QueryResult result = orchestrator.processQuery(request("   \n ", 5, mode));

        assertThat(result.getMode()).isEqualTo(QueryMode.fromString(mode));
        assertThat(result.getQuestion()).isEmpty();
        assertThat(result.getTopK()).isEqualTo(5);
        assertThat(result.getAnswer()).isEmpty();
        assertThat(result.getRag()).isNull();
        assertThat(result.getCopilot()).isNull();
        assertThat(result.getAgentTrace()).isEmpty();
        assertThat(result.getMarkdownUrl()).isNull();
        assertThat(result.getPdfUrl()).isNull();
        verifyNoInteractions(strategyFactory);
    }

    @Test
    void processQuery_shouldTrimQuestionAndDispatchToResolvedMode() {
        QueryResult expected = QueryResult.builder().mode(QueryMode.RAG_ONLY).answer("F = ma").build();
        when(strategyFactory.getStrategy(QueryMode.RAG_ONLY)).thenReturn(strategy);
        when(strategy.execute("What is force?", 8)).thenReturn(expected);

        QueryResult result = orchestrator.processQuery(request("  What is force?  ", null, "RAG_ONLY"));

        assertThat(result).isSameAs(expected);
    }

    @Test
    void processQuery_shouldDefaultUnknownModeToAssisted() {
        QueryResult expected = QueryResult.builder().mode(QueryMode.ASSISTED).build();
        when(strategyFactory.getStrategy(QueryMode.ASSISTED)).thenReturn(strategy);
        when(strategy.execute("q", 8)).thenReturn(expected);

        assertThat(orchestrator.processQuery(request("q", 8, "something_else"))).isSameAs(expected);
    }

    @Test
    void processQuery_shouldPropagateBackendFailure() {
        when(strategyFactory.getStrategy(QueryMode.ASSISTED)).thenReturn(strategy);
        when(strategy.execute("q", 8)).thenThrow(new BackendException("HTTP error calling /query: 500", "study-rag", 500));

        assertThatThrownBy(() -> orchestrator.processQuery(request("q", 8, null)))
            .isInstanceOf(BackendException.class);
    }

    @Test
    void resolveTopK_shouldDefaultAndClamp() {
        assertThat(orchestrator.resolveTopK(null)).isEqualTo(8);
        assertThat(orchestrator.resolveTopK(0)).isEqualTo(1);
        assertThat(orchestrator.resolveTopK(-3)).isEqualTo(1);
        assertThat(orchestrator.resolveTopK(12)).isEqualTo(12);
        assertThat(orchestrator.resolveTopK(500)).isEqualTo(50);
    }
}
