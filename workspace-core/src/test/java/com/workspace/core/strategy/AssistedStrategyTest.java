package com.workspace.core.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workspace.common.exception.BackendException;
import com.workspace.core.client.LabCopilotClient;
import com.workspace.core.client.StudyRagClient;
import com.workspace.core.config.WorkspaceProperties;
import com.workspace.core.query.RagResponseNormalizer;
import com.workspace.core.query.model.CopilotResult;
import com.workspace.core.query.model.QueryMode;
import com.workspace.core.query.model.QueryResult;
import com.workspace.llm.client.OllamaClient;
import com.workspace.llm.client.OllamaConfig.ModelRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssistedStrategyTest {

    private static final String QUESTION = "How do I calibrate the force sensor?";

    @Mock
    private StudyRagClient studyRagClient;
    @Mock
    private LabCopilotClient labCopilotClient;
    @Mock
    private OllamaClient ollamaClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AssistedStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new AssistedStrategy(studyRagClient, labCopilotClient, new RagResponseNormalizer(),
            new GroundedAnswerGenerator(ollamaClient, new WorkspaceProperties()));
    }

    private CopilotResult copilot(String json) throws Exception {
        return new CopilotResult(objectMapper.readTree(json));
    }

    @Test
    void execute_shouldPreferCopilotAnswerAndKeepPayloadUnmodified() throws Exception {
        when(studyRagClient.query(QUESTION, 8))
            .thenReturn(objectMapper.readTree("{\"answer\":\"rag answer\",\"chunks\":[{\"text\":\"zero the sensor\"}]}"));
        CopilotResult copilot = copilot("{\"answer\":\"Zero it with no load first.\",\"sources\":[\"lab3.pdf\"]}");
        when(labCopilotClient.chat(QUESTION, 8)).thenReturn(copilot);

        QueryResult result = strategy.execute(QUESTION, 8);

        assertThat(result.getMode()).isEqualTo(QueryMode.ASSISTED);
        assertThat(result.getAnswer()).isEqualTo("Zero it with no load first.");
        assertThat(result.getCopilot()).isSameAs(copilot);
        assertThat(result.getCopilot().getPayload().path("sources").get(0).asText()).isEqualTo("lab3.pdf");
        assertThat(result.getRag().getChunks()).hasSize(1);
        assertThat(result.getAgentTrace()).isEmpty();
        verifyNoInteractions(ollamaClient);
    }

    @Test
    void execute_shouldFallBackToRagAnswerWhenCopilotHasNone() throws Exception {
        when(studyRagClient.query(QUESTION, 8)).thenReturn(objectMapper.readTree("{\"answer\":\"rag answer\"}"));
        when(labCopilotClient.chat(QUESTION, 8)).thenReturn(copilot("{\"answer\":\"\"}"));

        assertThat(strategy.execute(QUESTION, 8).getAnswer()).isEqualTo("rag answer");
        verifyNoInteractions(ollamaClient);
    }

    @Test
    void execute_shouldGenerateFromChunksWhenNeitherBackendAnswers() throws Exception {
        when(studyRagClient.query(QUESTION, 8))
            .thenReturn(objectMapper.readTree("{\"retrieved\":[{\"text\":\"zero the sensor\"}]}"));
        when(labCopilotClient.chat(QUESTION, 8)).thenReturn(copilot("{\"answer\":null}"));
        when(ollamaClient.generate(anyString(), eq(ModelRole.CHAT), eq(0.2), eq(512))).thenReturn("Zero the sensor.");

        assertThat(strategy.execute(QUESTION, 8).getAnswer()).isEqualTo("Zero the sensor.");
    }

    @Test
    void execute_shouldPropagateCopilotFailure() throws Exception {
        when(studyRagClient.query(QUESTION, 8)).thenReturn(objectMapper.readTree("{}"));
        when(labCopilotClient.chat(QUESTION, 8))
            .thenThrow(new BackendException("HTTP error calling /chat: 503", "lab-copilot", 503));

        assertThatThrownBy(() -> strategy.execute(QUESTION, 8))
            .isInstanceOf(BackendException.class)
            .hasMessageContaining("503");
    }
}
