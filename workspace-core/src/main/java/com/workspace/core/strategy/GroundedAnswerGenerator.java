package com.workspace.core.strategy;

import com.workspace.common.util.TextUtils;
import com.workspace.core.config.WorkspaceProperties;
import com.workspace.core.query.model.Chunk;
import com.workspace.llm.client.OllamaClient;
import com.workspace.llm.client.OllamaConfig;
import com.workspace.llm.prompt.WorkspacePrompts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds the numbered snippet context and produces short answers that may only use it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroundedAnswerGenerator {

    static final double TEMPERATURE = 0.2;
    static final int MAX_TOKENS = 512;

    private final OllamaClient ollamaClient;
    private final WorkspaceProperties properties;

    /**
     * @return generated answer, or "" without calling the model when there are no chunks
     */
    public String answerFromChunks(String question, List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return "";
        }
        String context = buildContext(chunks);
        log.info("[GROUNDED_ANSWER] Summarizing chunks | chunks={} | contextLength={}", chunks.size(), context.length());
        return ollamaClient.generate(
            WorkspacePrompts.buildGroundedAnswerPrompt(question, context),
            OllamaConfig.ModelRole.CHAT,
            TEMPERATURE,
            MAX_TOKENS);
    }

    /**
     * "[idx] text" blocks separated by blank lines. Each snippet and the whole block
     * are capped so a large top_k cannot blow past the model's context window.
     */
    public String buildContext(List<Chunk> chunks) {
        WorkspaceProperties.Query limits = properties.getQuery();
        StringBuilder context = new StringBuilder();
        for (Chunk chunk : chunks) {
            String block = "[" + chunk.getIdx() + "] " + TextUtils.truncate(chunk.getText(), limits.getMaxChunkChars());
            int separator = context.length() == 0 ? 0 : 2;
            if (context.length() + separator + block.length() > limits.getMaxContextChars()) {
                log.debug("[GROUNDED_ANSWER] Context limit reached | includedChunks={} | totalChunks={}",
                    chunk.getIdx() - 1, chunks.size());
                break;
            }
            if (separator > 0) {
                context.append("\n\n");
            }
            context.append(block);
        }
        return context.toString();
    }
}
