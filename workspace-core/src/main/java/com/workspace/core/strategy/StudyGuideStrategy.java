package com.workspace.core.strategy;

import com.workspace.core.client.StudyRagClient;
import com.workspace.core.export.ExportResult;
import com.workspace.core.export.GuideExportService;
import com.workspace.core.query.RagResponseNormalizer;
import com.workspace.core.query.model.AgentTrace;
import com.workspace.core.query.model.QueryMode;
import com.workspace.core.query.model.QueryResult;
import com.workspace.core.query.model.RagResult;
import com.workspace.core.query.model.TraceTool;
import com.workspace.llm.client.OllamaClient;
import com.workspace.llm.client.OllamaConfig;
import com.workspace.llm.prompt.WorkspacePrompts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Retrieval, then a markdown study guide from the study model, then export to
 * markdown (+ PDF when rendering works).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StudyGuideStrategy implements QueryStrategy {

    static final double TEMPERATURE = 0.3;
    static final int MAX_TOKENS = 1024;

    private final StudyRagClient studyRagClient;
    private final RagResponseNormalizer normalizer;
    private final GroundedAnswerGenerator answerGenerator;
    private final OllamaClient ollamaClient;
    private final GuideExportService exportService;

    @Override
    public QueryMode mode() {
        return QueryMode.STUDY_GUIDE;
    }

    @Override
    public QueryResult execute(String question, int topK) {
        long startTime = System.currentTimeMillis();

        RagResult rag = normalizer.normalize(studyRagClient.query(question, topK), topK);

        String context;
        if (rag.hasChunks()) {
            context = answerGenerator.buildContext(rag.getChunks());
        } else if (rag.hasAnswer()) {
            context = rag.getAnswer();
        } else {
            context = WorkspacePrompts.NO_CONTEXT_FOUND;
        }

        String guide = ollamaClient.generate(
            WorkspacePrompts.buildStudyGuidePrompt(question, context),
            OllamaConfig.ModelRole.STUDY,
            TEMPERATURE,
            MAX_TOKENS);

        ExportResult export = exportService.export(guide, question);

        AgentTrace trace = new AgentTrace();
        trace.append(TraceTool.RAG, "Fetched top-" + topK + " chunks from Study RAG.");
        trace.append(TraceTool.STUDY_GUIDE_LLM, "Generated a structured study guide based on RAG context.");
        trace.append(TraceTool.FILE_EXPORT, export.hasPdf()
            ? "Saved guide as markdown and PDF."
            : "Saved guide as markdown; PDF rendering was not available.");

        log.info("[STUDY_GUIDE] Completed | chunks={} | guideLength={} | slug={} | pdf={} | durationMs={}",
            rag.getChunks().size(), guide.length(), export.getSlug(), export.hasPdf(),
            System.currentTimeMillis() - startTime);

        return QueryResult.builder()
            .mode(QueryMode.STUDY_GUIDE)
            .question(question)
            .topK(topK)
            .answer(guide)
            .rag(rag)
            .agentTrace(trace.getSteps())
            .markdownUrl(export.getMarkdownUrl())
            .pdfUrl(export.getPdfUrl())
            .build();
    }
}
