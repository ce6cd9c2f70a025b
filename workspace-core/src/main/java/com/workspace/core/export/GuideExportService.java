package com.workspace.core.export;

import com.workspace.common.util.SlugUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Two-phase export of a generated study guide:
 * 1. markdown write, required (failure aborts the request)
 * 2. PDF rendering, optional (failure is logged and reported as absent)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GuideExportService {

    private final GuideStorageService storageService;
    private final PdfGuideRenderer pdfRenderer;

    public ExportResult export(String markdown, String question) {
        String slug = SlugUtils.slugify(question);
        String markdownName = slug + ".md";

        Path markdownPath;
        try {
            markdownPath = storageService.writeText(markdownName, markdown);
        } catch (IOException e) {
            log.error("[GUIDE_EXPORT] Markdown write failed | slug={} | error={}", slug, e.getMessage(), e);
            throw new GuideExportException("Failed to save study guide " + markdownName, e);
        }

        Path pdfPath = renderPdf(markdown, slug);

        log.info("[GUIDE_EXPORT] Guide exported | slug={} | markdownLength={} | pdf={}",
            slug, markdown != null ? markdown.length() : 0, pdfPath != null);

        return ExportResult.builder()
            .slug(slug)
            .markdownPath(markdownPath.toString())
            .markdownUrl(storageService.publicUrl(markdownName))
            .pdfPath(pdfPath != null ? pdfPath.toString() : null)
            .pdfUrl(pdfPath != null ? storageService.publicUrl(slug + ".pdf") : null)
            .build();
    }

    private Path renderPdf(String markdown, String slug) {
        Path target = null;
        try {
            target = storageService.resolve(slug + ".pdf");
            pdfRenderer.render(markdown, target);
            return target;
        } catch (Exception e) {
            // PDF is optional, the markdown is already on disk
            log.warn("[GUIDE_EXPORT] PDF rendering skipped | slug={} | error={}", slug, e.getMessage());
            removeStalePdf(target, slug);
            return null;
        }
    }

    /**
     * A PDF left over from an earlier export of the same slug would no longer match the markdown.
     */
    private void removeStalePdf(Path target, String slug) {
        if (target == null) {
            return;
        }
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("[GUIDE_EXPORT] Could not remove stale PDF | slug={} | error={}", slug, e.getMessage());
        }
    }
}
