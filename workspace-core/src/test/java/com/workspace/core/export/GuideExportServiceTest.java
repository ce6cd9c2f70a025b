package com.workspace.core.export;

import com.workspace.core.config.WorkspaceProperties;
import com.workspace.core.export.impl.LocalGuideStorageService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class GuideExportServiceTest {

    private static final String GUIDE = "# Thermodynamics\n\nShort overview.\n\n## Laws\n- **Zeroth** law: équilibre\n- First law";

    @TempDir
    Path tempDir;

    private GuideExportService serviceWritingTo(Path directory, PdfGuideRenderer renderer) {
        WorkspaceProperties properties = new WorkspaceProperties();
        properties.getGuides().setDirectory(directory.toString());
        return new GuideExportService(new LocalGuideStorageService(properties), renderer);
    }

    @Test
    void export_shouldWriteMarkdownAndPdfUnderSlug() throws Exception {
        Path guides = tempDir.resolve("study_guides");

        ExportResult result = serviceWritingTo(guides, new PdfGuideRenderer())
            .export(GUIDE, "Make me a study plan for Thermodynamics!");

        assertThat(result.getSlug()).isEqualTo("make-me-a-study-plan-for-thermodynamics");
        assertThat(result.getMarkdownUrl()).isEqualTo("/guides/make-me-a-study-plan-for-thermodynamics.md");
        assertThat(result.getPdfUrl()).isEqualTo("/guides/make-me-a-study-plan-for-thermodynamics.pdf");

        Path markdown = guides.resolve("make-me-a-study-plan-for-thermodynamics.md");
        assertThat(Files.readString(markdown, StandardCharsets.UTF_8)).isEqualTo(GUIDE);

        Path pdf = guides.resolve("make-me-a-study-plan-for-thermodynamics.pdf");
        assertThat(pdf).exists();
        assertThat(new String(Files.readAllBytes(pdf), 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");
    }

    @Test
    void export_shouldKeepMarkdownAndOmitPdfWhenRenderingFails() throws Exception {
        PdfGuideRenderer failing = mock(PdfGuideRenderer.class);
        doThrow(new IOException("font unavailable")).when(failing).render(anyString(), any(Path.class));

        ExportResult result = serviceWritingTo(tempDir, failing).export(GUIDE, "Optics study guide");

        assertThat(result.hasPdf()).isFalse();
        assertThat(result.getPdfPath()).isNull();
        assertThat(result.getPdfUrl()).isNull();
        assertThat(tempDir.resolve("optics-study-guide.md")).exists();
        assertThat(result.getMarkdownUrl()).isEqualTo("/guides/optics-study-guide.md");
    }

    @Test
    void export_shouldRemovePreviousPdfWhenRenderingFails() throws Exception {
        serviceWritingTo(tempDir, new PdfGuideRenderer()).export(GUIDE, "Optics study guide");
        Path pdf = tempDir.resolve("optics-study-guide.pdf");
        assertThat(pdf).exists();

        PdfGuideRenderer failing = mock(PdfGuideRenderer.class);
        doThrow(new IOException("font unavailable")).when(failing).render(anyString(), any(Path.class));

        ExportResult result = serviceWritingTo(tempDir, failing).export("updated guide", "Optics study guide");

        assertThat(result.getPdfUrl()).isNull();
        assertThat(pdf).doesNotExist();
        assertThat(Files.readString(tempDir.resolve("optics-study-guide.md"))).isEqualTo("updated guide");
    }

    @Test
    void export_shouldOverwriteGuideWithSameSlug() throws Exception {
        GuideExportService service = serviceWritingTo(tempDir, new PdfGuideRenderer());

        service.export("first version", "Optics study guide");
        service.export("second version", "optics   STUDY guide?");

        assertThat(Files.readString(tempDir.resolve("optics-study-guide.md"))).isEqualTo("second version");
    }

    @Test
    void export_shouldFailWhenMarkdownCannotBeWritten() throws Exception {
        Path notADirectory = Files.writeString(tempDir.resolve("occupied"), "plain file");

        GuideExportService service = serviceWritingTo(notADirectory, new PdfGuideRenderer());

        assertThatThrownBy(() -> service.export(GUIDE, "Optics study guide"))
            .isInstanceOf(GuideExportException.class)
            .hasMessageContaining("optics-study-guide.md");
    }
}
