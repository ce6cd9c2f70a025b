package com.workspace.core.export;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.font.encoding.GlyphList;
import org.apache.pdfbox.pdmodel.font.encoding.WinAnsiEncoding;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Print-ready rendering of a markdown study guide with PDFBox.
 *
 * Only the structure guides actually use is honored: headings, bullet lists and
 * paragraphs. Inline emphasis markers are stripped.
 */
@Component
@Slf4j
public class PdfGuideRenderer {

    private static final float MARGIN = 56f;
    private static final float BODY_SIZE = 11f;
    private static final float LEADING_FACTOR = 1.4f;
    private static final float BULLET_INDENT = 14f;

    public void render(String markdown, Path target) throws IOException {
        PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

        try (PDDocument document = new PDDocument()) {
            PageWriter writer = new PageWriter(document);
            try {
                for (String rawLine : (markdown != null ? markdown : "").split("\\R", -1)) {
                    String line = rawLine.strip();
                    if (line.isEmpty()) {
                        writer.skip(BODY_SIZE * 0.6f);
                        continue;
                    }
                    if (line.startsWith("#")) {
                        int level = headingLevel(line);
                        float size = level == 1 ? 18f : level == 2 ? 15f : 13f;
                        writer.skip(size * 0.4f);
                        writer.paragraph(stripInline(line.substring(level).strip()), bold, size, 0f, null);
                    } else if (isBullet(line)) {
                        writer.paragraph(stripInline(line.substring(2).strip()), regular, BODY_SIZE, BULLET_INDENT, "•");
                    } else {
                        writer.paragraph(stripInline(line), regular, BODY_SIZE, 0f, null);
                    }
                }
            } finally {
                writer.close();
            }
            document.save(target.toFile());
        }
        log.debug("Rendered guide PDF to {}", target);
    }

    private static int headingLevel(String line) {
        int level = 0;
        while (level < line.length() && line.charAt(level) == '#') {
            level++;
        }
        return level;
    }

    private static boolean isBullet(String line) {
        return line.length() > 2
            && (line.startsWith("- ") || line.startsWith("* ") || line.startsWith("+ "));
    }

    private static String stripInline(String text) {
        return text.replace("**", "").replace("__", "").replace("`", "");
    }

    /**
     * Standard 14 fonts only cover WinAnsi; anything else becomes '?'.
     */
    static String toWinAnsi(String text) {
        StringBuilder out = new StringBuilder(text.length());
        text.replace("\t", "    ").codePoints().forEach(cp -> {
            String glyph = GlyphList.getAdobeGlyphList().codePointToName(cp);
            out.appendCodePoint(WinAnsiEncoding.INSTANCE.contains(glyph) ? cp : '?');
        });
        return out.toString();
    }

    private static List<String> wrap(String text, PDType1Font font, float size, float width) throws IOException {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split(" +")) {
            String candidate = current.length() == 0 ? word : current + " " + word;
            if (current.length() > 0 && font.getStringWidth(candidate) / 1000f * size > width) {
                lines.add(current.toString());
                current = new StringBuilder(word);
            } else {
                current = new StringBuilder(candidate);
            }
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }

    /**
     * Cursor over the current page, starting a new one when the bottom margin is hit.
     */
    private static final class PageWriter {

        private final PDDocument document;
        private final float textWidth = PDRectangle.A4.getWidth() - 2 * MARGIN;
        private PDPageContentStream stream;
        private float y;

        PageWriter(PDDocument document) throws IOException {
            this.document = document;
            newPage();
        }

        void skip(float amount) {
            y -= amount;
        }

        void paragraph(String text, PDType1Font font, float size, float indent, String marker) throws IOException {
            float leading = size * LEADING_FACTOR;
            List<String> lines = wrap(toWinAnsi(text), font, size, textWidth - indent);
            for (int i = 0; i < lines.size(); i++) {
                if (y - leading < MARGIN) {
                    newPage();
                }
                y -= leading;
                if (marker != null && i == 0) {
                    show(marker, font, size, MARGIN + indent - BULLET_INDENT * 0.7f);
                }
                show(lines.get(i), font, size, MARGIN + indent);
            }
        }

        private void show(String text, PDType1Font font, float size, float x) throws IOException {
            stream.beginText();
            stream.setFont(font, size);
            stream.newLineAtOffset(x, y);
            stream.showText(text);
            stream.endText();
        }

        private void newPage() throws IOException {
            close();
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = page.getMediaBox().getHeight() - MARGIN;
        }

        void close() throws IOException {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }
    }
}
