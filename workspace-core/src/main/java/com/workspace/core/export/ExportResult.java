package com.workspace.core.export;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExportResult {
    private String slug;
    private String markdownPath;
    private String markdownUrl;
    private String pdfPath; // null when rendering failed
    private String pdfUrl;  // null when rendering failed

    public boolean hasPdf() {
        return pdfPath != null;
    }
}
