package com.workspace.core.export;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Durable store for exported study guides, addressed by slug-derived file names.
 * Local filesystem for now (can be extended to object storage).
 */
public interface GuideStorageService {

    /**
     * Write text content under the given file name, replacing any previous file.
     */
    Path writeText(String fileName, String content) throws IOException;

    /**
     * Location a binary artifact with this name should be written to.
     * The parent directory exists when this returns.
     */
    Path resolve(String fileName) throws IOException;

    /**
     * Public URL the transport layer serves the stored file under.
     */
    String publicUrl(String fileName);
}
