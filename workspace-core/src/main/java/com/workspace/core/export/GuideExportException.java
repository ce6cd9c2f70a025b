package com.workspace.core.export;

/**
 * The primary markdown write failed; the study guide cannot be delivered.
 */
public class GuideExportException extends RuntimeException {

    public GuideExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
