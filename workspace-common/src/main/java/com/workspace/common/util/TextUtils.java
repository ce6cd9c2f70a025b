package com.workspace.common.util;

public final class TextUtils {

    private TextUtils() {}

    /**
     * Hard cut at {@code maxLength} characters, no ellipsis.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }
}
