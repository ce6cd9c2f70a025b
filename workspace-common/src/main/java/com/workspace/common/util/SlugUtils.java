package com.workspace.common.util;

public final class SlugUtils {

    public static final String FALLBACK_SLUG = "guide";
    public static final int MAX_SLUG_LENGTH = 80;

    private static final char SEPARATOR = '-';

    private SlugUtils() {}

    /**
     * Derives a filesystem-safe name from free text. Every character that is not a
     * letter or digit becomes a separator, separator runs collapse into one and
     * leading/trailing separators are dropped. Deterministic for equal input.
     */
    public static String slugify(String text) {
        if (text == null || text.isEmpty()) {
            return FALLBACK_SLUG;
        }

        StringBuilder slug = new StringBuilder(Math.min(text.length(), MAX_SLUG_LENGTH * 2));
        boolean pendingSeparator = false;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);

            if (Character.isLetterOrDigit(codePoint)) {
                if (pendingSeparator && slug.length() > 0) {
                    slug.append(SEPARATOR);
                }
                pendingSeparator = false;
                slug.appendCodePoint(Character.toLowerCase(codePoint));
            } else {
                pendingSeparator = true;
            }
        }

        if (slug.length() == 0) {
            return FALLBACK_SLUG;
        }
        return truncate(slug.toString());
    }

    private static String truncate(String slug) {
        if (slug.length() <= MAX_SLUG_LENGTH) {
            return slug;
        }
        String cut = slug.substring(0, MAX_SLUG_LENGTH);
        // Don't split a surrogate pair or leave a dangling separator
        if (Character.isHighSurrogate(cut.charAt(cut.length() - 1))) {
            cut = cut.substring(0, cut.length() - 1);
        }
        while (!cut.isEmpty() && cut.charAt(cut.length() - 1) == SEPARATOR) {
            cut = cut.substring(0, cut.length() - 1);
        }
        return cut.isEmpty() ? FALLBACK_SLUG : cut;
    }
}
