package com.judgmentbell.common.verdict;

import java.util.Locale;
import java.util.Optional;

/** Text clean-up shared by the response parsers. */
final class ResponseText {

    private ResponseText() {}

    /** Removes code fences and a leading {@code json} language marker. */
    static String stripMarkup(String text) {
        String cleaned = text.trim();
        int fence = cleaned.indexOf("```");
        if (fence >= 0) {
            int close = cleaned.indexOf("```", fence + 3);
            cleaned = close > fence
                ? cleaned.substring(fence + 3, close)
                : cleaned.substring(fence + 3);
        }
        cleaned = cleaned.trim();
        if (cleaned.toLowerCase(Locale.ROOT).startsWith("json")) {
            cleaned = cleaned.substring(4).trim();
        }
        return cleaned;
    }

    /** The outermost {@code {...}} span, if any. */
    static Optional<String> embeddedObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) return Optional.empty();
        return Optional.of(text.substring(start, end + 1));
    }

    static String excerpt(String text, int maxLength) {
        if (text == null) return "";
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= maxLength ? flat : flat.substring(0, maxLength);
    }
}
