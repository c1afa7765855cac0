package com.phillippitts.hybridinference.util;

/** Utility for privacy-safe logging of prompt previews. */
public final class LogSanitizer {

    /** Default preview length for prompts in log lines. */
    public static final int PROMPT_PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of a prompt with its full length, e.g. {@code "Summarize the..." (312 chars)}.
     */
    public static String preview(String prompt) {
        if (prompt == null) {
            return "<null>";
        }
        String flat = truncate(prompt, PROMPT_PREVIEW_CHARS).replace('\n', ' ').replace('\r', ' ');
        String ellipsis = prompt.length() > PROMPT_PREVIEW_CHARS ? "..." : "";
        return '"' + flat + ellipsis + "\" (" + prompt.length() + " chars)";
    }
}
