package com.example.fileorganizer.backend;

import java.util.regex.Pattern;

/**
 * Strips reasoning traces and filler that some models prepend to their answer.
 */
public final class ResponseCleaner {
    private static final Pattern THINK_BLOCK = Pattern.compile("<think>.*?</think>", Pattern.DOTALL);
    private static final Pattern UNCLOSED_THINK = Pattern.compile("^.*?</think>", Pattern.DOTALL);
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n");

    private ResponseCleaner() {
    }

    public static String clean(String response) {
        if (response == null) {
            return "";
        }
        String cleaned = THINK_BLOCK.matcher(response).replaceAll("");
        cleaned = UNCLOSED_THINK.matcher(cleaned).replaceFirst("");
        cleaned = BLANK_LINES.matcher(cleaned).replaceAll("\n");
        return cleaned.strip();
    }
}
