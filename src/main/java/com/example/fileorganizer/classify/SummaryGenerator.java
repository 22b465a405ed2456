package com.example.fileorganizer.classify;

import com.example.fileorganizer.backend.ChatBackend;
import com.example.fileorganizer.backend.ChatMessage;
import com.example.fileorganizer.backend.ResponseCleaner;
import com.example.fileorganizer.exception.BackendException;

import java.util.List;

/**
 * Asks the backend for a short summary of extracted file text.
 */
public class SummaryGenerator {
    static final int MIN_CONTENT_LENGTH = 10;
    private static final int PROMPT_CONTENT_LENGTH = 1000;
    private static final String SYSTEM_PROMPT =
            "You are a document summarization expert. Reply with the summary only, "
                    + "without reasoning, tags or explanations.";

    private final ChatBackend backend;
    private final int summaryLength;

    public SummaryGenerator(ChatBackend backend, int summaryLength) {
        this.backend = backend;
        this.summaryLength = summaryLength;
    }

    /**
     * Returns at most {@code summaryLength} characters, or an empty string without calling
     * the backend when the content is too short to summarize.
     */
    public String summarize(String fileName, String content) throws BackendException {
        if (content == null || content.strip().length() < MIN_CONTENT_LENGTH) {
            return "";
        }
        String excerpt = content.length() > PROMPT_CONTENT_LENGTH
                ? content.substring(0, PROMPT_CONTENT_LENGTH) + "..."
                : content;
        String prompt = "Summarize the following file content in at most " + summaryLength + " characters.\n\n"
                + "File name: " + fileName + "\n"
                + "File content:\n" + excerpt + "\n\n"
                + "Return only the summary.";
        String summary = ResponseCleaner.clean(backend.chat(List.of(
                ChatMessage.system(SYSTEM_PROMPT),
                ChatMessage.user(prompt))));
        return summary.length() > summaryLength ? summary.substring(0, summaryLength) : summary;
    }

    public int summaryLength() {
        return summaryLength;
    }
}
