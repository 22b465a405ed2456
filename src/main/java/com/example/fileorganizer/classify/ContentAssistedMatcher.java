package com.example.fileorganizer.classify;

import com.example.fileorganizer.backend.ChatBackend;
import com.example.fileorganizer.backend.ChatMessage;
import com.example.fileorganizer.backend.ResponseCleaner;
import com.example.fileorganizer.classify.ClassificationContext.Stage;
import com.example.fileorganizer.exception.BackendException;
import com.example.fileorganizer.extract.ContentExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Lets the backend choose a candidate from the file's summary. The answer has to name one
 * of the offered directories; anything else is rejected and the next matcher runs.
 */
public class ContentAssistedMatcher implements DirectoryMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContentAssistedMatcher.class);
    private static final String SYSTEM_PROMPT =
            "You are a file classification expert. Reply with one directory name only, "
                    + "without reasoning, tags, numbering or explanations.";

    private final ChatBackend backend;
    private final ContentExtractor extractor;
    private final SummaryGenerator summaries;
    private final ClassificationRules rules;
    private final int contentLength;

    public ContentAssistedMatcher(ChatBackend backend,
                                  ContentExtractor extractor,
                                  SummaryGenerator summaries,
                                  ClassificationRules rules,
                                  int contentLength) {
        this.backend = backend;
        this.extractor = extractor;
        this.summaries = summaries;
        this.rules = rules;
        this.contentLength = contentLength;
    }

    @Override
    public Optional<LevelMatch> tryMatch(MatchRequest request) {
        ClassificationContext context = request.context();
        if (context.backendDegraded()) {
            return Optional.empty();
        }
        ensureSummary(context);
        if (context.backendDegraded()) {
            return Optional.empty();
        }

        String answer;
        try {
            answer = ResponseCleaner.clean(backend.chat(List.of(
                    ChatMessage.system(SYSTEM_PROMPT),
                    ChatMessage.user(prompt(request)))));
        } catch (BackendException e) {
            degrade(context, e);
            return Optional.empty();
        }

        Optional<String> resolved = DirectoryNameResolver.resolve(answer, request.candidates());
        if (resolved.isEmpty()) {
            LOGGER.warn("Backend answer '{}' for {} is not one of {}; rejected",
                    answer, context.file().name(), request.candidates());
            return Optional.empty();
        }
        return Optional.of(new LevelMatch(resolved.get(),
                "content match: " + backend.name() + " chose " + resolved.get()));
    }

    @Override
    public String name() {
        return "content";
    }

    private void ensureSummary(ClassificationContext context) {
        if (context.hasSummary()) {
            return;
        }
        if (!context.hasContent()) {
            long start = System.currentTimeMillis();
            String content;
            try {
                content = extractor.extract(context.file().toPath(), contentLength);
            } catch (IOException e) {
                LOGGER.warn("Failed to extract content from {}: {}", context.file().path(), e.getMessage());
                content = "";
            }
            context.setContent(content);
            context.recordTiming(Stage.CONTENT_EXTRACTION, System.currentTimeMillis() - start);
        }
        long start = System.currentTimeMillis();
        try {
            context.setSummary(summaries.summarize(context.file().name(), context.content()));
        } catch (BackendException e) {
            context.setSummary("");
            degrade(context, e);
        } finally {
            context.recordTiming(Stage.SUMMARY, System.currentTimeMillis() - start);
        }
    }

    private void degrade(ClassificationContext context, BackendException e) {
        LOGGER.warn("Backend unavailable for {}, continuing with name heuristics: {}",
                context.file().name(), e.getMessage());
        context.markBackendDegraded(e.getMessage());
    }

    private String prompt(MatchRequest request) {
        ClassificationContext context = request.context();
        String summary = context.summary().isBlank() ? "no summary" : context.summary();
        StringBuilder prompt = new StringBuilder()
                .append("Choose the directory that best fits the file below.\n\n")
                .append("File name: ").append(context.file().name()).append('\n')
                .append("Extension: ").append(context.file().extension()).append('\n')
                .append("Summary: ").append(summary).append("\n\n")
                .append("Directories (answer with exactly one of these names, no numbering or punctuation):\n")
                .append(String.join("\n", request.candidates())).append('\n');
        String described = rules.describe(request.candidates());
        if (!described.isEmpty()) {
            prompt.append("\nClassification rules:\n").append(described).append('\n');
        }
        prompt.append("\nPriorities:\n")
                .append("1. A directory named after a year or month that appears in the file name\n")
                .append("2. A directory whose name appears in the file name\n")
                .append("3. A directory whose topic matches the file content\n")
                .append("4. A directory matching the file type\n\n")
                .append("Return only the directory name.");
        return prompt.toString();
    }
}
