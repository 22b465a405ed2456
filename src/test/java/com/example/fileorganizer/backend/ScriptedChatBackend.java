package com.example.fileorganizer.backend;

import com.example.fileorganizer.exception.BackendException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-process backend answering from a script: summary prompts get {@code summary}, every
 * other prompt gets {@code answer}. Records the user prompts it received.
 */
public class ScriptedChatBackend implements ChatBackend {
    private final String summary;
    private final String answer;
    private final boolean failing;
    private final List<String> prompts = Collections.synchronizedList(new ArrayList<>());

    private ScriptedChatBackend(String summary, String answer, boolean failing) {
        this.summary = summary;
        this.answer = answer;
        this.failing = failing;
    }

    public static ScriptedChatBackend answering(String summary, String answer) {
        return new ScriptedChatBackend(summary, answer, false);
    }

    public static ScriptedChatBackend unreachable() {
        return new ScriptedChatBackend(null, null, true);
    }

    @Override
    public String chat(List<ChatMessage> messages) throws BackendException {
        String prompt = messages.get(messages.size() - 1).content();
        prompts.add(prompt);
        if (failing) {
            throw new BackendException(name(), "connection refused");
        }
        return prompt.startsWith("Summarize") ? summary : answer;
    }

    @Override
    public String name() {
        return "scripted";
    }

    public int calls() {
        return prompts.size();
    }

    public List<String> prompts() {
        synchronized (prompts) {
            return List.copyOf(prompts);
        }
    }
}
