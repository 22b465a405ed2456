package com.example.fileorganizer.backend;

import com.example.fileorganizer.exception.BackendException;

import java.util.List;

/**
 * A summarization/classification service reachable over a synchronous call.
 */
public interface ChatBackend {
    /**
     * Sends the messages and returns the trimmed, non-empty text answer.
     */
    String chat(List<ChatMessage> messages) throws BackendException;

    String name();
}
