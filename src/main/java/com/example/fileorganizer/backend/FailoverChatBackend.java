package com.example.fileorganizer.backend;

import com.example.fileorganizer.exception.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tries equivalent backends in priority order until one answers.
 */
public class FailoverChatBackend implements ChatBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(FailoverChatBackend.class);

    private final List<ChatBackend> backends;

    public FailoverChatBackend(List<ChatBackend> backends) {
        this.backends = List.copyOf(backends);
    }

    @Override
    public String chat(List<ChatMessage> messages) throws BackendException {
        if (backends.isEmpty()) {
            throw new BackendException(name(), "no backend configured");
        }
        BackendException last = null;
        for (ChatBackend backend : backends) {
            try {
                String answer = backend.chat(messages);
                LOGGER.debug("Backend {} answered", backend.name());
                return answer;
            } catch (BackendException ex) {
                last = ex;
                LOGGER.warn("Backend {} unavailable, trying next: {}", backend.name(), ex.getMessage());
            }
        }
        throw new BackendException(name(), "all " + backends.size() + " backends failed", last);
    }

    @Override
    public String name() {
        return "failover";
    }

    public List<ChatBackend> backends() {
        return backends;
    }
}
