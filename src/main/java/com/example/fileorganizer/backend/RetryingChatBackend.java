package com.example.fileorganizer.backend;

import com.example.fileorganizer.exception.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Retries a backend a bounded number of times with linear backoff between attempts.
 * When every attempt fails, the failures of the earlier attempts are attached to the thrown
 * exception as suppressed exceptions; nothing outlives the call.
 */
public class RetryingChatBackend implements ChatBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingChatBackend.class);

    private final ChatBackend delegate;
    private final int maxAttempts;
    private final Duration backoff;

    public RetryingChatBackend(ChatBackend delegate, int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    @Override
    public String chat(List<ChatMessage> messages) throws BackendException {
        List<BackendException> failures = new ArrayList<>(maxAttempts);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return delegate.chat(messages);
            } catch (BackendException ex) {
                failures.add(ex);
                LOGGER.warn("Backend {} failed (attempt {}/{}): {}", delegate.name(), attempt, maxAttempts, ex.getMessage());
                if (attempt < maxAttempts) {
                    pause(attempt);
                }
            }
        }
        BackendException last = failures.get(failures.size() - 1);
        BackendException exhausted = new BackendException(delegate.name(),
                "all " + maxAttempts + " attempts failed, last error: " + last.getMessage(), last);
        for (BackendException earlier : failures.subList(0, failures.size() - 1)) {
            exhausted.addSuppressed(earlier);
        }
        throw exhausted;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    private void pause(int attempt) throws BackendException {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.multipliedBy(attempt).toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BackendException(delegate.name(), "interrupted during retry backoff", ex);
        }
    }
}
