package com.example.fileorganizer.backend;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Builds the backend chain from configured endpoints.
 */
public final class ChatBackends {
    private ChatBackends() {
    }

    /**
     * Returns a failover chain over the enabled endpoints, sorted by priority, each wrapped in
     * bounded retries. Empty when no endpoint is enabled.
     */
    public static Optional<ChatBackend> fromEndpoints(List<BackendEndpoint> endpoints,
                                                      int retryAttempts,
                                                      Duration retryBackoff,
                                                      Duration requestTimeout,
                                                      ObjectMapper mapper) {
        List<BackendEndpoint> enabled = endpoints.stream()
                .filter(BackendEndpoint::enabled)
                .sorted(Comparator.comparingInt(BackendEndpoint::priority))
                .toList();
        if (enabled.isEmpty()) {
            return Optional.empty();
        }
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        List<ChatBackend> chain = enabled.stream()
                .map(endpoint -> (ChatBackend) new RetryingChatBackend(
                        create(endpoint, client, mapper, requestTimeout), retryAttempts, retryBackoff))
                .toList();
        return Optional.of(new FailoverChatBackend(chain));
    }

    static ChatBackend create(BackendEndpoint endpoint, HttpClient client, ObjectMapper mapper, Duration requestTimeout) {
        switch (endpoint.kind()) {
            case OLLAMA:
                return new OllamaChatBackend(endpoint, client, mapper, requestTimeout);
            case OPENAI_COMPATIBLE:
                return new OpenAiCompatibleChatBackend(endpoint, client, mapper, requestTimeout);
            default:
                throw new IllegalArgumentException("Unsupported backend kind: " + endpoint.kind());
        }
    }
}
