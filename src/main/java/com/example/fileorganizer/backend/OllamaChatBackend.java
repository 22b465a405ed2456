package com.example.fileorganizer.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

/**
 * Ollama's native chat API: {@code POST /api/chat} without streaming.
 */
public class OllamaChatBackend extends HttpChatBackend {

    public OllamaChatBackend(BackendEndpoint endpoint, HttpClient client, ObjectMapper mapper, Duration requestTimeout) {
        super(endpoint, client, mapper, requestTimeout);
    }

    @Override
    protected URI endpointUri() {
        return URI.create(endpoint.normalizedBaseUrl() + "/api/chat");
    }

    @Override
    protected ObjectNode payload(List<ChatMessage> messages) {
        ObjectNode payload = messagesPayload(messages);
        payload.put("stream", false);
        return payload;
    }

    @Override
    protected String content(JsonNode root) {
        JsonNode message = root.path("message");
        return message.path("content").isTextual() ? message.get("content").asText() : null;
    }
}
