package com.example.fileorganizer.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * {@code POST /chat/completions} as served by OpenAI-compatible APIs and LM Studio.
 */
public class OpenAiCompatibleChatBackend extends HttpChatBackend {

    public OpenAiCompatibleChatBackend(BackendEndpoint endpoint, HttpClient client, ObjectMapper mapper, Duration requestTimeout) {
        super(endpoint, client, mapper, requestTimeout);
    }

    @Override
    protected URI endpointUri() {
        return URI.create(endpoint.normalizedBaseUrl() + "/chat/completions");
    }

    @Override
    protected ObjectNode payload(List<ChatMessage> messages) {
        ObjectNode payload = messagesPayload(messages);
        // Qwen models emit reasoning traces unless told otherwise.
        if (endpoint.model() != null && endpoint.model().toLowerCase(Locale.ROOT).contains("qwen")) {
            payload.put("enable_thinking", false);
        }
        return payload;
    }

    @Override
    protected String content(JsonNode root) {
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return null;
        }
        JsonNode content = choices.get(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
