package com.example.fileorganizer.backend;

import com.example.fileorganizer.exception.BackendException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Shared request/response plumbing for JSON chat endpoints. One call is one HTTP request;
 * retries belong to {@link RetryingChatBackend}.
 */
abstract class HttpChatBackend implements ChatBackend {
    protected final BackendEndpoint endpoint;
    protected final ObjectMapper mapper;
    private final HttpClient client;
    private final Duration requestTimeout;

    HttpChatBackend(BackendEndpoint endpoint, HttpClient client, ObjectMapper mapper, Duration requestTimeout) {
        this.endpoint = endpoint;
        this.client = client;
        this.mapper = mapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String chat(List<ChatMessage> messages) throws BackendException {
        String body;
        try {
            body = mapper.writeValueAsString(payload(messages));
        } catch (JsonProcessingException ex) {
            throw new BackendException(name(), "could not encode request", ex);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(endpointUri())
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (endpoint.apiKey() != null && !endpoint.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + endpoint.apiKey());
        }
        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException ex) {
            throw new BackendException(name(), "request timed out after " + requestTimeout.toMillis() + " ms", ex);
        } catch (IOException ex) {
            throw new BackendException(name(), "unreachable at " + endpoint.normalizedBaseUrl(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BackendException(name(), "interrupted", ex);
        }
        if (response.statusCode() / 100 != 2) {
            throw new BackendException(name(), "HTTP " + response.statusCode() + ": " + abbreviate(response.body()));
        }
        JsonNode root;
        try {
            root = mapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            throw new BackendException(name(), "response is not JSON", ex);
        }
        String content = content(root);
        if (content == null || content.isBlank()) {
            throw new BackendException(name(), "empty response content");
        }
        return content.strip();
    }

    @Override
    public String name() {
        return endpoint.name() == null || endpoint.name().isBlank() ? endpoint.id() : endpoint.name();
    }

    protected ObjectNode messagesPayload(List<ChatMessage> messages) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.model());
        payload.set("messages", mapper.valueToTree(messages));
        return payload;
    }

    protected abstract URI endpointUri();

    protected abstract ObjectNode payload(List<ChatMessage> messages);

    /**
     * Returns the answer text from the parsed response, or null if the shape is unexpected.
     */
    protected abstract String content(JsonNode root);

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
