package com.example.fileorganizer.backend;

import com.example.fileorganizer.json.ObjectMappers;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatBackendsTest {

    @Test
    void buildsChainFromEnabledEndpointsByPriority() {
        List<BackendEndpoint> endpoints = List.of(
                new BackendEndpoint("cloud", "Cloud", BackendKind.OPENAI_COMPATIBLE, "https://api.example.com/v1",
                        "gpt-4o-mini", "key", 2, true),
                new BackendEndpoint("local", "Local", BackendKind.OLLAMA, "localhost:11434", "llama3", null, 1, true),
                new BackendEndpoint("off", "Off", BackendKind.OLLAMA, "localhost:11435", "llama3", null, 0, false)
        );

        Optional<ChatBackend> chain = ChatBackends.fromEndpoints(endpoints, 3, Duration.ZERO, Duration.ofSeconds(5),
                ObjectMappers.create());

        assertTrue(chain.isPresent());
        FailoverChatBackend failover = assertInstanceOf(FailoverChatBackend.class, chain.get());
        assertEquals(2, failover.backends().size());
        assertEquals("Local", failover.backends().get(0).name());
        assertEquals("Cloud", failover.backends().get(1).name());
    }

    @Test
    void noEnabledEndpointMeansNoBackend() {
        assertTrue(ChatBackends.fromEndpoints(List.of(), 3, Duration.ZERO, Duration.ofSeconds(5),
                ObjectMappers.create()).isEmpty());
    }

    @Test
    void acceptsKindAliases() {
        assertEquals(BackendKind.OPENAI_COMPATIBLE, BackendKind.fromId("LM_Studio"));
        assertEquals(BackendKind.OLLAMA, BackendKind.fromId(" ollama "));
    }
}
