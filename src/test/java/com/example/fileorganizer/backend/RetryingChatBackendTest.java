package com.example.fileorganizer.backend;

import com.example.fileorganizer.exception.BackendException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryingChatBackendTest {

    @Test
    void retriesUntilTheDelegateAnswers() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ChatBackend flaky = new ChatBackend() {
            @Override
            public String chat(List<ChatMessage> messages) throws BackendException {
                if (calls.incrementAndGet() < 3) {
                    throw new BackendException("flaky", "busy");
                }
                return "Finance";
            }

            @Override
            public String name() {
                return "flaky";
            }
        };
        RetryingChatBackend retrying = new RetryingChatBackend(flaky, 3, Duration.ZERO);

        assertEquals("Finance", retrying.chat(List.of(ChatMessage.user("pick"))));
        assertEquals(3, calls.get());
    }

    @Test
    void givesUpAfterTheAttemptBudget() {
        ScriptedChatBackend down = ScriptedChatBackend.unreachable();
        RetryingChatBackend retrying = new RetryingChatBackend(down, 3, Duration.ZERO);

        BackendException ex = assertThrows(BackendException.class,
                () -> retrying.chat(List.of(ChatMessage.user("pick"))));
        assertEquals(3, down.calls());
        assertTrue(ex.getMessage().contains("all 3 attempts failed"));
        assertTrue(ex.getMessage().contains("connection refused"));
        assertEquals(2, ex.getSuppressed().length);
    }

    @Test
    void failuresAreNotCarriedIntoLaterCalls() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ChatBackend downThenUp = new ChatBackend() {
            @Override
            public String chat(List<ChatMessage> messages) throws BackendException {
                if (calls.incrementAndGet() <= 2) {
                    throw new BackendException("recovering", "busy");
                }
                return "Legal";
            }

            @Override
            public String name() {
                return "recovering";
            }
        };
        RetryingChatBackend retrying = new RetryingChatBackend(downThenUp, 2, Duration.ZERO);

        BackendException first = assertThrows(BackendException.class,
                () -> retrying.chat(List.of(ChatMessage.user("pick"))));
        assertEquals(1, first.getSuppressed().length);
        assertEquals("Legal", retrying.chat(List.of(ChatMessage.user("pick"))));
        assertEquals("Legal", retrying.chat(List.of(ChatMessage.user("pick"))));
        assertEquals(4, calls.get());
    }

    @Test
    void failoverUsesTheNextBackendInOrder() throws Exception {
        ScriptedChatBackend down = ScriptedChatBackend.unreachable();
        ScriptedChatBackend up = ScriptedChatBackend.answering("summary", "Legal");
        FailoverChatBackend failover = new FailoverChatBackend(List.of(down, up));

        assertEquals("Legal", failover.chat(List.of(ChatMessage.user("pick"))));
        assertEquals(1, down.calls());
        assertEquals(1, up.calls());
    }

    @Test
    void failoverRaisesWhenEveryBackendFails() {
        FailoverChatBackend failover = new FailoverChatBackend(
                List.of(ScriptedChatBackend.unreachable(), ScriptedChatBackend.unreachable()));

        assertThrows(BackendException.class, () -> failover.chat(List.of(ChatMessage.user("pick"))));
    }
}
