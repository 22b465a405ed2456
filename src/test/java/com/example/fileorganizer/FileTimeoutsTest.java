package com.example.fileorganizer;

import com.example.fileorganizer.exception.ClassificationTimeoutException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileTimeoutsTest {

    @Test
    void returnsTheResultWithinTheDeadline() throws Exception {
        assertEquals("done", FileTimeouts.call("quick", Duration.ofSeconds(5), () -> "done"));
        assertEquals("direct", FileTimeouts.call("unbounded", Duration.ZERO, () -> "direct"));
    }

    @Test
    void propagatesIoErrors() {
        IOException error = assertThrows(IOException.class, () -> FileTimeouts.call("failing", Duration.ofSeconds(5),
                () -> {
                    throw new IOException("disk gone");
                }));
        assertEquals("disk gone", error.getMessage());
    }

    @Test
    void throwsWhenTheDeadlinePasses() {
        assertThrows(ClassificationTimeoutException.class, () -> FileTimeouts.call("slow", Duration.ofMillis(50),
                () -> {
                    try {
                        Thread.sleep(1_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }));
    }
}
