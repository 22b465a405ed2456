package com.example.fileorganizer;

import com.example.fileorganizer.backend.BackendEndpoint;
import com.example.fileorganizer.backend.BackendKind;
import com.example.fileorganizer.transferlog.OperationKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {

    @Test
    void appliesDefaults() throws Exception {
        OrganizerConfig config = load("{\"sourceDirectories\": [\"/data/in\"]}");

        assertEquals(1, config.sourceDirectories().size());
        assertEquals(Optional.empty(), config.targetDirectory());
        assertEquals(Path.of("output"), config.outputDirectory());
        assertEquals(Path.of("output", "transfer_logs"), config.transferLogDirectory());
        assertEquals(Path.of("output", "organize_result.json"), config.resultStoreFile());
        assertEquals(OperationKind.COPY, config.operation());
        assertEquals(Duration.ofSeconds(180), config.fileTimeout());
        assertEquals(2000, config.contentExtractionLength());
        assertEquals(150, config.summaryLength());
        assertEquals(10, config.maxDepth());
        assertEquals(3, config.backendRetryAttempts());
        assertEquals(Duration.ofSeconds(1), config.backendRetryBackoff());
        assertFalse(config.followLinks());
        assertTrue(config.threadCount() >= 1);
        assertTrue(config.excludeFilePatterns().contains("Thumbs.db"));
        assertTrue(config.excludeDirectoryPatterns().contains("$RECYCLE.BIN"));
        assertTrue(config.backends().isEmpty());
    }

    @Test
    void readsBackendsAndOverrides() throws Exception {
        OrganizerConfig config = load("{"
                + "\"sourceDirectories\": [\"/data/in\"],"
                + "\"targetDirectory\": \"/data/sorted\","
                + "\"operation\": \"move\","
                + "\"threadCount\": 4,"
                + "\"maxFiles\": 50,"
                + "\"excludeFilePatterns\": [\"*.tmp\"],"
                + "\"backends\": ["
                + "  {\"baseUrl\": \"localhost:11434\", \"model\": \"qwen2.5:7b\"},"
                + "  {\"kind\": \"lmstudio\", \"name\": \"Studio\", \"baseUrl\": \"http://localhost:1234\","
                + "   \"model\": \"local-model\", \"priority\": 0, \"enabled\": false}"
                + "]}");

        assertEquals(Optional.of(Path.of("/data/sorted")), config.targetDirectory());
        assertEquals(OperationKind.MOVE, config.operation());
        assertEquals(4, config.threadCount());
        assertEquals(Optional.of(50), config.maxFiles());
        assertTrue(config.excludeFilePatterns().contains("*.tmp"));
        assertTrue(config.excludeFilePatterns().contains(".DS_Store"));

        BackendEndpoint ollama = config.backends().get(0);
        assertEquals("ollama-1", ollama.id());
        assertEquals(BackendKind.OLLAMA, ollama.kind());
        assertEquals(1, ollama.priority());
        assertTrue(ollama.enabled());
        assertEquals("http://localhost:11434", ollama.normalizedBaseUrl());

        BackendEndpoint studio = config.backends().get(1);
        assertEquals(BackendKind.OPENAI_COMPATIBLE, studio.kind());
        assertEquals("Studio", studio.name());
        assertEquals(0, studio.priority());
        assertFalse(studio.enabled());
    }

    @Test
    void rejectsUnknownOperation() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> load("{\"operation\": \"delete_duplicate\"}"));
        assertTrue(error.getMessage().contains("operation"));
    }

    @Test
    void rejectsBackendWithoutModel() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> load("{\"backends\": [{\"baseUrl\": \"http://localhost:11434\"}]}"));
        assertEquals("backends[0].model is required.", error.getMessage());
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> load("{\"maxDepth\": 0}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"fileTimeoutSeconds\": -5}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"maxFiles\": -1}"));
    }

    private static OrganizerConfig load(String json) throws Exception {
        Path file = Files.createTempDirectory("config").resolve("config.json");
        Files.writeString(file, json);
        return new ConfigLoader().load(file);
    }
}
