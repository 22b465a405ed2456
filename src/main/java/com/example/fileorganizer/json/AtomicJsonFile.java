package com.example.fileorganizer.json;

import com.example.fileorganizer.exception.LogCorruptionException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * A JSON document on disk that is only ever replaced as a whole.
 *
 * <p>Writes go to a temporary file in the same directory, are forced to disk, and are then
 * renamed over the document, so readers see either the previous or the new content.
 */
public final class AtomicJsonFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(AtomicJsonFile.class);

    private final ObjectMapper mapper;
    private final Path path;

    public AtomicJsonFile(ObjectMapper mapper, Path path) {
        this.mapper = mapper;
        this.path = path.toAbsolutePath().normalize();
    }

    /**
     * Returns the parsed document, or empty if the file does not exist or is blank.
     *
     * @throws LogCorruptionException if the file exists but is not valid JSON of the given type
     */
    public <T> Optional<T> read(JavaType type) throws IOException {
        Optional<JsonNode> tree = readTree();
        if (tree.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.convertValue(tree.get(), type));
        } catch (IllegalArgumentException ex) {
            throw new LogCorruptionException(path, "unexpected document structure", ex);
        }
    }

    public <T> Optional<T> read(Class<T> type) throws IOException {
        return read(mapper.constructType(type));
    }

    /**
     * Returns the raw JSON tree, or empty if the file does not exist or is blank.
     */
    public Optional<JsonNode> readTree() throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        String content = Files.readString(path);
        if (content.isBlank()) {
            LOGGER.warn("Document {} is empty; treating it as absent.", path);
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(content));
        } catch (JsonProcessingException ex) {
            throw new LogCorruptionException(path, "malformed JSON", ex);
        }
    }

    /**
     * Replaces the document with the serialized value.
     */
    public void write(Object value) throws IOException {
        Path parent = path.getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, path.getFileName().toString() + ".", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
                 OutputStream out = Channels.newOutputStream(channel)) {
                mapper.writerWithDefaultPrettyPrinter()
                        .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                        .writeValue(out, value);
                out.flush();
                channel.force(true);
            }
            moveIntoPlace(temp);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public boolean exists() {
        return Files.exists(path);
    }

    public Path path() {
        return path;
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.warn("Atomic rename not supported for {}; falling back to a plain replace.", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
