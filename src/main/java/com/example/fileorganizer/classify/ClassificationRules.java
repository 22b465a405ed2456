package com.example.fileorganizer.classify;

import com.example.fileorganizer.exception.LogCorruptionException;
import com.example.fileorganizer.json.AtomicJsonFile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User supplied descriptions of what belongs in a directory, keyed by directory name.
 */
public final class ClassificationRules {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClassificationRules.class);
    private static final ClassificationRules NONE = new ClassificationRules(Map.of());

    private final Map<String, String> rules;

    public ClassificationRules(Map<String, String> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static ClassificationRules none() {
        return NONE;
    }

    /**
     * Loads a JSON object of {@code "directory": "description"} pairs. A missing or blank
     * file yields no rules; a malformed one is reported and ignored.
     */
    public static ClassificationRules load(Path file, ObjectMapper mapper) {
        if (file == null) {
            return NONE;
        }
        AtomicJsonFile json = new AtomicJsonFile(mapper, file);
        try {
            JavaType type = mapper.getTypeFactory().constructType(new TypeReference<LinkedHashMap<String, String>>() {
            });
            Map<String, String> loaded = json.<Map<String, String>>read(type).orElse(Map.of());
            LOGGER.info("Loaded {} classification rules from {}", loaded.size(), file);
            return new ClassificationRules(loaded);
        } catch (LogCorruptionException e) {
            LOGGER.warn("Ignoring unreadable classification rules {}: {}", file, e.getMessage());
            return NONE;
        } catch (IOException e) {
            LOGGER.warn("Failed to read classification rules {}: {}", file, e.getMessage());
            return NONE;
        }
    }

    public int size() {
        return rules.size();
    }

    /**
     * Renders the rules that mention one of the candidates, one {@code name: description}
     * per line. Empty when none apply.
     */
    public String describe(List<String> candidates) {
        StringBuilder builder = new StringBuilder();
        for (String candidate : candidates) {
            String description = rules.get(candidate);
            if (description != null && !description.isBlank()) {
                builder.append(candidate).append(": ").append(description.strip()).append('\n');
            }
        }
        return builder.toString().strip();
    }
}
