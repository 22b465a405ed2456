package com.example.fileorganizer;

import com.example.fileorganizer.backend.BackendEndpoint;
import com.example.fileorganizer.backend.BackendKind;
import com.example.fileorganizer.json.ObjectMappers;
import com.example.fileorganizer.transferlog.OperationKind;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ConfigLoader {
    private static final int DEFAULT_FILE_TIMEOUT_SECONDS = 180;
    private static final int DEFAULT_CONTENT_EXTRACTION_LENGTH = 2000;
    private static final int DEFAULT_SUMMARY_LENGTH = 150;
    private static final int DEFAULT_MAX_DEPTH = 10;
    private static final int DEFAULT_BACKEND_RETRY_ATTEMPTS = 3;
    private static final long DEFAULT_BACKEND_RETRY_BACKOFF_MILLIS = 1000;
    private static final int DEFAULT_BACKEND_REQUEST_TIMEOUT_SECONDS = 30;
    private static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            ".DS_Store",
            "pagefile.sys",
            "hiberfil.sys",
            "swapfile.sys"
    );
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = ObjectMappers.create();
    }

    public OrganizerConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        List<Path> sourceDirectories = raw.sourceDirectories == null
                ? List.of()
                : raw.sourceDirectories.stream().filter(value -> value != null && !value.isBlank()).map(Path::of).toList();
        Optional<Path> targetDirectory = Optional.ofNullable(raw.targetDirectory)
                .filter(value -> !value.isBlank())
                .map(Path::of);

        Path outputDirectory = Path.of(optionalString(raw.outputDirectory, "output"));
        Path transferLogDirectory = Optional.ofNullable(raw.transferLogDirectory)
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .orElse(outputDirectory.resolve("transfer_logs"));
        Path resultStoreFile = Optional.ofNullable(raw.resultStoreFile)
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .orElse(outputDirectory.resolve("organize_result.json"));
        Optional<Path> rulesFile = Optional.ofNullable(raw.classificationRulesFile)
                .filter(value -> !value.isBlank())
                .map(Path::of);

        OperationKind operation = parseOperation(raw.operation);
        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        int fileTimeoutSeconds = positive("fileTimeoutSeconds", raw.fileTimeoutSeconds, DEFAULT_FILE_TIMEOUT_SECONDS);
        int contentLength = positive("contentExtractionLength", raw.contentExtractionLength,
                DEFAULT_CONTENT_EXTRACTION_LENGTH);
        int summaryLength = positive("summaryLength", raw.summaryLength, DEFAULT_SUMMARY_LENGTH);
        int maxDepth = positive("maxDepth", raw.maxDepth, DEFAULT_MAX_DEPTH);
        int retryAttempts = positive("backendRetryAttempts", raw.backendRetryAttempts, DEFAULT_BACKEND_RETRY_ATTEMPTS);
        long retryBackoffMillis = raw.backendRetryBackoffMillis == null
                ? DEFAULT_BACKEND_RETRY_BACKOFF_MILLIS
                : raw.backendRetryBackoffMillis;
        if (retryBackoffMillis < 0) {
            throw new IllegalArgumentException("backendRetryBackoffMillis must not be negative.");
        }
        int requestTimeoutSeconds = positive("backendRequestTimeoutSeconds", raw.backendRequestTimeoutSeconds,
                DEFAULT_BACKEND_REQUEST_TIMEOUT_SECONDS);
        boolean followLinks = raw.followLinks != null && raw.followLinks;
        Optional<Integer> maxFiles = Optional.ofNullable(raw.maxFiles);
        if (maxFiles.isPresent() && maxFiles.get() < 0) {
            throw new IllegalArgumentException("maxFiles must not be negative.");
        }

        List<String> excludeFilePatterns = mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFilePatterns);
        List<String> excludeDirectoryPatterns = mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns);

        return new OrganizerConfig(
                sourceDirectories,
                targetDirectory,
                outputDirectory,
                transferLogDirectory,
                resultStoreFile,
                rulesFile,
                operation,
                threadCount,
                Duration.ofSeconds(fileTimeoutSeconds),
                contentLength,
                summaryLength,
                maxDepth,
                retryAttempts,
                Duration.ofMillis(retryBackoffMillis),
                Duration.ofSeconds(requestTimeoutSeconds),
                followLinks,
                maxFiles,
                excludeFilePatterns,
                excludeDirectoryPatterns,
                backends(raw.backends)
        );
    }

    private OperationKind parseOperation(String value) {
        if (value == null || value.isBlank()) {
            return OperationKind.COPY;
        }
        OperationKind kind;
        try {
            kind = OperationKind.fromId(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("operation must be 'copy' or 'move', got '" + value + "'.", e);
        }
        if (kind == OperationKind.DELETE_DUPLICATE) {
            throw new IllegalArgumentException("operation must be 'copy' or 'move', got '" + value + "'.");
        }
        return kind;
    }

    private List<BackendEndpoint> backends(List<RawBackend> raw) {
        if (raw == null) {
            return List.of();
        }
        List<BackendEndpoint> endpoints = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            RawBackend backend = raw.get(i);
            if (backend == null) {
                continue;
            }
            String key = "backends[" + i + "]";
            if (backend.baseUrl == null || backend.baseUrl.isBlank()) {
                throw new IllegalArgumentException(key + ".baseUrl is required.");
            }
            if (backend.model == null || backend.model.isBlank()) {
                throw new IllegalArgumentException(key + ".model is required.");
            }
            BackendKind kind;
            try {
                kind = backend.kind == null || backend.kind.isBlank()
                        ? BackendKind.OLLAMA
                        : BackendKind.fromId(backend.kind);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(key + ".kind: " + e.getMessage(), e);
            }
            String id = optionalString(backend.id, kind.id() + "-" + (i + 1));
            endpoints.add(new BackendEndpoint(
                    id,
                    optionalString(backend.name, id),
                    kind,
                    backend.baseUrl,
                    backend.model,
                    backend.apiKey == null || backend.apiKey.isBlank() ? null : backend.apiKey,
                    backend.priority == null ? i + 1 : backend.priority,
                    backend.enabled == null || backend.enabled
            ));
        }
        return List.copyOf(endpoints);
    }

    private int positive(String key, Integer value, int fallback) {
        if (value == null) {
            return fallback;
        }
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive.");
        }
        return value;
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public List<String> sourceDirectories = new ArrayList<>();
        public String targetDirectory;
        public String outputDirectory;
        public String transferLogDirectory;
        public String resultStoreFile;
        public String classificationRulesFile;
        public String operation;
        public Integer threadCount;
        public Integer fileTimeoutSeconds;
        public Integer contentExtractionLength;
        public Integer summaryLength;
        public Integer maxDepth;
        public Integer backendRetryAttempts;
        public Long backendRetryBackoffMillis;
        public Integer backendRequestTimeoutSeconds;
        public Boolean followLinks;
        public Integer maxFiles;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
        public List<RawBackend> backends;
    }

    private static class RawBackend {
        public String id;
        public String name;
        public String kind;
        public String baseUrl;
        public String model;
        public String apiKey;
        public Integer priority;
        public Boolean enabled;
    }
}
