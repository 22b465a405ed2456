package com.example.fileorganizer.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BackendKind {
    OLLAMA("ollama"),
    OPENAI_COMPATIBLE("openai");

    private final String id;

    BackendKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static BackendKind fromId(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "ollama":
                return OLLAMA;
            case "openai":
            case "openai_compatible":
            case "lmstudio":
            case "lm_studio":
            case "qwen":
                return OPENAI_COMPATIBLE;
            default:
                throw new IllegalArgumentException("Unknown backend kind: " + value);
        }
    }
}
