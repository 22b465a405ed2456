package com.example.fileorganizer.transferlog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OperationKind {
    COPY("copy"),
    MOVE("move"),
    DELETE_DUPLICATE("delete_duplicate");

    private final String id;

    OperationKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static OperationKind fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Operation kind must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OperationKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operation kind: " + value);
    }
}
