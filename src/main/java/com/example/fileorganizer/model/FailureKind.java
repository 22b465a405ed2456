package com.example.fileorganizer.model;

/**
 * Why a file could not be processed.
 */
public enum FailureKind {
    IO_ERROR,
    BACKEND_ERROR,
    CLASSIFICATION_FAILURE,
    COLLISION,
    LOG_CORRUPTION,
    TIMEOUT
}
