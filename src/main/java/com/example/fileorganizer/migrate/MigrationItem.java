package com.example.fileorganizer.migrate;

import com.example.fileorganizer.transferlog.OperationKind;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One planned copy or move of a source file into a target directory.
 *
 * @param targetFolder label recorded in the transfer log, usually the classified relative path
 */
public record MigrationItem(Path source, Path targetDirectory, OperationKind operation, String targetFolder) {
    public MigrationItem {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(targetDirectory, "targetDirectory");
        Objects.requireNonNull(operation, "operation");
        if (operation == OperationKind.DELETE_DUPLICATE) {
            throw new IllegalArgumentException("Migration items only copy or move");
        }
        if (targetFolder == null) {
            targetFolder = "";
        }
    }

    public MigrationItem(Path source, Path targetDirectory, OperationKind operation) {
        this(source, targetDirectory, operation, "");
    }
}
