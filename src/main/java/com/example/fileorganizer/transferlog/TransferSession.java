package com.example.fileorganizer.transferlog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The on-disk session document: header, appended operations and outstanding intents.
 */
public record TransferSession(
        @JsonProperty("session_info") SessionInfo info,
        @JsonProperty("operations") List<TransferOperation> operations,
        @JsonProperty("pending") List<PendingTransfer> pending
) {
    public TransferSession {
        operations = operations == null ? List.of() : List.copyOf(operations);
        pending = pending == null ? List.of() : List.copyOf(pending);
    }

    static TransferSession empty(SessionInfo info) {
        return new TransferSession(info, List.of(), List.of());
    }

    long nextOperationId() {
        long max = 0;
        for (TransferOperation operation : operations) {
            max = Math.max(max, operation.operationId());
        }
        return max + 1;
    }

    TransferSession withPending(PendingTransfer intent) {
        List<PendingTransfer> updated = new ArrayList<>(pending);
        updated.add(intent);
        return new TransferSession(info, operations, updated);
    }

    TransferSession withOperation(TransferOperation operation, String clearedIntentId) {
        List<TransferOperation> updatedOperations = new ArrayList<>(operations);
        updatedOperations.add(operation);
        List<PendingTransfer> updatedPending = new ArrayList<>(pending);
        if (clearedIntentId != null) {
            updatedPending.removeIf(intent -> clearedIntentId.equals(intent.intentId()));
        }
        return new TransferSession(info.count(operation.success()), updatedOperations, updatedPending);
    }

    TransferSession withInfo(SessionInfo updated) {
        return new TransferSession(updated, operations, pending);
    }

    public Optional<TransferOperation> operation(long id) {
        return operations.stream().filter(operation -> operation.operationId() == id).findFirst();
    }
}
