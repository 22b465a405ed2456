package com.example.fileorganizer.transferlog;

import java.util.Map;

public record SessionSummary(
        SessionInfo info,
        Map<OperationKind, Long> operationsByKind,
        Map<String, Long> operationsByTargetFolder,
        long totalBytes,
        int pendingIntents
) {
    public SessionSummary {
        operationsByKind = Map.copyOf(operationsByKind);
        operationsByTargetFolder = Map.copyOf(operationsByTargetFolder);
    }
}
