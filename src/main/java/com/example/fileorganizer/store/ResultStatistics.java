package com.example.fileorganizer.store;

import java.util.List;
import java.util.Map;

public record ResultStatistics(
        int total,
        int successCount,
        int failureCount,
        Map<String, Long> byOperation,
        Map<String, Long> byExtension,
        List<ResultEntry> recent
) {
    public ResultStatistics {
        byOperation = Map.copyOf(byOperation);
        byExtension = Map.copyOf(byExtension);
        recent = List.copyOf(recent);
    }
}
