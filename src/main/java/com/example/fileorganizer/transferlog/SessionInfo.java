package com.example.fileorganizer.transferlog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SessionInfo(
        @JsonProperty("session_name") String sessionName,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("total_operations") int totalOperations,
        @JsonProperty("successful_operations") int successfulOperations,
        @JsonProperty("failed_operations") int failedOperations
) {
    static SessionInfo opened(String name, Instant startTime) {
        return new SessionInfo(name, startTime, null, 0, 0, 0);
    }

    SessionInfo count(boolean success) {
        return new SessionInfo(sessionName, startTime, endTime,
                totalOperations + 1,
                successfulOperations + (success ? 1 : 0),
                failedOperations + (success ? 0 : 1));
    }

    SessionInfo ended(Instant at) {
        return new SessionInfo(sessionName, startTime, at, totalOperations, successfulOperations, failedOperations);
    }

    @JsonIgnore
    public boolean isEnded() {
        return endTime != null;
    }
}
