package com.example.fileorganizer.transferlog;

import java.util.List;

public record RestoreReport(String sessionName, boolean dryRun, List<RestoreDetail> details) {
    public RestoreReport {
        details = List.copyOf(details);
    }

    public long count(RestoreStatus status) {
        return details.stream().filter(detail -> detail.status() == status).count();
    }

    public int total() {
        return details.size();
    }

    /**
     * True when every selected operation is back in place or needed nothing.
     */
    public boolean isClean() {
        return count(RestoreStatus.FAILED) == 0;
    }
}
