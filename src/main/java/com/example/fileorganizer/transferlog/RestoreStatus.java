package com.example.fileorganizer.transferlog;

public enum RestoreStatus {
    RESTORED,
    ALREADY_INTACT,
    WOULD_RESTORE,
    SKIPPED,
    FAILED
}
