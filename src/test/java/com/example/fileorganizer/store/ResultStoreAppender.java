package com.example.fileorganizer.store;

import com.example.fileorganizer.json.ObjectMappers;
import com.example.fileorganizer.model.ClassificationStatus;
import com.example.fileorganizer.model.FileRecord;
import com.example.fileorganizer.model.TimingBreakdown;
import com.example.fileorganizer.transferlog.OperationKind;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Appends numbered entries to a result store from its own JVM.
 * Arguments: store file, ready marker, name prefix, entry count.
 */
public final class ResultStoreAppender {
    private ResultStoreAppender() {
    }

    public static void main(String[] args) throws Exception {
        Path storeFile = Path.of(args[0]);
        Path readyMarker = Path.of(args[1]);
        String prefix = args[2];
        int count = Integer.parseInt(args[3]);

        ResultStore store = new ResultStore(storeFile, ObjectMappers.create());
        Files.writeString(readyMarker, "ready");
        for (int i = 0; i < count; i++) {
            if (!store.append(entry(prefix + "-" + i + ".txt"))) {
                System.exit(2);
            }
        }
    }

    static ResultEntry entry(String name) {
        Instant now = Instant.parse("2024-03-01T10:00:00Z");
        FileRecord metadata = new FileRecord("/in/" + name, name, FileRecord.extensionOf(name), 42, now, now);
        return new ResultEntry(name, "/in/" + name, "Docs", "/out/Docs/" + name, List.of("Docs"),
                "level 1: file name contains directory name Docs", "", ClassificationStatus.COMPLETE,
                OperationKind.COPY, ProcessingStatus.MIGRATED, true, null, TimingBreakdown.NONE, 0, now, metadata);
    }
}
