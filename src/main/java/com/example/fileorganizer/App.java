package com.example.fileorganizer;

import com.example.fileorganizer.migrate.DuplicateReport;
import com.example.fileorganizer.store.ProcessingStatus;
import com.example.fileorganizer.transferlog.RestoreReport;
import com.example.fileorganizer.transferlog.RestoreStatus;
import com.example.fileorganizer.transferlog.SessionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = "Usage: java -jar file-organizer.jar <command> <config.json> [options]\n"
            + "  organize <config.json> [--dry-run] [--target <dir>]\n"
            + "  restore  <config.json> <session> [--dry-run] [--ids 1,2,3]\n"
            + "  sessions <config.json>\n"
            + "  dedupe   <config.json> <folder> [--dry-run]";

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
        String command = args[0];
        OrganizerConfig config = new ConfigLoader().load(Path.of(args[1]));
        List<String> options = new ArrayList<>(Arrays.asList(args).subList(2, args.length));
        boolean dryRun = options.remove("--dry-run");
        FileOrganizer organizer = new FileOrganizer(config);

        switch (command) {
            case "organize":
                organize(organizer, config, options, dryRun);
                break;
            case "restore":
                restore(organizer, options, dryRun);
                break;
            case "sessions":
                for (SessionInfo session : organizer.sessions()) {
                    LOGGER.info("{}  started {}  ended {}  {} operations ({} ok, {} failed)",
                            session.sessionName(), session.startTime(), session.endTime(),
                            session.totalOperations(), session.successfulOperations(), session.failedOperations());
                }
                break;
            case "dedupe":
                if (options.isEmpty()) {
                    LOGGER.error(USAGE);
                    System.exit(1);
                }
                DuplicateReport report = organizer.removeDuplicates(Path.of(options.get(0)), dryRun);
                LOGGER.info("{} duplicate groups, {} duplicates, {} deleted, {} bytes reclaimable",
                        report.groups().size(), report.duplicatesFound(), report.deleted().size(),
                        report.bytesReclaimable());
                break;
            default:
                LOGGER.error("Unknown command '{}'.\n{}", command, USAGE);
                System.exit(1);
        }
    }

    private static void organize(FileOrganizer organizer, OrganizerConfig config, List<String> options, boolean dryRun)
            throws Exception {
        Path target = optionValue(options, "--target")
                .map(Path::of)
                .orElseGet(() -> config.targetDirectory()
                        .orElseThrow(() -> new IllegalArgumentException(
                                "A target directory is required (--target or targetDirectory).")));
        if (config.sourceDirectories().isEmpty()) {
            throw new IllegalArgumentException("Config must include at least one source directory.");
        }
        OrganizeReport report = organizer.organize(organizer.scan(), target, dryRun);
        for (FileOutcome outcome : report.outcomes()) {
            if (!outcome.isSuccess() && outcome.status() != ProcessingStatus.SKIPPED) {
                LOGGER.warn("{}: {} ({})", outcome.file().path(), outcome.status(), outcome.message());
            }
        }
        if (report.failureCount() > 0) {
            System.exit(2);
        }
    }

    private static void restore(FileOrganizer organizer, List<String> options, boolean dryRun) throws Exception {
        List<Long> ids = optionValue(options, "--ids")
                .map(value -> Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(id -> !id.isEmpty())
                        .map(Long::valueOf)
                        .toList())
                .orElse(List.of());
        if (options.isEmpty()) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
        RestoreReport report = organizer.restore(options.get(0), ids, dryRun);
        report.details().stream()
                .filter(detail -> detail.status() == RestoreStatus.FAILED || detail.status() == RestoreStatus.SKIPPED)
                .forEach(detail -> LOGGER.warn("{}: {} ({})", detail.sourcePath(), detail.status(), detail.message()));
        if (!report.isClean()) {
            System.exit(2);
        }
    }

    // removes the option and its value from the list
    private static Optional<String> optionValue(List<String> options, String name) {
        int index = options.indexOf(name);
        if (index < 0 || index + 1 >= options.size()) {
            return Optional.empty();
        }
        String value = options.remove(index + 1);
        options.remove(index);
        return Optional.of(value);
    }
}
