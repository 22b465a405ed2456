package com.example.fileorganizer.migrate;

import com.example.fileorganizer.exception.CollisionException;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Finds a free file name in a target directory: the original name, then
 * {@code name_yyyyMMdd_HHmmss.ext} from the source's modification time, then
 * {@code name_yyyyMMdd_HHmmss_2.ext} and so on.
 */
public class CollisionResolver {
    static final int MAX_ATTEMPTS = 100;
    private static final DateTimeFormatter SUFFIX_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final TargetReservations reservations;
    private final ZoneId zone;

    public CollisionResolver(TargetReservations reservations) {
        this(reservations, ZoneId.systemDefault());
    }

    public CollisionResolver(TargetReservations reservations, ZoneId zone) {
        this.reservations = reservations;
        this.zone = zone;
    }

    /**
     * Returns a target path that neither exists nor is reserved, and reserves it.
     */
    public Path resolve(Path targetDirectory, String fileName, Instant modifiedTime) throws CollisionException {
        Path target = targetDirectory.resolve(fileName);
        if (claim(target)) {
            return target;
        }
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        String stamp = SUFFIX_FORMAT.format((modifiedTime == null ? Instant.EPOCH : modifiedTime).atZone(zone));
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String suffix = attempt == 1 ? "_" + stamp : "_" + stamp + "_" + attempt;
            Path candidate = targetDirectory.resolve(base + suffix + extension);
            if (claim(candidate)) {
                return candidate;
            }
        }
        throw new CollisionException(targetDirectory, fileName, MAX_ATTEMPTS);
    }

    private boolean claim(Path candidate) {
        if (Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        return reservations.reserve(candidate);
    }
}
