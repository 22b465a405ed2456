package com.example.fileorganizer.extract;

import com.example.fileorganizer.model.FileRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

public class FileRecordReader {
    private final boolean followLinks;

    public FileRecordReader() {
        this(true);
    }

    public FileRecordReader(boolean followLinks) {
        this.followLinks = followLinks;
    }

    public FileRecord read(Path path) throws IOException {
        LinkOption[] linkOptions = followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        Path absolute = path.toAbsolutePath().normalize();
        BasicFileAttributes attributes = Files.readAttributes(absolute, BasicFileAttributes.class, linkOptions);
        if (!attributes.isRegularFile()) {
            throw new IOException("Not a regular file: " + absolute);
        }
        String name = absolute.getFileName().toString();
        return new FileRecord(
                absolute.toString(),
                name,
                FileRecord.extensionOf(name),
                attributes.size(),
                attributes.creationTime().toInstant(),
                attributes.lastModifiedTime().toInstant()
        );
    }
}
