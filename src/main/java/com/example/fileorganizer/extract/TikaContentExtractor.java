package com.example.fileorganizer.extract;

import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts text from plain text, PDF and office documents through Apache Tika.
 */
public class TikaContentExtractor implements ContentExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(TikaContentExtractor.class);

    private final Tika tika;

    public TikaContentExtractor(Tika tika) {
        this.tika = tika;
    }

    @Override
    public String extract(Path path, int maxLength) throws IOException {
        if (maxLength <= 0) {
            return "";
        }
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, path.getFileName().toString());
        try (TikaInputStream stream = TikaInputStream.get(path, metadata)) {
            String text = tika.parseToString(stream, metadata, maxLength);
            return text.length() > maxLength ? text.substring(0, maxLength) : text;
        } catch (TikaException ex) {
            LOGGER.warn("Tika could not parse {} ({})", path, detectMimeType(path), ex);
            return "";
        }
    }

    /**
     * Returns the detected media type, or {@code application/octet-stream} when unknown.
     */
    public String detectMimeType(Path path) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(path));
            return mediaType == null ? "application/octet-stream" : mediaType.toString();
        } catch (IOException ex) {
            return "application/octet-stream";
        }
    }
}
