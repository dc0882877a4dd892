package com.eainde.docexport.files;

import com.eainde.docexport.registry.DocumentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Allocates {@code <base>_<yyyy-MM-dd_HH-mm-ss>.<ext>} inside the export directory.
 *
 * <p>The file is reserved with an atomic {@link Files#createFile} so concurrent runs that land on
 * the same second get {@code _2}, {@code _3}, ... suffixes instead of overwriting each other.</p>
 */
public class TimestampedArtifactPathAllocator implements ArtifactPathAllocator {

    private static final Logger log = LoggerFactory.getLogger(TimestampedArtifactPathAllocator.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    private static final int MAX_ATTEMPTS = 1000;

    private final Path directory;
    private final String defaultBaseName;
    private final Clock clock;

    public TimestampedArtifactPathAllocator(Path directory, String defaultBaseName) {
        this(directory, defaultBaseName, Clock.systemDefaultZone());
    }

    public TimestampedArtifactPathAllocator(Path directory, String defaultBaseName, Clock clock) {
        String base = sanitize(defaultBaseName);
        this.directory = directory;
        this.defaultBaseName = base != null ? base : "export";
        this.clock = clock;
    }

    @Override
    public Path allocatePath(DocumentKind kind, String customName) throws IOException {
        Files.createDirectories(directory);

        String base = sanitize(customName);
        if (base == null) {
            base = defaultBaseName;
        }
        String stem = base + "_" + LocalDateTime.now(clock).format(TIMESTAMP);

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String fileName = (attempt == 1 ? stem : stem + "_" + attempt) + "." + kind.extension();
            Path candidate = directory.resolve(fileName);
            try {
                Files.createFile(candidate);
                log.debug("Allocated artifact path {}", candidate);
                return candidate;
            } catch (FileAlreadyExistsException e) {
                log.trace("{} already taken, trying next suffix", candidate);
            }
        }
        throw new IOException("No free file name for " + stem + " in " + directory);
    }

    /**
     * Reduces a user-supplied name to a file-system-safe stem without extension.
     */
    static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String fileName = name.trim().replace('\\', '/');
        fileName = fileName.substring(fileName.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot > 0) {
            fileName = fileName.substring(0, dot);
        }
        String cleaned = fileName.replaceAll("[^A-Za-z0-9._-]+", "_").replaceAll("^[._]+", "");
        return cleaned.isEmpty() ? null : cleaned;
    }
}
