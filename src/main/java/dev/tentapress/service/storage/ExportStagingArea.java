package dev.tentapress.service.storage;

import dev.tentapress.dto.ArchiveResult;
import dev.tentapress.exception.ExportInitException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Working directory for export archives awaiting download.
 * Each export reserves its own file with an atomic create, so two exports started
 * in the same second get distinct names instead of overwriting each other.
 */
@Slf4j
public class ExportStagingArea {

    static final String FILENAME_PREFIX = "tentapress-export-";
    static final String FILENAME_EXTENSION = ".zip";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);
    private static final int MAX_NAME_ATTEMPTS = 100;

    private final Path directory;
    private final Clock clock;

    public ExportStagingArea(Path directory, Clock clock) {
        this.directory = directory.toAbsolutePath().normalize();
        this.clock = clock;
        log.info("ExportStagingArea initialized: directory={}", this.directory);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Create the staging directory if needed and reserve a fresh, empty archive file.
     *
     * @throws ExportInitException if the directory or the file cannot be created
     */
    public ArchiveResult allocate() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ExportInitException("Unable to create export directory " + directory, e);
        }

        String timestamp = TIMESTAMP_FORMAT.format(clock.instant());
        for (int attempt = 1; attempt <= MAX_NAME_ATTEMPTS; attempt++) {
            String filename = FILENAME_PREFIX + timestamp + (attempt == 1 ? "" : "-" + attempt) + FILENAME_EXTENSION;
            Path path = directory.resolve(filename);
            try {
                Files.createFile(path);
                log.debug("Reserved export archive {}", path);
                return new ArchiveResult(path, filename);
            } catch (FileAlreadyExistsException e) {
                log.debug("Export filename {} already taken", filename);
            } catch (IOException e) {
                throw new ExportInitException("Unable to create export zip.", e);
            }
        }
        throw new ExportInitException("Unable to create export zip.",
                new FileAlreadyExistsException(directory.resolve(FILENAME_PREFIX + timestamp + FILENAME_EXTENSION).toString()));
    }

    /**
     * Delete an archive that was delivered or abandoned.
     */
    public Mono<Void> discard(Path archive) {
        return Mono.fromCallable(() -> {
            Path target = archive.toAbsolutePath().normalize();
            if (!target.startsWith(directory)) {
                log.warn("Refusing to delete file outside the export directory: {}", archive);
                return false;
            }
            boolean deleted = Files.deleteIfExists(target);
            if (deleted) {
                log.debug("Export archive deleted: {}", target);
            }
            return deleted;
        }).subscribeOn(Schedulers.boundedElastic())
          .onErrorResume(e -> {
              log.warn("Failed to delete export archive {}: {}", archive, e.getMessage());
              return Mono.just(false);
          })
          .then();
    }

    /**
     * Delete export archives last modified more than {@code maxAge} ago.
     *
     * @return the number of files deleted
     */
    public Mono<Integer> purgeOlderThan(Duration maxAge) {
        return Mono.fromCallable(() -> {
            if (!Files.isDirectory(directory)) {
                return 0;
            }
            Instant cutoff = clock.instant().minus(maxAge);
            List<Path> stale;
            try (Stream<Path> files = Files.list(directory)) {
                stale = files.filter(this::isExportArchive)
                        .filter(file -> lastModified(file).isBefore(cutoff))
                        .collect(Collectors.toList());
            }
            int deleted = 0;
            for (Path file : stale) {
                try {
                    if (Files.deleteIfExists(file)) {
                        deleted++;
                    }
                } catch (IOException e) {
                    log.warn("Failed to purge stale export archive {}: {}", file, e.getMessage());
                }
            }
            return deleted;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Check that the staging directory exists (creating it if needed) and is writable.
     */
    public Mono<Boolean> isWritable() {
        return Mono.fromCallable(() -> {
            Files.createDirectories(directory);
            return Files.isWritable(directory);
        }).subscribeOn(Schedulers.boundedElastic())
          .onErrorReturn(false);
    }

    private boolean isExportArchive(Path file) {
        String name = file.getFileName().toString();
        return Files.isRegularFile(file)
                && name.startsWith(FILENAME_PREFIX)
                && name.endsWith(FILENAME_EXTENSION);
    }

    private static Instant lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            // vanished between listing and inspection
            return Instant.MAX;
        }
    }
}
