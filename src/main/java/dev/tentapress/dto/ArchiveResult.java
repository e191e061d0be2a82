package dev.tentapress.dto;

import java.nio.file.Path;

/**
 * A freshly written export archive. The caller owns the file and deletes it after delivery.
 */
public record ArchiveResult(
        Path path,
        String filename
) {}
