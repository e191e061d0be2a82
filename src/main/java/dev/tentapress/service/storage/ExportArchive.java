package dev.tentapress.service.storage;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.tentapress.exception.ExportArchiveException;
import dev.tentapress.exception.ExportInitException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * An open zip container receiving JSON documents.
 * Entries are pretty-printed UTF-8 JSON, with slashes and non-ASCII left unescaped,
 * each followed by a newline. Once sealed no further entries are accepted.
 */
@Slf4j
public class ExportArchive implements Closeable {

    private static final DefaultIndenter INDENTER = new DefaultIndenter("    ", "\n");

    // "key": value, and [] / {} for empty containers
    private static final Separators SEPARATORS = Separators.createDefaultInstance()
            .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
            .withObjectEmptySeparator("")
            .withArrayEmptySeparator("");

    private final Path path;
    private final ZipOutputStream zip;
    private final ObjectWriter writer;
    private final List<String> entryNames = new ArrayList<>();
    private boolean sealed;

    private ExportArchive(Path path, ZipOutputStream zip, ObjectWriter writer) {
        this.path = path;
        this.zip = zip;
        this.writer = writer;
    }

    /**
     * Open a new, empty archive at {@code path}, replacing whatever the file holds.
     *
     * @throws ExportInitException if the file cannot be opened for writing; the file is removed
     */
    public static ExportArchive create(Path path, ObjectMapper objectMapper) {
        try {
            OutputStream out = Files.newOutputStream(path,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(out), StandardCharsets.UTF_8);
            return new ExportArchive(path, zip, jsonWriter(objectMapper));
        } catch (IOException e) {
            ExportInitException failure = new ExportInitException("Unable to create export zip.", e);
            try {
                Files.deleteIfExists(path);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    static ObjectWriter jsonWriter(ObjectMapper objectMapper) {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(SEPARATORS)
                .withObjectIndenter(INDENTER);
        printer.indentArraysWith(INDENTER);
        return objectMapper.writer(printer);
    }

    public Path getPath() {
        return path;
    }

    /** Names of the entries written so far, in order. */
    public List<String> getEntryNames() {
        return List.copyOf(entryNames);
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Serialize {@code document} and add it as a root entry.
     *
     * @throws ExportArchiveException if the entry cannot be written
     */
    public void writeJson(String entryName, Object document) {
        if (sealed) {
            throw new IllegalStateException("Export archive already sealed: " + path);
        }
        try {
            byte[] json = writer.writeValueAsBytes(document);
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(json);
            zip.write('\n');
            zip.closeEntry();
            entryNames.add(entryName);
            log.debug("Wrote {} ({} bytes) to {}", entryName, json.length + 1, path.getFileName());
        } catch (IOException e) {
            throw new ExportArchiveException("Unable to write " + entryName + " to export zip.", entryName, e);
        }
    }

    /**
     * Finish the container. Idempotent.
     *
     * @throws ExportArchiveException if the central directory cannot be written
     */
    public void seal() {
        if (sealed) {
            return;
        }
        sealed = true;
        try {
            zip.close();
        } catch (IOException e) {
            throw new ExportArchiveException("Unable to finalize export zip.", null, e);
        }
    }

    /**
     * Release the file handle without promising a valid container. Used on failure paths.
     */
    @Override
    public void close() throws IOException {
        if (sealed) {
            return;
        }
        sealed = true;
        zip.close();
    }
}
