package dev.tentapress.exception;

/**
 * Writing to or sealing an already opened export container failed.
 */
public class ExportArchiveException extends ExportException {

    private final String entryName;

    public ExportArchiveException(String message, String entryName, Throwable cause) {
        super(message, cause);
        this.entryName = entryName;
    }

    public String getEntryName() {
        return entryName;
    }
}
