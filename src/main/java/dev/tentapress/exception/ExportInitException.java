package dev.tentapress.exception;

/**
 * The export container could not be created or opened for writing.
 * Raised before any entry is written; no archive file is left behind.
 */
public class ExportInitException extends ExportException {

    public ExportInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
