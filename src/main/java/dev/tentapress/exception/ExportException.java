package dev.tentapress.exception;

/**
 * Base type for failures that abort an export. Degraded sections are not exceptions;
 * they are written into the archive as error-annotated documents.
 */
public class ExportException extends RuntimeException {

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
