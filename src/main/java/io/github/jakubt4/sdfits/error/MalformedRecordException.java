package io.github.jakubt4.sdfits.error;

import java.nio.file.Path;

/**
 * A spectrum, noise or metadata file could not be parsed. The file is skipped; the rest of
 * the directory is still converted.
 */
public class MalformedRecordException extends SdfitsException {

    private final Path file;

    public MalformedRecordException(final Path file, final String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public MalformedRecordException(final Path file, final String message, final Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
