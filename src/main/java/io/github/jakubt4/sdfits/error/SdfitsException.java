package io.github.jakubt4.sdfits.error;

/**
 * Base type of the conversion failures that are isolated to a record, a file or a directory.
 */
public class SdfitsException extends RuntimeException {

    public SdfitsException(final String message) {
        super(message);
    }

    public SdfitsException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
