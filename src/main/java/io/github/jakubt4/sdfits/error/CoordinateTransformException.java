package io.github.jakubt4.sdfits.error;

/**
 * A single pointing sample could not be converted to sky coordinates. The affected record is
 * dropped; the batch continues.
 */
public class CoordinateTransformException extends SdfitsException {

    public CoordinateTransformException(final String message) {
        super(message);
    }

    public CoordinateTransformException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
