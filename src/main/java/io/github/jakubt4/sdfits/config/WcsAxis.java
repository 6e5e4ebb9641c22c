package io.github.jakubt4.sdfits.config;

import java.util.Objects;

/**
 * One virtual WCS axis of the SDFITS data matrix.
 *
 * @param type           axis type, e.g. {@code FREQ}, {@code RA}, {@code DEC}, {@code STOKES}
 * @param length         number of pixels along the axis ({@code MAXISn})
 * @param referenceValue value at the reference pixel ({@code CRVALn})
 * @param referencePixel reference pixel ({@code CRPIXn})
 * @param increment      value increment per pixel ({@code CDELTn})
 */
public record WcsAxis(String type, int length, double referenceValue, double referencePixel, double increment) {

    public static final String RA = "RA";
    public static final String DEC = "DEC";

    public WcsAxis {
        Objects.requireNonNull(type, "axis type is required");
        if (length < 1) {
            throw new IllegalArgumentException("Axis " + type + " must have a positive length: " + length);
        }
    }

    public boolean isRa() {
        return RA.equals(type);
    }

    public boolean isDec() {
        return DEC.equals(type);
    }
}
