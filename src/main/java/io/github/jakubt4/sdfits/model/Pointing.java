package io.github.jakubt4.sdfits.model;

/**
 * Antenna pointing in horizontal coordinates, degrees.
 *
 * @param azimuth   azimuth, clockwise from north
 * @param elevation elevation above the horizon
 */
public record Pointing(double azimuth, double elevation) {

    /** Marker for records collected without an antenna position log. */
    public static final Pointing UNKNOWN = new Pointing(-1.0, -1.0);

    public boolean isUnknown() {
        return equals(UNKNOWN);
    }
}
