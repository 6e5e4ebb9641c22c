package io.github.jakubt4.sdfits.coordinates;

/**
 * Tangent-plane offsets of every sample from the first one, degrees.
 *
 * @param longitude offset along the reference point's parallel (RA direction)
 * @param latitude  offset along the reference point's meridian (Dec direction)
 */
public record AngularOffsets(double[] longitude, double[] latitude) {

    public int size() {
        return longitude.length;
    }
}
