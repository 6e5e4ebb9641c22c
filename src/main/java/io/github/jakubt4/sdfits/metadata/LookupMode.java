package io.github.jakubt4.sdfits.metadata;

/**
 * How a position is derived for an instant that falls between two log samples.
 */
public enum LookupMode {

    /** The sample closest in time; the earlier one on a tie. */
    NEAREST,

    /** Linear interpolation between the bracketing samples, azimuth along the shorter arc. */
    LINEAR
}
