package io.github.jakubt4.sdfits.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One sample of the antenna position log.
 *
 * @param timestamp sample time, UTC
 * @param azimuth   degrees
 * @param elevation degrees
 */
public record AntennaPosition(Instant timestamp, double azimuth, double elevation) {

    public AntennaPosition {
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public Pointing pointing() {
        return new Pointing(azimuth, elevation);
    }
}
