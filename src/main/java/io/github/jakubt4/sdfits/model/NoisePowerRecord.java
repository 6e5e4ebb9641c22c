package io.github.jakubt4.sdfits.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A noise-diode power reading.
 *
 * @param timestamp          start of the accumulation, UTC
 * @param sourceName         observed source
 * @param obsTime            integration duration in seconds
 * @param experimentName     experiment identifier
 * @param scanName           scan identifier
 * @param noisePower         measured noise power
 * @param accumulationLength number of accumulations behind {@code noisePower}
 * @param switchingFrequency noise diode switching frequency in Hz
 * @param blankingPeriod     noise diode blanking period in seconds
 */
public record NoisePowerRecord(
        Instant timestamp,
        String sourceName,
        double obsTime,
        String experimentName,
        String scanName,
        double noisePower,
        int accumulationLength,
        double switchingFrequency,
        double blankingPeriod
) implements ObservationRecord {

    public NoisePowerRecord {
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
