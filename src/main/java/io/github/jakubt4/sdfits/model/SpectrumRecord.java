package io.github.jakubt4.sdfits.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single accumulated power spectrum.
 *
 * @param timestamp      start of the accumulation, UTC
 * @param sourceName     observed source
 * @param obsTime        integration duration in seconds
 * @param experimentName experiment identifier
 * @param scanName       scan identifier
 * @param averages       number of raw spectra averaged into this one
 * @param sampleSize     size in bytes of one spectral sample as written by the spectrometer
 * @param spectrum       spectral power values, one per channel
 */
public record SpectrumRecord(
        Instant timestamp,
        String sourceName,
        double obsTime,
        String experimentName,
        String scanName,
        int averages,
        int sampleSize,
        float[] spectrum
) implements ObservationRecord {

    public SpectrumRecord {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(spectrum, "spectrum is required");
    }

    public int spectrumLength() {
        return spectrum.length;
    }
}
