package io.github.jakubt4.sdfits.staging;

import java.time.Instant;

/**
 * Staged fields of one spectrum record.
 */
public record SpectrumRow(
        Instant timestamp,
        String dateObs,
        double ut,
        String object,
        double obsTime,
        String experiment,
        String scan,
        double azimuth,
        double elevation,
        int averages,
        int spectrumLength,
        int sampleSize,
        float[] spectrum
) implements StagedRow {
}
