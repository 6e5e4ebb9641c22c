package io.github.jakubt4.sdfits.staging;

import java.time.Instant;

/**
 * Staged fields of one noise-power record.
 */
public record NoiseRow(
        Instant timestamp,
        String dateObs,
        double ut,
        String object,
        double obsTime,
        String experiment,
        String scan,
        double azimuth,
        double elevation,
        double noisePower,
        int accumulationLength,
        double switchingFrequency,
        double blankingPeriod
) implements StagedRow {
}
