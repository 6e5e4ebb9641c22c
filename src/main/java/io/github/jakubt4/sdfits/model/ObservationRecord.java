package io.github.jakubt4.sdfits.model;

import java.time.Instant;

/**
 * One measurement event produced by a record reader.
 *
 * <p>Spectrum and noise-power readings share the identifying attributes below and differ
 * only in their payload, see {@link SpectrumRecord} and {@link NoisePowerRecord}.
 */
public sealed interface ObservationRecord permits SpectrumRecord, NoisePowerRecord {

    /** Start of the measurement, UTC. */
    Instant timestamp();

    String sourceName();

    /** Integration duration in seconds. */
    double obsTime();

    String experimentName();

    String scanName();
}
