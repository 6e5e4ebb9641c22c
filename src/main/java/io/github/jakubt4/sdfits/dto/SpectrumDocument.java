package io.github.jakubt4.sdfits.dto;

import java.time.Instant;

/**
 * JSON form of a spectrum file ({@code *.spec.json}).
 *
 * @param timestamp  start of the accumulation, UTC (required)
 * @param source     observed source
 * @param obsTime    integration time in seconds
 * @param experiment experiment name
 * @param scan       scan name
 * @param averages   number of averaged spectra
 * @param sampleSize bytes per spectral sample
 * @param spectrum   channel powers (required, non-empty)
 */
public record SpectrumDocument(
        Instant timestamp,
        String source,
        Double obsTime,
        String experiment,
        String scan,
        Integer averages,
        Integer sampleSize,
        float[] spectrum
) {
}
