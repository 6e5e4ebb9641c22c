package io.github.jakubt4.sdfits.staging;

import java.time.Instant;

/**
 * Fields staged for every record regardless of stream.
 */
public interface StagedRow {

    Instant timestamp();

    /** ISO-8601 UTC date-time without offset, e.g. {@code 2018-09-23T12:00:01.5}. */
    String dateObs();

    /** Seconds since UTC midnight, with fraction. */
    double ut();

    String object();

    double obsTime();

    String experiment();

    String scan();

    double azimuth();

    double elevation();
}
