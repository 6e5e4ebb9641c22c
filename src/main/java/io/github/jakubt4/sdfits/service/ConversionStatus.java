package io.github.jakubt4.sdfits.service;

/**
 * Outcome of converting one scan directory.
 */
public enum ConversionStatus {

    /** The artifact was written. */
    CONVERTED,
    /** An artifact from an earlier run exists and overriding was not requested. */
    SKIPPED_EXISTING_OUTPUT,
    /** No readable spectrum or noise record was found. */
    SKIPPED_NO_RECORDS,
    /** The directory could not be converted; nothing was written. */
    FAILED
}
