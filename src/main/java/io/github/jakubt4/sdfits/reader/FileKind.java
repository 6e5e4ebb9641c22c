package io.github.jakubt4.sdfits.reader;

/**
 * Role of a file found in a scan directory.
 */
public enum FileKind {
    SPECTRUM,
    NOISE,
    METADATA,
    OUTPUT,
    OTHER
}
