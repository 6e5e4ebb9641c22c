package io.github.jakubt4.sdfits.scan;

import java.nio.file.Path;
import java.util.List;

/**
 * A leaf scan directory and its classified files, each list sorted by file name.
 *
 * @param directory       the scan directory
 * @param spectrumFiles   spectrum files
 * @param noiseFiles      noise-power files
 * @param metadataFiles   metadata (antenna log) files, normally exactly one
 * @param existingOutputs artifacts written by an earlier run
 */
public record ScanDirectory(
        Path directory,
        List<Path> spectrumFiles,
        List<Path> noiseFiles,
        List<Path> metadataFiles,
        List<Path> existingOutputs
) {

    public static final String OUTPUT_EXTENSION = ".fits";

    public ScanDirectory {
        spectrumFiles = List.copyOf(spectrumFiles);
        noiseFiles = List.copyOf(noiseFiles);
        metadataFiles = List.copyOf(metadataFiles);
        existingOutputs = List.copyOf(existingOutputs);
    }

    /** Artifact path, named after the directory: {@code <dir>/<dir name>.fits}. */
    public Path outputFile() {
        final var name = directory.toAbsolutePath().normalize().getFileName();
        return directory.resolve((name == null ? "root" : name.toString()) + OUTPUT_EXTENSION);
    }

    public boolean hasExistingOutput() {
        return !existingOutputs.isEmpty();
    }
}
