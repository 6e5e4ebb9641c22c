package io.github.jakubt4.sdfits.service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Per-directory report of a conversion.
 *
 * @param directory      scan directory
 * @param status         outcome
 * @param outputFile     artifact written, or the existing one that caused a skip; may be {@code null}
 * @param metadataFile   antenna log used for pointing; {@code null} when pointing is unknown
 * @param spectrumRows   rows in the {@code MATRIX} table
 * @param noiseRows      rows in the {@code NOISE} table
 * @param droppedSamples records removed because their pointing could not be transformed
 * @param maxOffset      largest angular distance of a spectrum pointing from the first one, degrees
 * @param skippedFiles   files that could not be read
 * @param message        human-readable summary or failure reason
 */
public record ConversionResult(
        Path directory,
        ConversionStatus status,
        Path outputFile,
        Path metadataFile,
        int spectrumRows,
        int noiseRows,
        int droppedSamples,
        double maxOffset,
        List<Path> skippedFiles,
        String message
) {

    public ConversionResult {
        skippedFiles = List.copyOf(skippedFiles);
    }

    public static ConversionResult converted(final Path directory, final Path outputFile, final Path metadataFile,
                                             final int spectrumRows, final int noiseRows, final int droppedSamples,
                                             final double maxOffset, final List<Path> skippedFiles) {
        return new ConversionResult(directory, ConversionStatus.CONVERTED, outputFile, metadataFile,
                spectrumRows, noiseRows, droppedSamples, maxOffset, skippedFiles,
                "Wrote " + spectrumRows + " spectra and " + noiseRows + " noise readings");
    }

    public static ConversionResult skippedExistingOutput(final Path directory, final Path existingOutput) {
        return new ConversionResult(directory, ConversionStatus.SKIPPED_EXISTING_OUTPUT, existingOutput, null,
                0, 0, 0, 0.0, List.of(), "Already converted: " + existingOutput.getFileName());
    }

    public static ConversionResult skippedNoRecords(final Path directory, final Path metadataFile,
                                                    final List<Path> skippedFiles) {
        return new ConversionResult(directory, ConversionStatus.SKIPPED_NO_RECORDS, null, metadataFile,
                0, 0, 0, 0.0, skippedFiles, "No spectrum or noise records");
    }

    public static ConversionResult failed(final Path directory, final String message) {
        return new ConversionResult(directory, ConversionStatus.FAILED, null, null,
                0, 0, 0, 0.0, List.of(), message);
    }

    public Optional<Path> metadata() {
        return Optional.ofNullable(metadataFile);
    }
}
