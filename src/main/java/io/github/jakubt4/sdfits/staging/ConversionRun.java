package io.github.jakubt4.sdfits.staging;

import io.github.jakubt4.sdfits.metadata.PositionLookup;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one directory conversion: the spectrum and noise staging buffers plus the antenna
 * position lookup selected for the directory.
 *
 * <p>Created empty for each directory and dropped once its artifact is written; nothing here
 * is shared between directories.
 */
public final class ConversionRun {

    private final Path directory;
    private final PositionLookup positionLookup;
    private final Path metadataFile;
    private final ColumnBuffer<SpectrumRow> spectra = new ColumnBuffer<>(StagedColumns.SPECTRUM_COLUMNS);
    private final ColumnBuffer<NoiseRow> noise = new ColumnBuffer<>(StagedColumns.NOISE_COLUMNS);
    private final List<Path> skippedFiles = new ArrayList<>();

    /**
     * @param directory      scan directory being converted
     * @param positionLookup antenna log of the directory, {@code null} when it has none
     * @param metadataFile   file the lookup was read from, {@code null} when it has none
     */
    public ConversionRun(final Path directory, final PositionLookup positionLookup, final Path metadataFile) {
        this.directory = Objects.requireNonNull(directory, "directory is required");
        this.positionLookup = positionLookup;
        this.metadataFile = metadataFile;
    }

    public Path directory() {
        return directory;
    }

    public Optional<PositionLookup> positionLookup() {
        return Optional.ofNullable(positionLookup);
    }

    public Optional<Path> metadataFile() {
        return Optional.ofNullable(metadataFile);
    }

    public ColumnBuffer<SpectrumRow> spectra() {
        return spectra;
    }

    public ColumnBuffer<NoiseRow> noise() {
        return noise;
    }

    public void recordSkippedFile(final Path file) {
        skippedFiles.add(file);
    }

    public List<Path> skippedFiles() {
        return List.copyOf(skippedFiles);
    }
}
