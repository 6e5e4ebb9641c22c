package io.github.jakubt4.sdfits.service;

import io.github.jakubt4.sdfits.config.SdfitsProperties;
import io.github.jakubt4.sdfits.config.SiteConfig;
import io.github.jakubt4.sdfits.coordinates.CoordinateTransformService;
import io.github.jakubt4.sdfits.coordinates.SkyPositions;
import io.github.jakubt4.sdfits.error.MalformedRecordException;
import io.github.jakubt4.sdfits.fits.SdfitsFileWriter;
import io.github.jakubt4.sdfits.metadata.AntennaPositionIndex;
import io.github.jakubt4.sdfits.model.ObservationRecord;
import io.github.jakubt4.sdfits.model.Pointing;
import io.github.jakubt4.sdfits.reader.RecordReader;
import io.github.jakubt4.sdfits.scan.ScanDirectory;
import io.github.jakubt4.sdfits.staging.ColumnBuffer;
import io.github.jakubt4.sdfits.staging.ConversionRun;
import io.github.jakubt4.sdfits.staging.StagedColumns;
import io.github.jakubt4.sdfits.staging.StagedRow;
import io.github.jakubt4.sdfits.staging.StreamCollector;
import io.github.jakubt4.sdfits.staging.TemporalSorter;
import io.github.jakubt4.sdfits.table.TableAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Converts one scan directory: collect, sort, transform, assemble, write.
 *
 * <p>All intermediate state lives in a {@link ConversionRun} created for the call, so
 * directories never share buffers or pointing logs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionPipeline {

    private final RecordReader recordReader;
    private final StreamCollector collector;
    private final TemporalSorter sorter;
    private final CoordinateTransformService transformService;
    private final TableAssembler assembler;
    private final SdfitsFileWriter writer;
    private final SiteConfig site;
    private final SdfitsProperties properties;

    /**
     * @param scan     directory and its classified files
     * @param override rebuild even when an artifact already exists
     * @return the outcome; failures other than unreadable files surface as exceptions
     */
    public ConversionResult convert(final ScanDirectory scan, final boolean override) {
        final var directory = scan.directory();
        if (scan.hasExistingOutput() && !override) {
            final var existing = scan.existingOutputs().get(0);
            log.info("[{}] already converted to {}, skipping", directory, existing.getFileName());
            return ConversionResult.skippedExistingOutput(directory, existing);
        }

        log.info("[{}] converting {} spectrum and {} noise file(s)",
                directory, scan.spectrumFiles().size(), scan.noiseFiles().size());
        final var run = openRun(scan);
        collect(run, scan.spectrumFiles(), recordReader::readSpectrum);
        collect(run, scan.noiseFiles(), recordReader::readNoise);

        final var metadataFile = run.metadataFile().orElse(null);
        if (run.spectra().isEmpty() && run.noise().isEmpty()) {
            log.warn("[{}] no spectrum or noise records, nothing to write", directory);
            return ConversionResult.skippedNoRecords(directory, metadataFile, run.skippedFiles());
        }

        sorter.sortBy(run.spectra(), StagedColumns.TIMESTAMP);
        sorter.sortBy(run.noise(), StagedColumns.TIMESTAMP);

        final var spectrumSky = transform(run.spectra());
        final var noiseSky = transform(run.noise());
        final var maxOffset = maxOffset(spectrumSky);

        final var matrix = assembler.assembleSpectrumTable(run, spectrumSky);
        final var noise = assembler.assembleNoiseTable(run, noiseSky);
        final var output = scan.outputFile();
        writer.write(output, assembler.primaryHeader(), List.of(matrix, noise));

        final var dropped = spectrumSky.rejectedCount() + noiseSky.rejectedCount();
        log.info("[{}] {} spectra, {} noise readings, {} dropped, max pointing offset {} deg",
                directory, matrix.rowCount(), noise.rowCount(), dropped, String.format("%.4f", maxOffset));
        return ConversionResult.converted(directory, output, metadataFile,
                matrix.rowCount(), noise.rowCount(), dropped, maxOffset, run.skippedFiles());
    }

    private ConversionRun openRun(final ScanDirectory scan) {
        final var directory = scan.directory();
        final var candidates = scan.metadataFiles();
        if (candidates.isEmpty()) {
            log.warn("[{}] no metadata file, pointing recorded as az={} el={}",
                    directory, Pointing.UNKNOWN.azimuth(), Pointing.UNKNOWN.elevation());
            return new ConversionRun(directory, null, null);
        }
        if (candidates.size() > 1) {
            log.warn("[{}] {} metadata files {}, using the last one", directory, candidates.size(),
                    candidates.stream().map(Path::getFileName).toList());
        }

        final var unreadable = new ArrayList<Path>();
        ConversionRun run = null;
        for (var i = candidates.size() - 1; i >= 0 && run == null; i--) {
            final var file = candidates.get(i);
            try {
                final var index = new AntennaPositionIndex(recordReader.readAntennaLog(file),
                        properties.metadata().lookup());
                log.info("[{}] antenna log {}: {} samples from {} to {}",
                        directory, file.getFileName(), index.size(), index.start(), index.end());
                run = new ConversionRun(directory, index, file);
            } catch (final MalformedRecordException e) {
                log.warn("[{}] skipping metadata file: {}", directory, e.getMessage());
                unreadable.add(file);
            }
        }
        if (run == null) {
            log.warn("[{}] no usable metadata file, pointing recorded as unknown", directory);
            run = new ConversionRun(directory, null, null);
        }
        unreadable.forEach(run::recordSkippedFile);
        return run;
    }

    private <T extends ObservationRecord> void collect(final ConversionRun run, final List<Path> files,
                                                       final Function<Path, T> read) {
        for (final var file : files) {
            try {
                collector.append(run, read.apply(file));
            } catch (final MalformedRecordException e) {
                log.warn("[{}] skipping record file: {}", run.directory(), e.getMessage());
                run.recordSkippedFile(file);
            }
        }
    }

    private <R extends StagedRow> SkyPositions transform(final ColumnBuffer<R> rows) {
        final var sky = transformService.toEquatorialAndGalactic(
                rows.doubles(StagedColumns.ELEVATION),
                rows.doubles(StagedColumns.AZIMUTH),
                rows.column(StagedColumns.TIMESTAMP),
                site);
        if (sky.rejectedCount() > 0) {
            rows.retainRows(sky.sourceRows());
        }
        return sky;
    }

    private double maxOffset(final SkyPositions sky) {
        final var offsets = transformService.angularOffset(sky.rightAscension(), sky.declination());
        var max = 0.0;
        for (var i = 0; i < offsets.size(); i++) {
            max = FastMath.max(max, FastMath.hypot(offsets.longitude()[i], offsets.latitude()[i]));
        }
        return max;
    }
}
