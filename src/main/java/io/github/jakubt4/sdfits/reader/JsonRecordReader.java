package io.github.jakubt4.sdfits.reader;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.sdfits.dto.MetadataDocument;
import io.github.jakubt4.sdfits.dto.NoisePowerDocument;
import io.github.jakubt4.sdfits.dto.SpectrumDocument;
import io.github.jakubt4.sdfits.error.MalformedRecordException;
import io.github.jakubt4.sdfits.model.AntennaPosition;
import io.github.jakubt4.sdfits.model.NoisePowerRecord;
import io.github.jakubt4.sdfits.model.SpectrumRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads spectrum, noise-power and metadata files stored as JSON documents.
 *
 * <p>File roles follow the naming used by the acquisition pipeline: {@code *.spec.json}
 * spectra, {@code *.npow.json} noise readings, {@code meta-data.json} or {@code *.meta.json}
 * metadata and {@code *.fits} previously written artifacts.
 */
@Component
@RequiredArgsConstructor
public class JsonRecordReader implements RecordReader {

    static final String SPECTRUM_SUFFIX = ".spec.json";
    static final String NOISE_SUFFIX = ".npow.json";
    static final String METADATA_NAME = "meta-data.json";
    static final String METADATA_SUFFIX = ".meta.json";
    static final String OUTPUT_SUFFIX = ".fits";

    private final ObjectMapper objectMapper;

    @Override
    public FileKind classify(final Path file) {
        final var name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(SPECTRUM_SUFFIX)) {
            return FileKind.SPECTRUM;
        }
        if (name.endsWith(NOISE_SUFFIX)) {
            return FileKind.NOISE;
        }
        if (name.equals(METADATA_NAME) || name.endsWith(METADATA_SUFFIX)) {
            return FileKind.METADATA;
        }
        if (name.endsWith(OUTPUT_SUFFIX)) {
            return FileKind.OUTPUT;
        }
        return FileKind.OTHER;
    }

    @Override
    public SpectrumRecord readSpectrum(final Path file) {
        final var document = read(file, SpectrumDocument.class);
        if (document.timestamp() == null) {
            throw new MalformedRecordException(file, "spectrum has no timestamp");
        }
        if (document.spectrum() == null || document.spectrum().length == 0) {
            throw new MalformedRecordException(file, "spectrum has no channels");
        }
        return new SpectrumRecord(
                document.timestamp(),
                document.source(),
                orZero(document.obsTime()),
                document.experiment(),
                document.scan(),
                Objects.requireNonNullElse(document.averages(), 1),
                Objects.requireNonNullElse(document.sampleSize(), Float.BYTES),
                document.spectrum());
    }

    @Override
    public NoisePowerRecord readNoise(final Path file) {
        final var document = read(file, NoisePowerDocument.class);
        if (document.timestamp() == null) {
            throw new MalformedRecordException(file, "noise reading has no timestamp");
        }
        if (document.noisePower() == null) {
            throw new MalformedRecordException(file, "noise reading has no noisePower");
        }
        return new NoisePowerRecord(
                document.timestamp(),
                document.source(),
                orZero(document.obsTime()),
                document.experiment(),
                document.scan(),
                document.noisePower(),
                Objects.requireNonNullElse(document.accumulationLength(), 0),
                orZero(document.switchingFrequency()),
                orZero(document.blankingPeriod()));
    }

    @Override
    public List<AntennaPosition> readAntennaLog(final Path file) {
        final var document = read(file, MetadataDocument.class);
        if (document.antennaPosition() == null || document.antennaPosition().isEmpty()) {
            throw new MalformedRecordException(file, "metadata has no antenna positions");
        }

        final var positions = new ArrayList<AntennaPosition>(document.antennaPosition().size());
        for (final var entry : document.antennaPosition()) {
            if (entry == null || entry.time() == null || entry.fields() == null
                    || entry.fields().az() == null || entry.fields().el() == null) {
                throw new MalformedRecordException(file,
                        "antenna position " + positions.size() + " lacks time, az or el");
            }
            positions.add(new AntennaPosition(entry.time(), entry.fields().az(), entry.fields().el()));
        }
        return positions;
    }

    private <T> T read(final Path file, final Class<T> type) {
        try (var in = Files.newInputStream(file)) {
            final var document = objectMapper.readValue(in, type);
            if (document == null) {
                throw new MalformedRecordException(file, "empty document");
            }
            return document;
        } catch (final JacksonException e) {
            throw new MalformedRecordException(file, "invalid JSON: " + e.getOriginalMessage(), e);
        } catch (final IOException e) {
            throw new MalformedRecordException(file, "cannot read: " + e.getMessage(), e);
        }
    }

    private static double orZero(final Double value) {
        return value == null ? 0.0 : value;
    }
}
