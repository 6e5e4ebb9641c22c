package io.github.jakubt4.sdfits.reader;

import io.github.jakubt4.sdfits.error.MalformedRecordException;
import io.github.jakubt4.sdfits.model.AntennaPosition;
import io.github.jakubt4.sdfits.model.NoisePowerRecord;
import io.github.jakubt4.sdfits.model.SpectrumRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Parses the files of a scan directory into typed records.
 *
 * <p>Each read method either returns a complete record or throws
 * {@link MalformedRecordException}; I/O failures are reported the same way.
 */
public interface RecordReader {

    /** Role of {@code file}, judged from its name alone. */
    FileKind classify(Path file);

    SpectrumRecord readSpectrum(Path file);

    NoisePowerRecord readNoise(Path file);

    /** Antenna position samples in file order; never empty. */
    List<AntennaPosition> readAntennaLog(Path file);
}
