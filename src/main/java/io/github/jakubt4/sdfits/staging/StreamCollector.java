package io.github.jakubt4.sdfits.staging;

import io.github.jakubt4.sdfits.metadata.PositionLookup;
import io.github.jakubt4.sdfits.model.NoisePowerRecord;
import io.github.jakubt4.sdfits.model.ObservationRecord;
import io.github.jakubt4.sdfits.model.Pointing;
import io.github.jakubt4.sdfits.model.SpectrumRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the table fields of each observation record, including its antenna pointing, and
 * appends them to the matching staging buffer.
 */
@Slf4j
@Component
public class StreamCollector {

    private static final int PROGRESS_INTERVAL = 100;

    /**
     * Appends {@code record} to the spectrum or noise buffer of {@code run}, using the run's
     * position lookup when it has one.
     */
    public void append(final ConversionRun run, final ObservationRecord record) {
        if (record instanceof SpectrumRecord spectrum) {
            appendSpectrum(run.spectra(), spectrum, run.positionLookup());
            logProgress("spectrum", run.spectra().size(), spectrum.timestamp(), run);
        } else if (record instanceof NoisePowerRecord noisePower) {
            appendNoise(run.noise(), noisePower, run.positionLookup());
            logProgress("noise", run.noise().size(), noisePower.timestamp(), run);
        }
    }

    /**
     * @param lookup antenna position log; when empty the pointing is {@link Pointing#UNKNOWN}
     */
    public void appendSpectrum(final ColumnBuffer<SpectrumRow> buffer, final SpectrumRecord record,
                               final Optional<PositionLookup> lookup) {
        final var timestamp = record.timestamp();
        final var pointing = pointingAt(timestamp, lookup);
        buffer.append(new SpectrumRow(
                timestamp,
                dateObs(timestamp),
                secondsOfDay(timestamp),
                text(record.sourceName()),
                record.obsTime(),
                text(record.experimentName()),
                text(record.scanName()),
                pointing.azimuth(),
                pointing.elevation(),
                record.averages(),
                record.spectrumLength(),
                record.sampleSize(),
                record.spectrum()));
    }

    /**
     * @param lookup antenna position log; when empty the pointing is {@link Pointing#UNKNOWN}
     */
    public void appendNoise(final ColumnBuffer<NoiseRow> buffer, final NoisePowerRecord record,
                            final Optional<PositionLookup> lookup) {
        final var timestamp = record.timestamp();
        final var pointing = pointingAt(timestamp, lookup);
        buffer.append(new NoiseRow(
                timestamp,
                dateObs(timestamp),
                secondsOfDay(timestamp),
                text(record.sourceName()),
                record.obsTime(),
                text(record.experimentName()),
                text(record.scanName()),
                pointing.azimuth(),
                pointing.elevation(),
                record.noisePower(),
                record.accumulationLength(),
                record.switchingFrequency(),
                record.blankingPeriod()));
    }

    static String dateObs(final Instant timestamp) {
        return LocalDateTime.ofInstant(timestamp, ZoneOffset.UTC).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    static double secondsOfDay(final Instant timestamp) {
        final var time = LocalDateTime.ofInstant(timestamp, ZoneOffset.UTC).toLocalTime();
        return time.toSecondOfDay() + time.getNano() / 1.0e9;
    }

    private static Pointing pointingAt(final Instant timestamp, final Optional<PositionLookup> lookup) {
        return lookup.map(positions -> positions.positionAt(timestamp)).orElse(Pointing.UNKNOWN);
    }

    private static String text(final String value) {
        return Objects.requireNonNullElse(value, "");
    }

    private static void logProgress(final String stream, final int rows, final Instant timestamp, final ConversionRun run) {
        if ((rows - 1) % PROGRESS_INTERVAL == 0) {
            log.debug("[{}] {} row {} at {}", run.directory().getFileName(), stream, rows, timestamp);
        }
    }
}
