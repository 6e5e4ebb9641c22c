package io.github.jakubt4.sdfits.metadata;

import io.github.jakubt4.sdfits.model.AntennaPosition;
import io.github.jakubt4.sdfits.model.Pointing;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable time index over an antenna position log.
 *
 * <p>Queries before the first or after the last sample return that edge sample; the log is
 * never extrapolated.
 */
public final class AntennaPositionIndex implements PositionLookup {

    private final List<AntennaPosition> samples;
    private final List<Instant> times;
    private final LookupMode mode;

    /**
     * @param samples log samples in any order; re-sorted by timestamp, ties keep their order
     * @param mode    lookup mode between samples
     * @throws IllegalArgumentException if {@code samples} is empty
     */
    public AntennaPositionIndex(final List<AntennaPosition> samples, final LookupMode mode) {
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Antenna position log is empty");
        }
        this.samples = samples.stream()
                .sorted(Comparator.comparing(AntennaPosition::timestamp))
                .toList();
        this.times = this.samples.stream().map(AntennaPosition::timestamp).toList();
        this.mode = Objects.requireNonNull(mode, "mode is required");
    }

    public int size() {
        return samples.size();
    }

    public Instant start() {
        return times.get(0);
    }

    public Instant end() {
        return times.get(times.size() - 1);
    }

    @Override
    public Pointing positionAt(final Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp is required");
        final var found = Collections.binarySearch(times, timestamp);
        if (found >= 0) {
            return samples.get(found).pointing();
        }

        final var insertion = -found - 1;
        if (insertion == 0) {
            return samples.get(0).pointing();
        }
        if (insertion == samples.size()) {
            return samples.get(samples.size() - 1).pointing();
        }

        final var before = samples.get(insertion - 1);
        final var after = samples.get(insertion);
        return switch (mode) {
            case NEAREST -> nearest(before, after, timestamp);
            case LINEAR -> interpolate(before, after, timestamp);
        };
    }

    private static Pointing nearest(final AntennaPosition before, final AntennaPosition after, final Instant timestamp) {
        final var sinceBefore = Duration.between(before.timestamp(), timestamp);
        final var untilAfter = Duration.between(timestamp, after.timestamp());
        return untilAfter.compareTo(sinceBefore) < 0 ? after.pointing() : before.pointing();
    }

    private static Pointing interpolate(final AntennaPosition before, final AntennaPosition after, final Instant timestamp) {
        final var span = Duration.between(before.timestamp(), after.timestamp()).toNanos();
        final var fraction = (double) Duration.between(before.timestamp(), timestamp).toNanos() / span;

        final var azimuthStep = ((after.azimuth() - before.azimuth() + 540.0) % 360.0) - 180.0;
        final var azimuth = before.azimuth() + fraction * azimuthStep;
        final var elevation = before.elevation() + fraction * (after.elevation() - before.elevation());
        return new Pointing(((azimuth % 360.0) + 360.0) % 360.0, elevation);
    }
}
