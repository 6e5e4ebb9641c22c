package io.github.jakubt4.sdfits.dto;

import java.time.Instant;
import java.util.List;

/**
 * JSON form of a scan's metadata file; only the antenna position log is consumed.
 */
public record MetadataDocument(List<PositionEntry> antennaPosition) {

    /**
     * @param time   sample time, UTC
     * @param fields sampled values
     */
    public record PositionEntry(Instant time, Fields fields) {
    }

    /**
     * @param az azimuth, degrees
     * @param el elevation, degrees
     */
    public record Fields(Double az, Double el) {
    }
}
