package io.github.jakubt4.sdfits.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Objects;

/**
 * Observatory and instrument description shared by every table of a run.
 *
 * <p>Angles in degrees (east longitude positive), elevation in metres above the WGS-84
 * ellipsoid. Out-of-range coordinates are rejected at construction so that no coordinate
 * transform ever sees an invalid site.
 *
 * @param origin            organisation written to {@code ORIGIN}
 * @param latitude          geodetic latitude
 * @param longitude         east longitude
 * @param elevation         height in metres
 * @param telescope         telescope name written to {@code TELESCOP}
 * @param instrument        back-end name written to {@code INSTRUME}
 * @param beamEfficiency    main-beam efficiency
 * @param forwardEfficiency forward efficiency
 */
public record SiteConfig(
        @DefaultValue("Haystack Observatory") String origin,
        @DefaultValue("42.62333333") double latitude,
        @DefaultValue("-71.48833333") double longitude,
        @DefaultValue("131") double elevation,
        @DefaultValue("Westford") String telescope,
        @DefaultValue("GPU spectrometer") String instrument,
        @DefaultValue("1.0") double beamEfficiency,
        @DefaultValue("1.0") double forwardEfficiency
) {

    public SiteConfig {
        Objects.requireNonNull(origin, "origin is required");
        Objects.requireNonNull(telescope, "telescope is required");
        Objects.requireNonNull(instrument, "instrument is required");
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("Site latitude out of range [-90, 90]: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude >= 360.0) {
            throw new IllegalArgumentException("Site longitude out of range [-180, 360): " + longitude);
        }
        if (!Double.isFinite(elevation)) {
            throw new IllegalArgumentException("Site elevation must be finite: " + elevation);
        }
    }

    /** The Westford antenna at Haystack Observatory. */
    public static SiteConfig defaults() {
        return new SiteConfig("Haystack Observatory", 42.62333333, -71.48833333, 131.0,
                "Westford", "GPU spectrometer", 1.0, 1.0);
    }
}
