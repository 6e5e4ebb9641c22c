package io.github.jakubt4.sdfits.config;

import io.github.jakubt4.sdfits.metadata.LookupMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Externalised configuration bound from the {@code sdfits.*} namespace.
 *
 * <p>Every group defaults to the legacy converter's constants, so an empty
 * {@code application.yml} yields the Westford/Haystack setup.
 */
@ConfigurationProperties(prefix = "sdfits")
public record SdfitsProperties(
        @DefaultValue SiteConfig site,
        @DefaultValue WeatherConfig weather,
        @DefaultValue Wcs wcs,
        @DefaultValue Output output,
        @DefaultValue Metadata metadata
) {

    /**
     * @param axes WCS axes in FITS order; empty selects {@link WcsAxisConfig#defaults()}
     */
    public record Wcs(@DefaultValue List<WcsAxis> axes) {

        public WcsAxisConfig toAxisConfig() {
            return axes == null || axes.isEmpty() ? WcsAxisConfig.defaults() : new WcsAxisConfig(axes);
        }
    }

    /**
     * @param override      rebuild directories that already hold an output artifact
     * @param obsMode       value of {@code OBSMODE}, blank to omit it
     * @param primaryObject {@code OBJECT} of the primary header
     */
    public record Output(
            @DefaultValue("false") boolean override,
            @DefaultValue("LINEPSSW") String obsMode,
            @DefaultValue("OBJECTID") String primaryObject
    ) {

        public Output {
            ObsMode.validate(obsMode);
        }
    }

    /**
     * @param lookup how antenna positions are looked up between log samples
     */
    public record Metadata(@DefaultValue("NEAREST") LookupMode lookup) {
    }
}
