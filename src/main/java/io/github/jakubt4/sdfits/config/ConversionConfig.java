package io.github.jakubt4.sdfits.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Exposes the immutable site, weather and WCS descriptors built from {@link SdfitsProperties}.
 * They are created once at start-up and shared read-only by every directory conversion.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SdfitsProperties.class)
public class ConversionConfig {

    @Bean
    SiteConfig siteConfig(final SdfitsProperties properties) {
        final var site = properties.site();
        log.info("Site [{}] lat={} lon={} elev={} m, instrument [{}]",
                site.telescope(), site.latitude(), site.longitude(), site.elevation(), site.instrument());
        return site;
    }

    @Bean
    WeatherConfig weatherConfig(final SdfitsProperties properties) {
        return properties.weather();
    }

    @Bean
    WcsAxisConfig wcsAxisConfig(final SdfitsProperties properties) {
        return properties.wcs().toAxisConfig();
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
