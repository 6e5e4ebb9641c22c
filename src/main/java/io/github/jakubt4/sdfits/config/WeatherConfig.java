package io.github.jakubt4.sdfits.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Ambient conditions recorded in the table headers.
 *
 * <p>Unset values fall back to the standard atmosphere used by the SLALIB refraction code.
 * The values are informational only: the coordinate transform runs with refraction disabled.
 *
 * @param dewpoint           K
 * @param humidity           relative humidity, 0.0 - 1.0
 * @param pressure           hPa
 * @param outsideTemperature K
 * @param windDirection      degrees
 * @param windSpeed          m/s
 * @param atmosphericOpacity zenith opacity
 */
public record WeatherConfig(
        @DefaultValue("273.15") double dewpoint,
        @DefaultValue("0.5") double humidity,
        @DefaultValue("1013.25") double pressure,
        @DefaultValue("293.15") double outsideTemperature,
        @DefaultValue("0.0") double windDirection,
        @DefaultValue("0.0") double windSpeed,
        @DefaultValue("0.0") double atmosphericOpacity
) {

    public static WeatherConfig defaults() {
        return new WeatherConfig(273.15, 0.5, 1013.25, 293.15, 0.0, 0.0, 0.0);
    }
}
