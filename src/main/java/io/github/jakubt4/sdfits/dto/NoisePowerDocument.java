package io.github.jakubt4.sdfits.dto;

import java.time.Instant;

/**
 * JSON form of a noise-power file ({@code *.npow.json}).
 *
 * @param timestamp          start of the accumulation, UTC (required)
 * @param source             observed source
 * @param obsTime            integration time in seconds
 * @param experiment         experiment name
 * @param scan               scan name
 * @param noisePower         measured noise power (required)
 * @param accumulationLength number of accumulations
 * @param switchingFrequency noise diode switching frequency, Hz
 * @param blankingPeriod     noise diode blanking period, s
 */
public record NoisePowerDocument(
        Instant timestamp,
        String source,
        Double obsTime,
        String experiment,
        String scan,
        Double noisePower,
        Integer accumulationLength,
        Double switchingFrequency,
        Double blankingPeriod
) {
}
