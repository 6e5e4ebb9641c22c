package io.github.jakubt4.sdfits;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SDFITS converter: merges spectrometer, noise-power and antenna-pointing streams into
 * single-dish FITS tables.
 *
 * <p>Each scan directory holding spectrum and noise records plus an antenna log is turned into
 * one {@code <dir>/<dir>.fits} file with a {@code MATRIX} and a {@code NOISE} binary table.
 * Pointing is converted from horizontal to equatorial and galactic coordinates with Orekit.
 *
 * @see io.github.jakubt4.sdfits.service.ConversionOrchestrator
 * @see io.github.jakubt4.sdfits.runner.ConversionCommandLineRunner
 */
@SpringBootApplication
public class SdfitsApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SdfitsApplication.class, args)));
    }
}
