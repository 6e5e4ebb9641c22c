package io.github.jakubt4.sdfits.service;

import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.jakubt4.sdfits.config.OrekitConfig;
import io.github.jakubt4.sdfits.config.SdfitsProperties;
import io.github.jakubt4.sdfits.config.SiteConfig;
import io.github.jakubt4.sdfits.config.WcsAxisConfig;
import io.github.jakubt4.sdfits.config.WeatherConfig;
import io.github.jakubt4.sdfits.coordinates.CoordinateTransformService;
import io.github.jakubt4.sdfits.error.InconsistentSpectrumLengthException;
import io.github.jakubt4.sdfits.fits.SdfitsFileWriter;
import io.github.jakubt4.sdfits.metadata.LookupMode;
import io.github.jakubt4.sdfits.reader.JsonRecordReader;
import io.github.jakubt4.sdfits.scan.DirectoryScanner;
import io.github.jakubt4.sdfits.scan.ScanDirectory;
import io.github.jakubt4.sdfits.staging.StreamCollector;
import io.github.jakubt4.sdfits.staging.TemporalSorter;
import io.github.jakubt4.sdfits.table.TableAssembler;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringJUnitConfig(classes = {OrekitConfig.class, CoordinateTransformService.class})
class ConversionPipelineTest {

    private static final Instant T0 = Instant.parse("2018-09-23T12:00:00Z");

    @Autowired
    private CoordinateTransformService transformService;

    private DirectoryScanner scanner;
    private ConversionPipeline pipeline;

    @TempDir
    Path root;

    @BeforeEach
    void setUp() {
        final var reader = new JsonRecordReader(JsonMapper.builder().findAndAddModules().build());
        final var properties = new SdfitsProperties(SiteConfig.defaults(), WeatherConfig.defaults(),
                new SdfitsProperties.Wcs(List.of()),
                new SdfitsProperties.Output(false, "LINEPSSW", "OBJECTID"),
                new SdfitsProperties.Metadata(LookupMode.NEAREST));
        final var assembler = new TableAssembler(SiteConfig.defaults(), WeatherConfig.defaults(),
                WcsAxisConfig.defaults(), properties, Clock.fixed(T0, ZoneOffset.UTC));
        scanner = new DirectoryScanner(reader);
        pipeline = new ConversionPipeline(reader, new StreamCollector(), new TemporalSorter(), transformService,
                assembler, new SdfitsFileWriter(), SiteConfig.defaults(), properties);
    }

    @Test
    void writesRowsInTimestampOrderRegardlessOfFileOrder() throws Exception {
        final var dir = scanDir("scan1");
        spectrum(dir, "a.spec.json", T0.plusSeconds(2), 3.0f);
        spectrum(dir, "b.spec.json", T0, 1.0f);
        spectrum(dir, "c.spec.json", T0.plusSeconds(1), 2.0f);
        noise(dir, "a.npow.json", T0.plusSeconds(1), 7.0);
        metadata(dir, "meta-data.json");

        final var result = pipeline.convert(scan(dir), false);

        assertThat(result.status()).isEqualTo(ConversionStatus.CONVERTED);
        assertThat(result.spectrumRows()).isEqualTo(3);
        assertThat(result.noiseRows()).isEqualTo(1);
        assertThat(result.metadata()).contains(dir.resolve("meta-data.json"));
        assertThat(result.outputFile()).isEqualTo(dir.resolve("scan1.fits"));
        try (Fits fits = new Fits(dir.resolve("scan1.fits").toFile())) {
            fits.read();
            final var matrix = (BinaryTableHDU) fits.getHDU(1);
            assertThat((double[]) matrix.getColumn("UT")).containsExactly(43200.0, 43201.0, 43202.0);
            final var spectra = (float[][]) matrix.getColumn("SPECTRUM");
            assertThat(spectra[0][0]).isEqualTo(1.0f);
            assertThat(spectra[1][0]).isEqualTo(2.0f);
            assertThat(spectra[2][0]).isEqualTo(3.0f);
            assertThat((float[]) matrix.getColumn("AZIMUTH")).containsExactly(100.0f, 101.0f, 102.0f);
            assertThat(matrix.getHeader().getStringValue("OBSMODE")).isEqualTo("LINEPSSW");

            final var noise = (BinaryTableHDU) fits.getHDU(2);
            assertThat((double[]) noise.getColumn("NOISE")).containsExactly(7.0);
        }
    }

    @Test
    void existingOutputIsLeftUntouched() throws IOException {
        final var dir = scanDir("scan1");
        spectrum(dir, "a.spec.json", T0, 1.0f);
        final var existing = Files.writeString(dir.resolve("scan1.fits"), "previous run");

        final var result = pipeline.convert(scan(dir), false);

        assertThat(result.status()).isEqualTo(ConversionStatus.SKIPPED_EXISTING_OUTPUT);
        assertThat(Files.readString(existing)).isEqualTo("previous run");
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).hasSize(2);
        }
    }

    @Test
    void overrideRebuildsExistingOutput() throws IOException {
        final var dir = scanDir("scan1");
        spectrum(dir, "a.spec.json", T0, 1.0f);
        final var existing = Files.writeString(dir.resolve("scan1.fits"), "previous run");

        final var result = pipeline.convert(scan(dir), true);

        assertThat(result.status()).isEqualTo(ConversionStatus.CONVERTED);
        assertThat(Files.size(existing)).isGreaterThan(2880L);
    }

    @Test
    void missingMetadataRecordsUnknownPointing() throws Exception {
        final var dir = scanDir("scan1");
        spectrum(dir, "a.spec.json", T0, 1.0f);
        spectrum(dir, "b.spec.json", T0.plusSeconds(1), 2.0f);

        final var result = pipeline.convert(scan(dir), false);

        assertThat(result.status()).isEqualTo(ConversionStatus.CONVERTED);
        assertThat(result.metadata()).isEmpty();
        try (Fits fits = new Fits(result.outputFile().toFile())) {
            fits.read();
            final var matrix = (BinaryTableHDU) fits.getHDU(1);
            assertThat((float[]) matrix.getColumn("AZIMUTH")).containsExactly(-1.0f, -1.0f);
            assertThat((float[]) matrix.getColumn("ELEVATIO")).containsExactly(-1.0f, -1.0f);
        }
    }

    @Test
    void malformedFileIsSkippedAndTheRestConverted() throws IOException {
        final var dir = scanDir("scan1");
        spectrum(dir, "a.spec.json", T0, 1.0f);
        final var broken = Files.writeString(dir.resolve("b.spec.json"), "{ not json");
        metadata(dir, "meta-data.json");

        final var result = pipeline.convert(scan(dir), false);

        assertThat(result.status()).isEqualTo(ConversionStatus.CONVERTED);
        assertThat(result.spectrumRows()).isEqualTo(1);
        assertThat(result.skippedFiles()).containsExactly(broken);
    }

    @Test
    void lastMetadataFileWinsWhenThereAreSeveral() throws IOException {
        final var dir = scanDir("scan1");
        spectrum(dir, "a.spec.json", T0, 1.0f);
        metadata(dir, "a.meta.json");
        metadata(dir, "b.meta.json");

        final var result = pipeline.convert(scan(dir), false);

        assertThat(result.metadata()).contains(dir.resolve("b.meta.json"));
    }

    @Test
    void longSourceNameStillConverts() throws Exception {
        final var dir = scanDir("longname");
        Files.writeString(dir.resolve("a.spec.json"), """
                {"timestamp":"%s","source":"%s","scan":"longname","spectrum":[1.0,2.0]}
                """.formatted(T0, "X".repeat(75)));

        final var result = pipeline.convert(scan(dir), false);

        assertThat(result.status()).isEqualTo(ConversionStatus.CONVERTED);
        try (Fits fits = new Fits(result.outputFile().toFile())) {
            fits.read();
            final var matrix = (BinaryTableHDU) fits.getHDU(1);
            assertThat(matrix.getHeader().getStringValue("OBJECT")).isEqualTo("XXXXXXXXXXXX");
        }
    }

    @Test
    void directoryWithoutRecordsIsSkipped() throws IOException {
        final var dir = scanDir("scan1");
        metadata(dir, "meta-data.json");

        final var result = pipeline.convert(scan(dir), false);

        assertThat(result.status()).isEqualTo(ConversionStatus.SKIPPED_NO_RECORDS);
        assertThat(dir.resolve("scan1.fits")).doesNotExist();
    }

    @Test
    void inconsistentSpectrumLengthWritesNothing() throws IOException {
        final var dir = scanDir("scan1");
        spectrum(dir, "a.spec.json", T0, 1.0f);
        Files.writeString(dir.resolve("b.spec.json"), """
                {"timestamp":"%s","source":"W3OH","scan":"scan1","spectrum":[1.0,2.0,3.0,4.0,5.0]}
                """.formatted(T0.plusSeconds(1)));
        final var scan = scan(dir);

        assertThatThrownBy(() -> pipeline.convert(scan, false))
                .isInstanceOf(InconsistentSpectrumLengthException.class);
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).noneMatch(file -> file.getFileName().toString().contains(".fits"));
        }
    }

    private ScanDirectory scan(final Path dir) {
        return scanner.scan(dir.toString()).get(0);
    }

    private Path scanDir(final String name) throws IOException {
        return Files.createDirectories(root.resolve(name));
    }

    private static void spectrum(final Path dir, final String name, final Instant timestamp, final float first)
            throws IOException {
        Files.writeString(dir.resolve(name), """
                {"timestamp":"%s","source":"W3OH","obsTime":1.0,"experiment":"exp","scan":"scan1",
                 "averages":16,"sampleSize":4,"spectrum":[%s,0.5,0.25]}
                """.formatted(timestamp, first));
    }

    private static void noise(final Path dir, final String name, final Instant timestamp, final double power)
            throws IOException {
        Files.writeString(dir.resolve(name), """
                {"timestamp":"%s","source":"W3OH","obsTime":1.0,"experiment":"exp","scan":"scan1",
                 "noisePower":%s,"accumulationLength":64,"switchingFrequency":80.0,"blankingPeriod":0.001}
                """.formatted(timestamp, power));
    }

    private static void metadata(final Path dir, final String name) throws IOException {
        Files.writeString(dir.resolve(name), """
                {"antennaPosition":[
                  {"time":"%s","fields":{"az":100.0,"el":45.0}},
                  {"time":"%s","fields":{"az":101.0,"el":45.0}},
                  {"time":"%s","fields":{"az":102.0,"el":45.0}}]}
                """.formatted(T0, T0.plusSeconds(1), T0.plusSeconds(2)));
    }
}
