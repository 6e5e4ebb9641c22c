package io.github.jakubt4.sdfits.reader;

import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.jakubt4.sdfits.error.MalformedRecordException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonRecordReaderTest {

    private final JsonRecordReader reader = new JsonRecordReader(JsonMapper.builder().findAndAddModules().build());

    @TempDir
    Path dir;

    @Test
    void classifiesFilesByName() {
        assertThat(reader.classify(Path.of("a/0001.spec.json"))).isEqualTo(FileKind.SPECTRUM);
        assertThat(reader.classify(Path.of("a/0001.npow.json"))).isEqualTo(FileKind.NOISE);
        assertThat(reader.classify(Path.of("a/meta-data.json"))).isEqualTo(FileKind.METADATA);
        assertThat(reader.classify(Path.of("a/antenna.meta.json"))).isEqualTo(FileKind.METADATA);
        assertThat(reader.classify(Path.of("a/a.FITS"))).isEqualTo(FileKind.OUTPUT);
        assertThat(reader.classify(Path.of("a/.a.fits.tmp"))).isEqualTo(FileKind.OTHER);
        assertThat(reader.classify(Path.of("a/notes.txt"))).isEqualTo(FileKind.OTHER);
    }

    @Test
    void readsSpectrum() throws IOException {
        final var file = write("0001.spec.json", """
                {"timestamp":"2018-09-23T12:00:00Z","source":"W3OH","obsTime":1.0,"experiment":"exp",
                 "scan":"scan1","averages":16,"sampleSize":4,"spectrum":[0.1,0.2,0.3]}
                """);

        final var record = reader.readSpectrum(file);

        assertThat(record.timestamp()).isEqualTo(Instant.parse("2018-09-23T12:00:00Z"));
        assertThat(record.sourceName()).isEqualTo("W3OH");
        assertThat(record.averages()).isEqualTo(16);
        assertThat(record.spectrum()).containsExactly(0.1f, 0.2f, 0.3f);
    }

    @Test
    void optionalSpectrumFieldsFallBackToDefaults() throws IOException {
        final var file = write("0002.spec.json", """
                {"timestamp":"2018-09-23T12:00:00Z","spectrum":[1.0]}
                """);

        final var record = reader.readSpectrum(file);

        assertThat(record.averages()).isEqualTo(1);
        assertThat(record.sampleSize()).isEqualTo(Float.BYTES);
        assertThat(record.obsTime()).isZero();
        assertThat(record.sourceName()).isNull();
    }

    @Test
    void readsNoisePower() throws IOException {
        final var file = write("0001.npow.json", """
                {"timestamp":"2018-09-23T12:00:01Z","source":"W3OH","obsTime":0.5,"experiment":"exp","scan":"scan1",
                 "noisePower":1.5,"accumulationLength":64,"switchingFrequency":80.0,"blankingPeriod":0.001}
                """);

        final var record = reader.readNoise(file);

        assertThat(record.noisePower()).isEqualTo(1.5);
        assertThat(record.accumulationLength()).isEqualTo(64);
        assertThat(record.switchingFrequency()).isEqualTo(80.0);
        assertThat(record.blankingPeriod()).isEqualTo(0.001);
    }

    @Test
    void readsAntennaLog() throws IOException {
        final var file = write("meta-data.json", """
                {"antennaPosition":[
                  {"time":"2018-09-23T12:00:00Z","fields":{"az":120.0,"el":45.0}},
                  {"time":"2018-09-23T12:00:10Z","fields":{"az":121.0,"el":45.5}}]}
                """);

        final var log = reader.readAntennaLog(file);

        assertThat(log).hasSize(2);
        assertThat(log.get(1).azimuth()).isEqualTo(121.0);
        assertThat(log.get(1).elevation()).isEqualTo(45.5);
    }

    @Test
    void spectrumWithoutTimestampIsMalformed() throws IOException {
        final var file = write("0003.spec.json", """
                {"source":"W3OH","spectrum":[1.0]}
                """);

        assertThatThrownBy(() -> reader.readSpectrum(file))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("timestamp")
                .satisfies(e -> assertThat(((MalformedRecordException) e).getFile()).isEqualTo(file));
    }

    @Test
    void invalidJsonIsMalformed() throws IOException {
        final var file = write("0004.npow.json", "{\"timestamp\": ");

        assertThatThrownBy(() -> reader.readNoise(file))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("invalid JSON");
    }

    @Test
    void emptyAntennaLogIsMalformed() throws IOException {
        final var file = write("meta-data.json", "{\"antennaPosition\":[]}");

        assertThatThrownBy(() -> reader.readAntennaLog(file)).isInstanceOf(MalformedRecordException.class);
    }

    @Test
    void missingFileIsMalformed() {
        assertThatThrownBy(() -> reader.readSpectrum(dir.resolve("absent.spec.json")))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("cannot read");
    }

    private Path write(final String name, final String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }
}
