package io.github.jakubt4.sdfits.table;

import io.github.jakubt4.sdfits.config.SdfitsProperties;
import io.github.jakubt4.sdfits.config.SiteConfig;
import io.github.jakubt4.sdfits.config.WcsAxis;
import io.github.jakubt4.sdfits.config.WcsAxisConfig;
import io.github.jakubt4.sdfits.config.WeatherConfig;
import io.github.jakubt4.sdfits.coordinates.SkyPositions;
import io.github.jakubt4.sdfits.error.InconsistentSpectrumLengthException;
import io.github.jakubt4.sdfits.metadata.LookupMode;
import io.github.jakubt4.sdfits.staging.ConversionRun;
import io.github.jakubt4.sdfits.staging.NoiseRow;
import io.github.jakubt4.sdfits.staging.SpectrumRow;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableAssemblerTest {

    private static final Instant T0 = Instant.parse("2018-09-23T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2020-01-02T03:04:05Z"), ZoneOffset.UTC);

    @Test
    void spectrumHeaderFollowsTheSdfitsKeywordOrder() {
        final var run = runWithSpectra(128, 128);

        final var table = assembler("LINEPSSW").assembleSpectrumTable(run, sky(2));

        assertThat(table.extensionName()).isEqualTo("MATRIX");
        assertThat(table.header()).extracting(HeaderEntry::keyword).containsSubsequence(
                "EXTNAME", "EXTVER", "NMATRIX", "SCHEMAV", "ORIGIN", "DATE", "DATE-OBS", "OBJECT",
                "TELESCOP", "INSTRUME", "MAXIS",
                "MAXIS1", "CTYPE1", "CDELT1", "CRPIX1", "CRVAL1",
                "MAXIS4", "CTYPE4", "CDELT4", "CRPIX4", "CRVAL4",
                "SITELONG", "SITELAT", "SITEELEV", "FOFFSET", "RESTFREQ", "VELO-LSR", "VELDEF", "DELTAV",
                "BEAMEFF", "FORWEFF", "EPOCH", "DEWPOINT", "HUMIDITY", "PRESSURE", "TAU-ATM",
                "TOUTSIDE", "WINDDIRE", "WINDSPEE", "OBSMODE");
        assertThat(table.headerValue("DATE")).contains("2020-01-02T03:04:05");
        assertThat(table.headerValue("DATE-OBS")).contains("2018-09-23T12:00:00");
        assertThat(table.headerValue("TELESCOP")).contains("Westford");
        assertThat(table.headerValue("SCHEMAV")).contains(TableSchemas.VERSION);
        assertThat(table.headerValue("MAXIS")).contains(4);
    }

    @Test
    void raAndDecReferenceValuesComeFromTheFirstRow() {
        final var table = assembler("LINEPSSW").assembleSpectrumTable(runWithSpectra(4, 4), sky(2));

        assertThat(table.headerValue("CRVAL2")).contains(10.0);
        assertThat(table.headerValue("CRVAL3")).contains(40.0);
        assertThat(table.headerValue("CRVAL1")).contains(0.0);
    }

    @Test
    void spectrumColumnsFollowSchemaVersionOne() {
        final var table = assembler("LINEPSSW").assembleSpectrumTable(runWithSpectra(4, 4), sky(2));

        assertThat(table.columns()).extracting(TableColumn::name).containsExactly(
                "SCAN", "OBJECT", "CRVAL2", "CRVAL3", "TSYS", "IMAGFREQ", "TAU-ATM", "MH2O", "PRESSURE",
                "TCHOP", "ELEVATIO", "AZIMUTH", "UT", "LST", "OBSTIME", "SPECTRUM");
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.column("SPECTRUM").orElseThrow().definition().format()).isEqualTo("4E");
        assertThat(table.column("SCAN").orElseThrow().definition().format()).isEqualTo("256A");

        final var scan = ((ColumnData.Strings) table.column("SCAN").orElseThrow().data()).values();
        assertThat(scan[0]).hasSize(256).startsWith("scan1 ");
        final var object = ((ColumnData.Strings) table.column("OBJECT").orElseThrow().data()).values();
        assertThat(object[0]).isEqualTo("W3OH-LONG-NA");
        final var tsys = ((ColumnData.Floats) table.column("TSYS").orElseThrow().data()).values();
        assertThat(tsys[0]).isNaN();
        final var ra = ((ColumnData.Floats) table.column("CRVAL2").orElseThrow().data()).values();
        assertThat(ra).containsExactly(10.0f, 11.0f);
    }

    @Test
    void inconsistentSpectrumLengthFailsTheTable() {
        final var run = runWithSpectra(128, 128, 256);

        assertThatThrownBy(() -> assembler("LINEPSSW").assembleSpectrumTable(run, sky(3)))
                .isInstanceOfSatisfying(InconsistentSpectrumLengthException.class, e -> {
                    assertThat(e.getRow()).isEqualTo(2);
                    assertThat(e.getExpectedLength()).isEqualTo(128);
                    assertThat(e.getActualLength()).isEqualTo(256);
                });
    }

    @Test
    void noiseTableCarriesNoiseColumns() {
        final var run = new ConversionRun(Path.of("scan1"), null, null);
        run.noise().append(new NoiseRow(T0, "2018-09-23T12:00:00", 43200.0, "W3OH", 1.0, "exp", "scan1",
                120.0, 45.0, 1.5, 64, 80.0, 0.001));

        final var table = assembler("").assembleNoiseTable(run, sky(1));

        assertThat(table.extensionName()).isEqualTo("NOISE");
        assertThat(table.columns()).extracting(TableColumn::name)
                .endsWith("OBSTIME", "NOISE", "ACCUMLEN", "SWFREQ", "BLANKPER");
        assertThat(((ColumnData.Doubles) table.column("NOISE").orElseThrow().data()).values()).containsExactly(1.5);
        assertThat(((ColumnData.Ints) table.column("ACCUMLEN").orElseThrow().data()).values()).containsExactly(64);
        assertThat(table.headerValue("OBSMODE")).isEmpty();
    }

    @Test
    void emptyStreamYieldsHeaderOnlyTable() {
        final var run = new ConversionRun(Path.of("scan1"), null, null);

        final var table = assembler("LINEPSSW").assembleNoiseTable(run, sky(0));

        assertThat(table.rowCount()).isZero();
        assertThat(table.columns()).isEmpty();
        assertThat(table.headerValue("DATE-OBS")).isEmpty();
        assertThat(table.headerValue("CRVAL2")).contains(0.0);
    }

    @Test
    void columnsFollowConfiguredAxes() {
        final var axes = new WcsAxisConfig(List.of(
                new WcsAxis("FREQ", 2, 0.0, 1.0, 1.0),
                new WcsAxis(WcsAxis.DEC, 1, 0.0, 0.0, 0.0)));
        final var assembler = new TableAssembler(SiteConfig.defaults(), WeatherConfig.defaults(), axes,
                properties("LINEPSSW"), CLOCK);

        final var table = assembler.assembleSpectrumTable(runWithSpectra(4), sky(1));

        assertThat(table.columns()).extracting(TableColumn::name)
                .startsWith("SCAN", "OBJECT", "CRVAL2", "TSYS")
                .doesNotContain("CRVAL3");
        assertThat(table.headerValue("CRVAL2")).contains(40.0);
    }

    @Test
    void longSourceNameIsTruncatedInTheObjectCard() {
        final var run = new ConversionRun(Path.of("scan1"), null, null);
        run.spectra().append(new SpectrumRow(T0, "2018-09-23T12:00:00", 43200.0, "X".repeat(75), 1.0, "exp",
                "scan1", 120.0, 45.0, 16, 4, 4, new float[4]));

        final var table = assembler("LINEPSSW").assembleSpectrumTable(run, sky(1));

        assertThat(table.headerValue("OBJECT")).contains("X".repeat(TableSchemas.OBJECT_WIDTH));
    }

    @Test
    void columnValuesMustMatchTheDeclaredType() {
        assertThatThrownBy(() -> new TableColumn(TableSchemas.UT, new float[]{1.0f}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("UT");
    }

    @Test
    void primaryHeaderNamesTheInstrument() {
        final var header = assembler("LINEPSSW").primaryHeader();

        assertThat(header).extracting(HeaderEntry::keyword)
                .containsExactly("ORIGIN", "DATE", "OBJECT", "TELESCOP", "INSTRUME", "EXTEND");
        assertThat(header.get(2).value()).isEqualTo("OBJECTID");
    }

    private static TableAssembler assembler(final String obsMode) {
        return new TableAssembler(SiteConfig.defaults(), WeatherConfig.defaults(), WcsAxisConfig.defaults(),
                properties(obsMode), CLOCK);
    }

    private static SdfitsProperties properties(final String obsMode) {
        return new SdfitsProperties(SiteConfig.defaults(), WeatherConfig.defaults(),
                new SdfitsProperties.Wcs(List.of()),
                new SdfitsProperties.Output(false, obsMode, "OBJECTID"),
                new SdfitsProperties.Metadata(LookupMode.NEAREST));
    }

    private static ConversionRun runWithSpectra(final int... lengths) {
        final var run = new ConversionRun(Path.of("scan1"), null, null);
        for (var i = 0; i < lengths.length; i++) {
            final var timestamp = T0.plusSeconds(i);
            run.spectra().append(new SpectrumRow(timestamp, "2018-09-23T12:00:0" + i, 43200.0 + i,
                    "W3OH-LONG-NAME", 1.0, "exp", "scan1", 120.0, 45.0, 16, lengths[i], 4, new float[lengths[i]]));
        }
        return run;
    }

    private static SkyPositions sky(final int rows) {
        final var index = new int[rows];
        final var ra = new double[rows];
        final var dec = new double[rows];
        final var lst = new double[rows];
        for (var i = 0; i < rows; i++) {
            index[i] = i;
            ra[i] = 10.0 + i;
            dec[i] = 40.0 + i;
            lst[i] = 14.5;
        }
        return new SkyPositions(index, ra, dec, ra.clone(), dec.clone(), lst, rows);
    }
}
