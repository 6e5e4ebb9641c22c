package io.github.jakubt4.sdfits.table;

import io.github.jakubt4.sdfits.config.SdfitsProperties;
import io.github.jakubt4.sdfits.config.SiteConfig;
import io.github.jakubt4.sdfits.config.WcsAxis;
import io.github.jakubt4.sdfits.config.WcsAxisConfig;
import io.github.jakubt4.sdfits.config.WeatherConfig;
import io.github.jakubt4.sdfits.coordinates.SkyPositions;
import io.github.jakubt4.sdfits.error.InconsistentSpectrumLengthException;
import io.github.jakubt4.sdfits.staging.ColumnBuffer;
import io.github.jakubt4.sdfits.staging.ConversionRun;
import io.github.jakubt4.sdfits.staging.StagedColumns;
import io.github.jakubt4.sdfits.staging.StagedRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the SDFITS {@code MATRIX} (spectra) and {@code NOISE} (noise power) tables of a
 * directory from its sorted staging buffers and transformed sky positions.
 *
 * <p>Both tables share one header routine and the column layout of {@link TableSchemas}.
 * The buffers must already hold exactly the rows accepted by the coordinate transform, in
 * the same order as {@code sky}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableAssembler {

    public static final String MATRIX = "MATRIX";
    public static final String NOISE = "NOISE";

    private static final DateTimeFormatter HEADER_DATE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    private final SiteConfig site;
    private final WeatherConfig weather;
    private final WcsAxisConfig axes;
    private final SdfitsProperties properties;
    private final Clock clock;

    /**
     * @throws InconsistentSpectrumLengthException if a spectrum's channel count differs from
     *                                             the first row's
     */
    public AssembledTable assembleSpectrumTable(final ConversionRun run, final SkyPositions sky) {
        final var rows = run.spectra();
        checkAligned(MATRIX, rows, sky);
        final var header = header(MATRIX, rows, sky);
        if (rows.isEmpty()) {
            return new AssembledTable(MATRIX, header, List.of(), 0);
        }

        final var spectra = rows.column(StagedColumns.SPECTRUM);
        final var channels = spectra.get(0).length;
        final var matrix = new float[spectra.size()][];
        for (var i = 0; i < matrix.length; i++) {
            final var spectrum = spectra.get(i);
            if (spectrum.length != channels) {
                throw new InconsistentSpectrumLengthException(i, channels, spectrum.length);
            }
            matrix[i] = spectrum;
        }

        final var values = commonValues(rows, sky);
        final var spectrumColumn = TableSchemas.spectrum(channels);
        values.put(spectrumColumn, new ColumnData.FloatVectors(matrix));
        log.debug("[{}] {} rows x {} channels", MATRIX, matrix.length, channels);
        return new AssembledTable(MATRIX, header, columns(TableSchemas.matrix(axes, channels), values), rows.size());
    }

    public AssembledTable assembleNoiseTable(final ConversionRun run, final SkyPositions sky) {
        final var rows = run.noise();
        checkAligned(NOISE, rows, sky);
        final var header = header(NOISE, rows, sky);
        if (rows.isEmpty()) {
            return new AssembledTable(NOISE, header, List.of(), 0);
        }

        final var values = commonValues(rows, sky);
        values.put(TableSchemas.NOISE, new ColumnData.Doubles(rows.doubles(StagedColumns.NOISE_POWER)));
        values.put(TableSchemas.ACCUMLEN, new ColumnData.Ints(
                rows.column(StagedColumns.ACCUMULATION_LENGTH).stream().mapToInt(Integer::intValue).toArray()));
        values.put(TableSchemas.SWFREQ, floats(rows.doubles(StagedColumns.SWITCHING_FREQUENCY)));
        values.put(TableSchemas.BLANKPER, floats(rows.doubles(StagedColumns.BLANKING_PERIOD)));
        log.debug("[{}] {} rows", NOISE, rows.size());
        return new AssembledTable(NOISE, header, columns(TableSchemas.noise(axes), values), rows.size());
    }

    /** Cards of the primary HDU. */
    public List<HeaderEntry> primaryHeader() {
        return List.of(
                new HeaderEntry("ORIGIN", site.origin(), "organisation creating the file"),
                new HeaderEntry("DATE", HEADER_DATE.format(clock.instant()), "file creation date (UTC)"),
                new HeaderEntry("OBJECT", properties.output().primaryObject(), "object name"),
                new HeaderEntry("TELESCOP", site.telescope(), "telescope name"),
                new HeaderEntry("INSTRUME", site.instrument(), "back-end name"),
                new HeaderEntry("EXTEND", Boolean.TRUE, "extensions follow"));
    }

    private <R extends StagedRow> List<HeaderEntry> header(final String extensionName, final ColumnBuffer<R> rows,
                                                           final SkyPositions sky) {
        final var header = new ArrayList<HeaderEntry>();
        header.add(new HeaderEntry("EXTNAME", extensionName, "name of this binary table extension"));
        header.add(HeaderEntry.of("EXTVER", 1));
        header.add(new HeaderEntry("NMATRIX", 1, "one data matrix per row"));
        header.add(new HeaderEntry("SCHEMAV", TableSchemas.VERSION, "column schema version"));
        header.add(HeaderEntry.of("ORIGIN", site.origin()));
        header.add(new HeaderEntry("DATE", HEADER_DATE.format(clock.instant()), "table creation date (UTC)"));
        if (!rows.isEmpty()) {
            header.add(new HeaderEntry("DATE-OBS", rows.column(StagedColumns.DATE_OBS).get(0), "first observation (UTC)"));
            header.add(HeaderEntry.of("OBJECT", truncate(rows.column(StagedColumns.OBJECT).get(0), TableSchemas.OBJECT_WIDTH)));
        }
        header.add(HeaderEntry.of("TELESCOP", site.telescope()));
        header.add(HeaderEntry.of("INSTRUME", site.instrument()));

        header.add(new HeaderEntry("MAXIS", axes.axes().size(), "number of virtual axes"));
        for (var i = 0; i < axes.axes().size(); i++) {
            final var axis = axes.axes().get(i);
            final var n = i + 1;
            var referenceValue = axis.referenceValue();
            if (!sky.isEmpty() && axis.isRa()) {
                referenceValue = sky.rightAscension()[0];
            } else if (!sky.isEmpty() && axis.isDec()) {
                referenceValue = sky.declination()[0];
            }
            header.add(HeaderEntry.of("MAXIS" + n, axis.length()));
            header.add(HeaderEntry.of("CTYPE" + n, axis.type()));
            header.add(HeaderEntry.of("CDELT" + n, axis.increment()));
            header.add(HeaderEntry.of("CRPIX" + n, axis.referencePixel()));
            header.add(HeaderEntry.of("CRVAL" + n, referenceValue));
        }

        header.add(new HeaderEntry("SITELONG", site.longitude(), "degrees east"));
        header.add(new HeaderEntry("SITELAT", site.latitude(), "degrees"));
        header.add(new HeaderEntry("SITEELEV", site.elevation(), "metres"));
        header.add(HeaderEntry.of("FOFFSET", 0.0));
        header.add(HeaderEntry.of("RESTFREQ", 1.0));
        header.add(HeaderEntry.of("VELO-LSR", 0.0));
        header.add(HeaderEntry.of("VELDEF", "RADI-LSR"));
        header.add(HeaderEntry.of("DELTAV", 0.0));
        header.add(new HeaderEntry("BEAMEFF", site.beamEfficiency(), "main-beam efficiency"));
        header.add(new HeaderEntry("FORWEFF", site.forwardEfficiency(), "forward efficiency"));
        header.add(HeaderEntry.of("EPOCH", 2000.0));
        header.add(new HeaderEntry("DEWPOINT", weather.dewpoint(), "K"));
        header.add(HeaderEntry.of("HUMIDITY", weather.humidity()));
        header.add(new HeaderEntry("PRESSURE", weather.pressure(), "hPa"));
        header.add(HeaderEntry.of("TAU-ATM", weather.atmosphericOpacity()));
        header.add(new HeaderEntry("TOUTSIDE", weather.outsideTemperature(), "K"));
        header.add(new HeaderEntry("WINDDIRE", weather.windDirection(), "degrees"));
        header.add(new HeaderEntry("WINDSPEE", weather.windSpeed(), "m/s"));

        final var obsMode = properties.output().obsMode();
        if (obsMode != null && !obsMode.isBlank()) {
            header.add(new HeaderEntry("OBSMODE", obsMode.trim(), "observing and switching mode"));
        }
        return header;
    }

    private <R extends StagedRow> Map<ColumnDefinition, ColumnData> commonValues(final ColumnBuffer<R> rows,
                                                                             final SkyPositions sky) {
        final var count = rows.size();
        final var values = new HashMap<ColumnDefinition, ColumnData>();
        values.put(TableSchemas.SCAN, new ColumnData.Strings(fixedWidth(rows.column(StagedColumns.SCAN), TableSchemas.SCAN_WIDTH)));
        values.put(TableSchemas.OBJECT, new ColumnData.Strings(fixedWidth(rows.column(StagedColumns.OBJECT), TableSchemas.OBJECT_WIDTH)));
        if (axes.hasRa()) {
            values.put(TableSchemas.crval(axes.axisNumber(WcsAxis.RA)), floats(sky.rightAscension()));
        }
        if (axes.hasDec()) {
            values.put(TableSchemas.crval(axes.axisNumber(WcsAxis.DEC)), floats(sky.declination()));
        }
        for (final var placeholder : TableSchemas.PLACEHOLDERS) {
            final var unset = new float[count];
            Arrays.fill(unset, Float.NaN);
            values.put(placeholder, new ColumnData.Floats(unset));
        }
        values.put(TableSchemas.ELEVATIO, floats(rows.doubles(StagedColumns.ELEVATION)));
        values.put(TableSchemas.AZIMUTH, floats(rows.doubles(StagedColumns.AZIMUTH)));
        values.put(TableSchemas.UT, new ColumnData.Doubles(rows.doubles(StagedColumns.UT)));
        values.put(TableSchemas.LST, new ColumnData.Doubles(sky.packedSiderealTime()));
        values.put(TableSchemas.OBSTIME, floats(rows.doubles(StagedColumns.OBSTIME)));
        return values;
    }

    private static List<TableColumn> columns(final List<ColumnDefinition> schema, final Map<ColumnDefinition, ColumnData> values) {
        final var columns = new ArrayList<TableColumn>(schema.size());
        for (final var definition : schema) {
            final var data = values.get(definition);
            if (data == null) {
                throw new IllegalStateException("No values for column " + definition.name());
            }
            columns.add(new TableColumn(definition, data));
        }
        return columns;
    }

    private static void checkAligned(final String table, final ColumnBuffer<?> rows, final SkyPositions sky) {
        if (rows.size() != sky.size()) {
            throw new IllegalArgumentException(table + " has " + rows.size() + " rows but "
                    + sky.size() + " sky positions");
        }
    }

    static String[] fixedWidth(final List<String> values, final int width) {
        final var padded = new String[values.size()];
        for (var i = 0; i < padded.length; i++) {
            final var value = values.get(i);
            padded[i] = value.length() >= width ? value.substring(0, width) : String.format("%-" + width + "s", value);
        }
        return padded;
    }

    // header string values are limited to one card
    static String truncate(final String value, final int width) {
        return value.length() > width ? value.substring(0, width) : value;
    }

    private static ColumnData.Floats floats(final double[] values) {
        final var result = new float[values.length];
        for (var i = 0; i < values.length; i++) {
            result[i] = (float) values[i];
        }
        return new ColumnData.Floats(result);
    }
}
