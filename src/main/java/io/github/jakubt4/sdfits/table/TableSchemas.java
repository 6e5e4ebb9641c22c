package io.github.jakubt4.sdfits.table;

import io.github.jakubt4.sdfits.config.WcsAxis;
import io.github.jakubt4.sdfits.config.WcsAxisConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Column layout of the {@code MATRIX} and {@code NOISE} tables.
 *
 * <p>The layout is versioned; {@link #VERSION} is written to every table header as
 * {@code SCHEMAV}. Changing a name, type, unit or position requires a new version.
 */
public final class TableSchemas {

    public static final int VERSION = 1;

    public static final int SCAN_WIDTH = 256;
    public static final int OBJECT_WIDTH = 12;

    public static final String DEGREES = "degrees";
    public static final String POWER = "power";

    public static final ColumnDefinition SCAN = new ColumnDefinition("SCAN", ColumnType.STRING, SCAN_WIDTH, null);
    public static final ColumnDefinition OBJECT = new ColumnDefinition("OBJECT", ColumnType.STRING, OBJECT_WIDTH, null);
    public static final ColumnDefinition TSYS = ColumnDefinition.scalar("TSYS", ColumnType.FLOAT, "K");
    public static final ColumnDefinition IMAGFREQ = ColumnDefinition.scalar("IMAGFREQ", ColumnType.FLOAT, "Hz");
    public static final ColumnDefinition TAU_ATM = ColumnDefinition.scalar("TAU-ATM", ColumnType.FLOAT, null);
    public static final ColumnDefinition MH2O = ColumnDefinition.scalar("MH2O", ColumnType.FLOAT, null);
    public static final ColumnDefinition PRESSURE = ColumnDefinition.scalar("PRESSURE", ColumnType.FLOAT, "hPa");
    public static final ColumnDefinition TCHOP = ColumnDefinition.scalar("TCHOP", ColumnType.FLOAT, "K");
    public static final ColumnDefinition ELEVATIO = ColumnDefinition.scalar("ELEVATIO", ColumnType.FLOAT, DEGREES);
    public static final ColumnDefinition AZIMUTH = ColumnDefinition.scalar("AZIMUTH", ColumnType.FLOAT, DEGREES);
    public static final ColumnDefinition UT = ColumnDefinition.scalar("UT", ColumnType.DOUBLE, null);
    public static final ColumnDefinition LST = ColumnDefinition.scalar("LST", ColumnType.DOUBLE, null);
    public static final ColumnDefinition OBSTIME = ColumnDefinition.scalar("OBSTIME", ColumnType.FLOAT, "seconds");

    public static final ColumnDefinition NOISE = ColumnDefinition.scalar("NOISE", ColumnType.DOUBLE, POWER);
    public static final ColumnDefinition ACCUMLEN = ColumnDefinition.scalar("ACCUMLEN", ColumnType.INT, null);
    public static final ColumnDefinition SWFREQ = ColumnDefinition.scalar("SWFREQ", ColumnType.FLOAT, "Hz");
    public static final ColumnDefinition BLANKPER = ColumnDefinition.scalar("BLANKPER", ColumnType.FLOAT, "s");

    /** Columns that have no source stream yet and are filled with NaN. */
    public static final List<ColumnDefinition> PLACEHOLDERS = List.of(TSYS, IMAGFREQ, TAU_ATM, MH2O, PRESSURE, TCHOP);

    private TableSchemas() {
    }

    /** {@code CRVALn} column for the WCS axis numbered {@code axisNumber}. */
    public static ColumnDefinition crval(final int axisNumber) {
        return ColumnDefinition.scalar("CRVAL" + axisNumber, ColumnType.FLOAT, DEGREES);
    }

    /** {@code SPECTRUM} column holding {@code channels} values per row. */
    public static ColumnDefinition spectrum(final int channels) {
        return new ColumnDefinition("SPECTRUM", ColumnType.FLOAT_VECTOR, channels, POWER);
    }

    /** Columns shared by both tables, in order. */
    public static List<ColumnDefinition> common(final WcsAxisConfig axes) {
        final var columns = new ArrayList<ColumnDefinition>();
        columns.add(SCAN);
        columns.add(OBJECT);
        if (axes.hasRa()) {
            columns.add(crval(axes.axisNumber(WcsAxis.RA)));
        }
        if (axes.hasDec()) {
            columns.add(crval(axes.axisNumber(WcsAxis.DEC)));
        }
        columns.addAll(PLACEHOLDERS);
        columns.addAll(List.of(ELEVATIO, AZIMUTH, UT, LST, OBSTIME));
        return columns;
    }

    public static List<ColumnDefinition> matrix(final WcsAxisConfig axes, final int channels) {
        final var columns = common(axes);
        columns.add(spectrum(channels));
        return List.copyOf(columns);
    }

    public static List<ColumnDefinition> noise(final WcsAxisConfig axes) {
        final var columns = common(axes);
        columns.addAll(List.of(NOISE, ACCUMLEN, SWFREQ, BLANKPER));
        return List.copyOf(columns);
    }
}
