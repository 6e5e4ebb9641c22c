package io.github.jakubt4.sdfits.staging;

import java.time.Instant;
import java.util.List;

/**
 * Column catalogue of the spectrum and noise staging buffers.
 */
public final class StagedColumns {

    public static final ColumnSpec<StagedRow, Instant> TIMESTAMP =
            ColumnSpec.of("datetime", Instant.class, StagedRow::timestamp);
    public static final ColumnSpec<StagedRow, String> DATE_OBS =
            ColumnSpec.of("date-obs", String.class, StagedRow::dateObs);
    public static final ColumnSpec<StagedRow, Double> UT =
            ColumnSpec.of("ut", Double.class, StagedRow::ut);
    public static final ColumnSpec<StagedRow, String> OBJECT =
            ColumnSpec.of("object", String.class, StagedRow::object);
    public static final ColumnSpec<StagedRow, Double> OBSTIME =
            ColumnSpec.of("obstime", Double.class, StagedRow::obsTime);
    public static final ColumnSpec<StagedRow, String> EXPERIMENT =
            ColumnSpec.of("experiment", String.class, StagedRow::experiment);
    public static final ColumnSpec<StagedRow, String> SCAN =
            ColumnSpec.of("scan", String.class, StagedRow::scan);
    public static final ColumnSpec<StagedRow, Double> AZIMUTH =
            ColumnSpec.of("az", Double.class, StagedRow::azimuth);
    public static final ColumnSpec<StagedRow, Double> ELEVATION =
            ColumnSpec.of("el", Double.class, StagedRow::elevation);

    public static final ColumnSpec<SpectrumRow, Integer> AVERAGES =
            ColumnSpec.of("navg", Integer.class, SpectrumRow::averages);
    public static final ColumnSpec<SpectrumRow, Integer> SPECTRUM_LENGTH =
            ColumnSpec.of("spec_len", Integer.class, SpectrumRow::spectrumLength);
    public static final ColumnSpec<SpectrumRow, Integer> SAMPLE_SIZE =
            ColumnSpec.of("spec_data_type", Integer.class, SpectrumRow::sampleSize);
    public static final ColumnSpec<SpectrumRow, float[]> SPECTRUM =
            ColumnSpec.of("spec", float[].class, SpectrumRow::spectrum);

    public static final ColumnSpec<NoiseRow, Double> NOISE_POWER =
            ColumnSpec.of("noise", Double.class, NoiseRow::noisePower);
    public static final ColumnSpec<NoiseRow, Integer> ACCUMULATION_LENGTH =
            ColumnSpec.of("accum_len", Integer.class, NoiseRow::accumulationLength);
    public static final ColumnSpec<NoiseRow, Double> SWITCHING_FREQUENCY =
            ColumnSpec.of("switch_freq", Double.class, NoiseRow::switchingFrequency);
    public static final ColumnSpec<NoiseRow, Double> BLANKING_PERIOD =
            ColumnSpec.of("blanking_per", Double.class, NoiseRow::blankingPeriod);

    public static final List<ColumnSpec<? super SpectrumRow, ?>> SPECTRUM_COLUMNS = List.of(
            TIMESTAMP, DATE_OBS, UT, OBJECT, OBSTIME, EXPERIMENT, SCAN,
            AVERAGES, SPECTRUM_LENGTH, SAMPLE_SIZE, SPECTRUM, AZIMUTH, ELEVATION);

    public static final List<ColumnSpec<? super NoiseRow, ?>> NOISE_COLUMNS = List.of(
            TIMESTAMP, DATE_OBS, UT, OBJECT, OBSTIME, EXPERIMENT, SCAN,
            ACCUMULATION_LENGTH, SWITCHING_FREQUENCY, BLANKING_PERIOD, NOISE_POWER, AZIMUTH, ELEVATION);

    private StagedColumns() {
    }
}
