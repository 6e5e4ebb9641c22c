package io.github.jakubt4.sdfits.coordinates;

/**
 * Batch result of the horizontal to equatorial/galactic transform. All angles in degrees,
 * sidereal time in hours.
 *
 * <p>Only samples that could be transformed are present; {@code sourceRows} maps each
 * result index back to the index of the input sample.
 *
 * @param sourceRows      input index of every transformed sample, ascending
 * @param rightAscension  ICRS right ascension in [0, 360)
 * @param declination     ICRS declination
 * @param galacticLongitude galactic longitude in [0, 360)
 * @param galacticLatitude  galactic latitude
 * @param siderealHours   local mean sidereal time in [0, 24)
 * @param inputCount      number of samples submitted
 */
public record SkyPositions(
        int[] sourceRows,
        double[] rightAscension,
        double[] declination,
        double[] galacticLongitude,
        double[] galacticLatitude,
        double[] siderealHours,
        int inputCount
) {

    public int size() {
        return sourceRows.length;
    }

    public boolean isEmpty() {
        return sourceRows.length == 0;
    }

    public int rejectedCount() {
        return inputCount - sourceRows.length;
    }

    /** LST column values in the packed {@code HHMMSS.sss} encoding. */
    public double[] packedSiderealTime() {
        final var packed = new double[siderealHours.length];
        for (var i = 0; i < packed.length; i++) {
            packed[i] = SiderealTime.toPackedSexagesimal(siderealHours[i]);
        }
        return packed;
    }
}
