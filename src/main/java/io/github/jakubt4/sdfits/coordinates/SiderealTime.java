package io.github.jakubt4.sdfits.coordinates;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

/**
 * Conversions between sidereal angles and the representations written to the tables.
 */
public final class SiderealTime {

    private SiderealTime() {
    }

    /**
     * @param angle sidereal angle in radians, any range
     * @return the angle as hours in [0, 24)
     */
    public static double toHours(final double angle) {
        final var hours = FastMath.toDegrees(MathUtils.normalizeAngle(angle, FastMath.PI)) / 15.0;
        return hours >= 24.0 ? 0.0 : hours;
    }

    /**
     * Packs decimal hours into the legacy {@code HHMMSS.sss} number used by the LST column,
     * e.g. 14h23m05.2s becomes {@code 142305.2}.
     */
    public static double toPackedSexagesimal(final double hours) {
        final var wholeHours = FastMath.floor(hours);
        final var minutesWithFraction = (hours - wholeHours) * 60.0;
        final var wholeMinutes = FastMath.floor(minutesWithFraction);
        final var seconds = (minutesWithFraction - wholeMinutes) * 60.0;
        return wholeHours * 10000.0 + wholeMinutes * 100.0 + seconds;
    }
}
