package io.github.jakubt4.sdfits.config;

import java.util.List;

/**
 * Ordered WCS virtual-axis descriptors, at most {@value #MAX_AXES}.
 */
public record WcsAxisConfig(List<WcsAxis> axes) {

    public static final int MAX_AXES = 4;

    public WcsAxisConfig {
        axes = List.copyOf(axes);
        if (axes.isEmpty() || axes.size() > MAX_AXES) {
            throw new IllegalArgumentException("Between 1 and " + MAX_AXES + " WCS axes required, got " + axes.size());
        }
    }

    /** Frequency, RA, Dec and Stokes, with a two-pixel frequency axis referenced at pixel 1. */
    public static WcsAxisConfig defaults() {
        return new WcsAxisConfig(List.of(
                new WcsAxis("FREQ", 2, 0.0, 1.0, 1.0),
                new WcsAxis(WcsAxis.RA, 1, 0.0, 0.0, 0.0),
                new WcsAxis(WcsAxis.DEC, 1, 0.0, 0.0, 0.0),
                new WcsAxis("STOKES", 1, 0.0, 0.0, 0.0)
        ));
    }

    public boolean hasRa() {
        return axes.stream().anyMatch(WcsAxis::isRa);
    }

    public boolean hasDec() {
        return axes.stream().anyMatch(WcsAxis::isDec);
    }

    /** FITS axis number (1-based) of the first axis of the given type, or 0 when absent. */
    public int axisNumber(final String type) {
        for (var i = 0; i < axes.size(); i++) {
            if (axes.get(i).type().equals(type)) {
                return i + 1;
            }
        }
        return 0;
    }
}
