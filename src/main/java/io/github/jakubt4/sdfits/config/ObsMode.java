package io.github.jakubt4.sdfits.config;

import java.util.Set;

/**
 * Validation of the SDFITS {@code OBSMODE} keyword: an observation type followed by a
 * switching mode, e.g. {@code LINEPSSW}.
 */
public final class ObsMode {

    private static final Set<String> OBSERVATION_TYPES = Set.of("LINE", "CONT", "PULS");
    private static final Set<String> SWITCHING_MODES = Set.of("PSSW", "FQSW", "BMSW", "PLSW", "LDSW", "TLPW");

    private ObsMode() {
    }

    /**
     * @param obsMode candidate value, {@code null} or blank to omit the keyword
     * @throws IllegalArgumentException if the value is not a known combination
     */
    public static void validate(final String obsMode) {
        if (obsMode == null || obsMode.isBlank()) {
            return;
        }
        if (obsMode.length() != 8
                || !OBSERVATION_TYPES.contains(obsMode.substring(0, 4))
                || !SWITCHING_MODES.contains(obsMode.substring(4))) {
            throw new IllegalArgumentException("Unsupported OBSMODE: " + obsMode
                    + " (expected one of " + OBSERVATION_TYPES + " followed by one of " + SWITCHING_MODES + ")");
        }
    }
}
