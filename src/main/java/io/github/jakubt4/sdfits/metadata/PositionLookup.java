package io.github.jakubt4.sdfits.metadata;

import io.github.jakubt4.sdfits.model.Pointing;

import java.time.Instant;

/**
 * Point-in-time query against an antenna position log.
 */
@FunctionalInterface
public interface PositionLookup {

    /**
     * @param timestamp query instant, UTC
     * @return the antenna pointing associated with {@code timestamp}; never {@code null}
     */
    Pointing positionAt(Instant timestamp);
}
