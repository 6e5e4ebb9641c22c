package io.github.jakubt4.sdfits.staging;

import java.util.Objects;
import java.util.function.Function;

/**
 * Typed key of one {@link ColumnBuffer} column: its name, value type and how the value is
 * taken from a staged row.
 *
 * @param name      column name, unique within a buffer
 * @param type      value type
 * @param extractor derives the column value from a row; must not return {@code null}
 * @param <R>       row type
 * @param <T>       value type
 */
public record ColumnSpec<R, T>(String name, Class<T> type, Function<? super R, ? extends T> extractor) {

    public ColumnSpec {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(extractor, "extractor is required");
    }

    public static <R, T> ColumnSpec<R, T> of(final String name, final Class<T> type,
                                             final Function<? super R, ? extends T> extractor) {
        return new ColumnSpec<>(name, type, extractor);
    }

    T extract(final R row) {
        final T value = extractor.apply(row);
        if (value == null) {
            throw new IllegalArgumentException("Column " + name + " has no value for row " + row);
        }
        return value;
    }
}
