package io.github.jakubt4.sdfits.staging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-oriented staging area: one list per named column, all of identical length.
 *
 * <p>{@link #append} derives every column value before touching any column, so a row either
 * lands in every column or in none. Rows can only be reordered or removed as a whole.
 *
 * @param <R> staged row type
 */
public final class ColumnBuffer<R> {

    private final Map<String, ColumnSpec<? super R, ?>> specs = new LinkedHashMap<>();
    private final Map<String, List<Object>> columns = new LinkedHashMap<>();
    private int size;

    /**
     * @param specs columns in order
     * @throws IllegalArgumentException on duplicate column names
     */
    public ColumnBuffer(final List<? extends ColumnSpec<? super R, ?>> specs) {
        for (final var spec : specs) {
            if (this.specs.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate column: " + spec.name());
            }
            columns.put(spec.name(), new ArrayList<>());
        }
    }

    /**
     * Appends one value to every column.
     *
     * @throws IllegalArgumentException if a column has no value for {@code row}; the buffer is
     *                                  left unchanged
     */
    public void append(final R row) {
        final var values = new Object[specs.size()];
        var i = 0;
        for (final var spec : specs.values()) {
            values[i++] = spec.extract(row);
        }
        i = 0;
        for (final var column : columns.values()) {
            column.add(values[i++]);
        }
        size++;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    /** Read-only view of the named column. */
    public List<Object> column(final String name) {
        final var column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return Collections.unmodifiableList(column);
    }

    /** Read-only, typed copy of a column. */
    public <T> List<T> column(final ColumnSpec<? super R, T> spec) {
        if (specs.get(spec.name()) != spec) {
            throw new IllegalArgumentException("Column " + spec.name() + " is not part of this buffer");
        }
        return columns.get(spec.name()).stream().map(spec.type()::cast).toList();
    }

    public double[] doubles(final ColumnSpec<? super R, Double> spec) {
        return column(spec).stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Keeps only the given rows, in the given order.
     *
     * @param rows indices into the current row order
     * @throws IndexOutOfBoundsException if an index is not a current row
     */
    public void retainRows(final int[] rows) {
        for (final var row : rows) {
            if (row < 0 || row >= size) {
                throw new IndexOutOfBoundsException("Row " + row + " outside buffer of size " + size);
            }
        }
        for (final var entry : columns.entrySet()) {
            final var source = entry.getValue();
            final var selected = new ArrayList<>(rows.length);
            for (final var row : rows) {
                selected.add(source.get(row));
            }
            entry.setValue(selected);
        }
        size = rows.length;
    }

    /**
     * Applies a permutation to every column: new row {@code i} is old row {@code permutation[i]}.
     */
    void reorder(final int[] permutation) {
        if (permutation.length != size) {
            throw new IllegalArgumentException("Permutation of length " + permutation.length
                    + " does not match buffer size " + size);
        }
        final var seen = new boolean[size];
        for (final var row : permutation) {
            if (row < 0 || row >= size || seen[row]) {
                throw new IllegalArgumentException("Not a permutation of 0.." + (size - 1));
            }
            seen[row] = true;
        }
        retainRows(permutation);
    }
}
