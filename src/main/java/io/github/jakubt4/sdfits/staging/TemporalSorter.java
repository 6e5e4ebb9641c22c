package io.github.jakubt4.sdfits.staging;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Reorders whole rows of a {@link ColumnBuffer} by one key column.
 */
@Component
public class TemporalSorter {

    /**
     * Sorts {@code buffer} ascending by {@code key} and applies the same permutation to every
     * column. The sort is stable: rows with equal keys keep their insertion order.
     *
     * @param buffer buffer to sort in place
     * @param key    sort key column
     * @param <R>    row type
     * @param <T>    key type
     */
    public <R, T extends Comparable<? super T>> void sortBy(final ColumnBuffer<R> buffer,
                                                            final ColumnSpec<? super R, T> key) {
        final var keys = buffer.column(key);
        final var order = IntStream.range(0, keys.size()).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparing((Integer row) -> keys.get(row)));
        buffer.reorder(Arrays.stream(order).mapToInt(Integer::intValue).toArray());
    }
}
