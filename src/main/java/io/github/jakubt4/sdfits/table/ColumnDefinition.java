package io.github.jakubt4.sdfits.table;

import java.util.Objects;

/**
 * Name, cell type, width and unit of one output column.
 *
 * @param name  {@code TTYPE} value
 * @param type  cell type
 * @param width characters for {@link ColumnType#STRING}, channels for
 *              {@link ColumnType#FLOAT_VECTOR}, 1 otherwise
 * @param unit  {@code TUNIT} value, {@code null} when dimensionless
 */
public record ColumnDefinition(String name, ColumnType type, int width, String unit) {

    public ColumnDefinition {
        Objects.requireNonNull(name, "column name is required");
        Objects.requireNonNull(type, "column type is required");
        if (width < 1) {
            throw new IllegalArgumentException("Column " + name + " needs a positive width: " + width);
        }
    }

    public static ColumnDefinition scalar(final String name, final ColumnType type, final String unit) {
        return new ColumnDefinition(name, type, 1, unit);
    }

    /** {@code TFORM} notation, e.g. {@code 256A}, {@code 1D}, {@code 1024E}. */
    public String format() {
        return width + String.valueOf(type.formatCode());
    }
}
