package io.github.jakubt4.sdfits.table;

import java.util.Objects;

/**
 * A column definition together with its cell values. The values' variant must match the
 * definition's {@link ColumnType}.
 */
public record TableColumn(ColumnDefinition definition, ColumnData data) {

    public TableColumn {
        Objects.requireNonNull(data, () -> "Column " + definition.name() + " needs data");
        if (data.type() != definition.type()) {
            throw new IllegalArgumentException("Column " + definition.name() + " is " + definition.type()
                    + " but got " + data.type() + " values");
        }
    }

    public TableColumn(final ColumnDefinition definition, final String[] values) {
        this(definition, new ColumnData.Strings(values));
    }

    public TableColumn(final ColumnDefinition definition, final float[] values) {
        this(definition, new ColumnData.Floats(values));
    }

    public TableColumn(final ColumnDefinition definition, final double[] values) {
        this(definition, new ColumnData.Doubles(values));
    }

    public TableColumn(final ColumnDefinition definition, final int[] values) {
        this(definition, new ColumnData.Ints(values));
    }

    public TableColumn(final ColumnDefinition definition, final float[][] values) {
        this(definition, new ColumnData.FloatVectors(values));
    }

    public String name() {
        return definition.name();
    }

    public int rowCount() {
        return data.rowCount();
    }
}
