package io.github.jakubt4.sdfits.table;

/**
 * Cell values of one column, one variant per {@link ColumnType}.
 */
public sealed interface ColumnData
        permits ColumnData.Strings, ColumnData.Floats, ColumnData.Doubles, ColumnData.Ints, ColumnData.FloatVectors {

    ColumnType type();

    int rowCount();

    /** Backing array as handed to the FITS encoder. */
    Object array();

    record Strings(String[] values) implements ColumnData {
        @Override
        public ColumnType type() {
            return ColumnType.STRING;
        }

        @Override
        public int rowCount() {
            return values.length;
        }

        @Override
        public Object array() {
            return values;
        }
    }

    record Floats(float[] values) implements ColumnData {
        @Override
        public ColumnType type() {
            return ColumnType.FLOAT;
        }

        @Override
        public int rowCount() {
            return values.length;
        }

        @Override
        public Object array() {
            return values;
        }
    }

    record Doubles(double[] values) implements ColumnData {
        @Override
        public ColumnType type() {
            return ColumnType.DOUBLE;
        }

        @Override
        public int rowCount() {
            return values.length;
        }

        @Override
        public Object array() {
            return values;
        }
    }

    record Ints(int[] values) implements ColumnData {
        @Override
        public ColumnType type() {
            return ColumnType.INT;
        }

        @Override
        public int rowCount() {
            return values.length;
        }

        @Override
        public Object array() {
            return values;
        }
    }

    /** One fixed-length vector per row. */
    record FloatVectors(float[][] values) implements ColumnData {
        @Override
        public ColumnType type() {
            return ColumnType.FLOAT_VECTOR;
        }

        @Override
        public int rowCount() {
            return values.length;
        }

        @Override
        public Object array() {
            return values;
        }
    }
}
