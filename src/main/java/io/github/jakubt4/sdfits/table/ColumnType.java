package io.github.jakubt4.sdfits.table;

/**
 * Binary-table cell types used by the SDFITS tables, with their {@code TFORM} letter.
 */
public enum ColumnType {

    /** Fixed-width character field, {@code nA}. */
    STRING('A'),
    /** 32-bit float, {@code 1E}. */
    FLOAT('E'),
    /** 64-bit float, {@code 1D}. */
    DOUBLE('D'),
    /** 32-bit integer, {@code 1J}. */
    INT('J'),
    /** Fixed-length float vector, {@code nE}. */
    FLOAT_VECTOR('E');

    private final char formatCode;

    ColumnType(final char formatCode) {
        this.formatCode = formatCode;
    }

    public char formatCode() {
        return formatCode;
    }
}
