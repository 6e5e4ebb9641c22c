package io.github.jakubt4.sdfits.error;

/**
 * A spectrum does not match the channel count of the first spectrum of its directory, which
 * fixes the width of the {@code SPECTRUM} column. Fails the whole directory.
 */
public class InconsistentSpectrumLengthException extends SdfitsException {

    private final int expectedLength;
    private final int actualLength;
    private final int row;

    public InconsistentSpectrumLengthException(final int row, final int expectedLength, final int actualLength) {
        super("Spectrum at row " + row + " has " + actualLength + " channels, expected " + expectedLength);
        this.row = row;
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    public int getRow() {
        return row;
    }

    public int getExpectedLength() {
        return expectedLength;
    }

    public int getActualLength() {
        return actualLength;
    }
}
