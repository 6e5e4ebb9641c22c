package io.github.jakubt4.sdfits.table;

import java.util.List;
import java.util.Optional;

/**
 * A fully assembled binary-table extension, ready to be encoded.
 *
 * @param extensionName {@code EXTNAME}
 * @param header        header cards in write order, {@code EXTNAME} first
 * @param columns       columns in schema order; empty for a table without rows
 * @param rowCount      number of rows in every column
 */
public record AssembledTable(String extensionName, List<HeaderEntry> header, List<TableColumn> columns, int rowCount) {

    public AssembledTable {
        header = List.copyOf(header);
        columns = List.copyOf(columns);
        for (final var column : columns) {
            if (column.rowCount() != rowCount) {
                throw new IllegalArgumentException("Column " + column.name() + " has " + column.rowCount()
                        + " rows, table " + extensionName + " has " + rowCount);
            }
        }
    }

    public Optional<Object> headerValue(final String keyword) {
        return header.stream()
                .filter(entry -> entry.keyword().equals(keyword))
                .map(HeaderEntry::value)
                .findFirst();
    }

    public Optional<TableColumn> column(final String name) {
        return columns.stream().filter(column -> column.name().equals(name)).findFirst();
    }
}
