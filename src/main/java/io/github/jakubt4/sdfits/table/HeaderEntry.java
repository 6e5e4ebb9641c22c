package io.github.jakubt4.sdfits.table;

import java.util.Objects;

/**
 * One header card. Values are {@link String}, {@link Double}, {@link Integer} or
 * {@link Boolean}.
 */
public record HeaderEntry(String keyword, Object value, String comment) {

    private static final int MAX_KEYWORD_LENGTH = 8;

    public HeaderEntry {
        Objects.requireNonNull(keyword, "keyword is required");
        Objects.requireNonNull(value, () -> "value of " + keyword + " is required");
        if (keyword.isEmpty() || keyword.length() > MAX_KEYWORD_LENGTH) {
            throw new IllegalArgumentException("Keyword must have 1-8 characters: " + keyword);
        }
        if (!(value instanceof String || value instanceof Double || value instanceof Integer
                || value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported value type for " + keyword + ": "
                    + value.getClass().getSimpleName());
        }
        comment = comment == null ? "" : comment;
    }

    public static HeaderEntry of(final String keyword, final Object value) {
        return new HeaderEntry(keyword, value, "");
    }
}
