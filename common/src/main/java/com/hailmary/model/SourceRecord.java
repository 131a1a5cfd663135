package com.hailmary.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A row read from a source relation (table or materialized view).
 *
 * <p>{@code primaryKey} keeps the key columns' native values, in key order, so they can be
 * bound back into keyset queries; {@code documentId} is their string form and becomes the
 * index document {@code _id}.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SourceRecord {

    private static final String KEY_SEPARATOR = ":";

    private List<Object> primaryKey;
    private String documentId;
    private Instant trackingValue;
    private Map<String, Object> columns;

    public Object get(String column) {
        return columns == null ? null : columns.get(column);
    }

    /**
     * Document id for a key: the single value as-is, or the values joined with {@code ':'},
     * a {@code null} part rendering as empty ({@code 7:} for company 7 without prospect).
     */
    public static String documentIdOf(List<?> keyValues) {
        if (keyValues.size() == 1) {
            return String.valueOf(keyValues.get(0));
        }
        return keyValues.stream()
                .map(value -> Objects.toString(value, ""))
                .collect(Collectors.joining(KEY_SEPARATOR));
    }
}
