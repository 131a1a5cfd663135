package com.hailmary.search.model;

import com.hailmary.model.SourceRecord;
import com.hailmary.transform.ColumnCopyTransformer;

import java.util.Map;

/**
 * Typed reads of JDBC column values.
 */
final class RowValues {

    private RowValues() {
        // utility class
    }

    static String string(SourceRecord record, String column) {
        Object value = ColumnCopyTransformer.toJsonValue(record.get(column));
        return value == null ? null : value.toString();
    }

    static Integer integer(SourceRecord record, String column) {
        Object value = record.get(column);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return value == null ? null : Integer.valueOf(value.toString().trim());
    }

    static Double decimal(SourceRecord record, String column) {
        Object value = record.get(column);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            // free-text values such as "$10M" are kept out of the numeric field
            return null;
        }
    }

    static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }

    static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
