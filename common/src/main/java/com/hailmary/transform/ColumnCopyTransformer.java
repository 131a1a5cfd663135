package com.hailmary.transform;

import com.hailmary.model.IndexDocument;
import com.hailmary.model.SourceRecord;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Default transformer: copies every column into the document, converting JDBC types to
 * JSON-friendly values: timestamps and UUIDs become strings, {@code numeric} values keep
 * their exact decimal digits.
 */
public class ColumnCopyTransformer implements DocumentTransformer {

    @Override
    public IndexDocument transform(SourceRecord record) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (record.getColumns() != null) {
            record.getColumns().forEach((column, value) -> body.put(column, toJsonValue(value)));
        }
        return IndexDocument.builder()
                .documentId(record.getDocumentId())
                .body(body)
                .build();
    }

    /**
     * Converts a JDBC column value to a type the JSON mapper writes unambiguously.
     */
    public static Object toJsonValue(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().toString();
        }
        if (value instanceof Instant || value instanceof OffsetDateTime || value instanceof LocalDate
                || value instanceof java.sql.Date || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof BigInteger bigInteger) {
            return bigInteger.bitLength() < Long.SIZE ? (Object) bigInteger.longValue() : bigInteger;
        }
        if (value instanceof BigDecimal bigDecimal) {
            // numeric columns keep their exact digits; only integral values that fit become longs
            if (bigDecimal.scale() <= 0 && bigDecimal.toBigInteger().bitLength() < Long.SIZE) {
                return bigDecimal.longValue();
            }
            return bigDecimal;
        }
        return value;
    }
}
