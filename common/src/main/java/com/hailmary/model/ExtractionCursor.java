package com.hailmary.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Keyset position inside a source: rows strictly after
 * {@code (trackingValue, primaryKey...)} in {@code ORDER BY tracking, pk...} order.
 *
 * <p>A {@code null} primary key means "strictly after {@code trackingValue}", which is
 * how every cycle starts from the stored checkpoint.  Individual key values may be
 * {@code null}; they sort after every non-null value.</p>
 */
@Data
@AllArgsConstructor
public class ExtractionCursor {

    private final Instant trackingValue;
    private final List<Object> primaryKey;

    public static ExtractionCursor after(Instant checkpoint) {
        return new ExtractionCursor(checkpoint, null);
    }

    public static ExtractionCursor after(SourceRecord record) {
        return new ExtractionCursor(record.getTrackingValue(), record.getPrimaryKey());
    }

    public boolean hasPrimaryKey() {
        return primaryKey != null;
    }
}
