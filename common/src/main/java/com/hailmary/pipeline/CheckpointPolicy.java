package com.hailmary.pipeline;

import com.hailmary.model.BulkLoadResult;
import com.hailmary.model.SourceRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Decides how far a checkpoint may move after loading one page.
 *
 * <p>The checkpoint means "every row with a tracking value at or below this has been
 * loaded".  A value is therefore safe only if all rows carrying it, and everything before
 * it, were accepted:</p>
 * <ul>
 *   <li>Rejected rows: advance to the highest value strictly below the first rejected
 *       row's value.  Rows after the first rejection are replayed next cycle even if
 *       they were accepted.</li>
 *   <li>Full page: the last value may continue on the next page, so advance only to the
 *       highest value strictly below it.</li>
 *   <li>Short page, all accepted: advance to the page maximum.</li>
 * </ul>
 */
public final class CheckpointPolicy {

    private CheckpointPolicy() {
        // utility class
    }

    /**
     * @param page          rows in extraction order (tracking value ascending, then primary key)
     * @param result        outcome of loading the page
     * @param pageExhausted {@code true} if the page was shorter than the batch size
     * @return the value to advance to, or empty if no value is safe yet
     */
    public static Optional<Instant> safeAdvanceValue(List<SourceRecord> page, BulkLoadResult result,
                                                     boolean pageExhausted) {
        if (page.isEmpty()) {
            return Optional.empty();
        }

        Instant boundary = null;
        for (SourceRecord record : page) {
            if (!result.isAccepted(record.getDocumentId())) {
                boundary = record.getTrackingValue();
                break;
            }
        }
        if (boundary == null) {
            if (pageExhausted) {
                return Optional.of(page.get(page.size() - 1).getTrackingValue());
            }
            boundary = page.get(page.size() - 1).getTrackingValue();
        }

        Instant safe = null;
        for (SourceRecord record : page) {
            if (!record.getTrackingValue().isBefore(boundary)) {
                break;
            }
            safe = record.getTrackingValue();
        }
        return Optional.ofNullable(safe);
    }
}
