package com.hailmary.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-document outcome of a bulk upsert.
 *
 * <p>A document id is either in {@code acceptedIds} or a key of {@code failures}
 * (id to rejection reason), never both.</p>
 */
@Data
@AllArgsConstructor
public class BulkLoadResult {

    private final Set<String> acceptedIds;
    private final Map<String, String> failures;

    public static BulkLoadResult empty() {
        return new BulkLoadResult(Collections.emptySet(), Collections.emptyMap());
    }

    public static BulkLoadResult allAccepted(Iterable<String> documentIds) {
        Set<String> ids = new LinkedHashSet<>();
        documentIds.forEach(ids::add);
        return new BulkLoadResult(ids, new LinkedHashMap<>());
    }

    public boolean isAccepted(String documentId) {
        return acceptedIds.contains(documentId);
    }

    /** @return {@code true} if no document in the batch was rejected. */
    public boolean isComplete() {
        return failures.isEmpty();
    }
}
