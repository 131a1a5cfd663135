package com.hailmary.transform;

import com.hailmary.config.SourceConfig;
import com.hailmary.model.IndexDocument;
import com.hailmary.model.SourceRecord;

/**
 * Maps a source row to the document stored in the source's index.
 *
 * <p>Implementations must be pure: the same record always yields the same document and
 * nothing outside the return value is touched.  The document id must be the record's
 * {@code documentId} so that replays overwrite instead of duplicating.</p>
 *
 * <p>Implementations need a public no-arg constructor; they are created by
 * {@link TransformerFactory} from {@link SourceConfig#getTransformerClassName()}.</p>
 */
public interface DocumentTransformer {

    /**
     * Called once after construction with the owning source's configuration.
     */
    default void init(SourceConfig config) {
        // no-op by default
    }

    IndexDocument transform(SourceRecord record);
}
