package com.hailmary.search.transform;

import com.hailmary.model.IndexDocument;
import com.hailmary.model.SourceRecord;
import com.hailmary.search.model.ProspectDocument;
import com.hailmary.transform.DocumentTransformer;

/**
 * Maps {@code "Prospect"} rows to {@link ProspectDocument}.
 */
public class ProspectDocumentTransformer implements DocumentTransformer {

    @Override
    public IndexDocument transform(SourceRecord record) {
        return IndexDocument.builder()
                .documentId(record.getDocumentId())
                .body(ProspectDocument.fromRecord(record).toPayload())
                .build();
    }
}
