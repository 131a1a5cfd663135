package com.hailmary.search.transform;

import com.hailmary.model.IndexDocument;
import com.hailmary.model.SourceRecord;
import com.hailmary.search.model.CompanyDocument;
import com.hailmary.transform.DocumentTransformer;

/**
 * Maps {@code "Company"} rows to {@link CompanyDocument}.
 */
public class CompanyDocumentTransformer implements DocumentTransformer {

    @Override
    public IndexDocument transform(SourceRecord record) {
        return IndexDocument.builder()
                .documentId(record.getDocumentId())
                .body(CompanyDocument.fromRecord(record).toPayload())
                .build();
    }
}
