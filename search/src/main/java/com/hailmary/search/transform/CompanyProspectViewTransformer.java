package com.hailmary.search.transform;

import com.hailmary.model.IndexDocument;
import com.hailmary.model.SourceRecord;
import com.hailmary.search.model.CompanyProspectDocument;
import com.hailmary.transform.DocumentTransformer;

/**
 * Maps {@code company_prospect_view} rows to {@link CompanyProspectDocument}.
 */
public class CompanyProspectViewTransformer implements DocumentTransformer {

    @Override
    public IndexDocument transform(SourceRecord record) {
        return IndexDocument.builder()
                .documentId(record.getDocumentId())
                .body(CompanyProspectDocument.fromRecord(record).toPayload())
                .build();
    }
}
