package com.hailmary.elasticsearch;

import com.hailmary.model.BulkLoadResult;
import com.hailmary.model.IndexDocument;

import java.io.IOException;
import java.util.List;

/**
 * Write side of the search index.
 */
public interface IndexWriter {

    /**
     * Upserts {@code documents} into {@code index}, keyed by document id: an existing
     * document with the same id is replaced, never duplicated.
     *
     * @return which documents were accepted and why the others were rejected
     * @throws IOException if the request as a whole could not be delivered
     */
    BulkLoadResult bulkUpsert(String index, List<IndexDocument> documents) throws IOException;

    long countDocuments(String index) throws IOException;

    /**
     * Creates {@code index} with default settings if it does not exist yet.
     */
    void ensureIndex(String index) throws IOException;

    boolean ping();
}
