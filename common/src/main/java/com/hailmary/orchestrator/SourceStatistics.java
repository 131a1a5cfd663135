package com.hailmary.orchestrator;

import lombok.Builder;
import lombok.Value;

/**
 * Row count of a source next to the document count of its index.
 *
 * <p>Because documents are keyed by primary key, an index can never legitimately hold
 * more documents than its relation has rows; {@code duplicateSuspected} flags when it does.</p>
 */
@Value
@Builder
public class SourceStatistics {

    String source;
    String relation;
    String index;
    Long rowCount;
    Long documentCount;
    boolean duplicateSuspected;
    String error;
}
