package com.hailmary.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A document ready for upsert into a destination index, keyed by the source primary key.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IndexDocument {

    private String documentId;
    private Map<String, Object> body;
}
