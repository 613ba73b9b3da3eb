package com.witty.infrastructure.adapter;

import com.witty.domain.formalize.model.OriginSpan;

import java.util.List;

/**
 * Optional capability for fetching external documents used as enrichment sources.
 * No implementation ships with the service; register a bean to enable it.
 */
public interface RetrievalAdapter {

    /**
     * @throws AdapterException when the backend cannot be reached
     */
    List<RetrievedDocument> retrieve(String query, int k);

    /**
     * Summary of {@code span} of the document (the whole document when span is null).
     */
    String summarize(RetrievedDocument document, OriginSpan span);
}
