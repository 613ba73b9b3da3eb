package com.witty.infrastructure.adapter;

/**
 * A document returned by a {@link RetrievalAdapter}.
 */
public record RetrievedDocument(String id, String url, String content) {}
