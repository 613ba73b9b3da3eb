package com.witty.domain.formalize.model;

/**
 * A marker token found in the normalized text, {@code [start, end)} in normalized coordinates.
 */
public record TokenMarker(MarkerType type, int start, int end, String token) {}
