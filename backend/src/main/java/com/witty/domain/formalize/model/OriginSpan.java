package com.witty.domain.formalize.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Half-open character range {@code [start, end)} into the original input text.
 * Serialized as a two-element array, e.g. {@code [3, 23]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"start", "end"})
public record OriginSpan(int start, int end) {

    @JsonCreator
    public OriginSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public boolean isEmpty() {
        return end == start;
    }

    public int length() {
        return end - start;
    }

    public boolean contains(OriginSpan other) {
        return other.start >= start && other.end <= end;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
