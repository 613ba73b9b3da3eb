package com.witty.domain.formalize.model;

/**
 * Normalized input together with, for every normalized character, the original-text range it came from.
 * Offsets of everything downstream are expressed in normalized coordinates and mapped back through
 * {@link #toOriginal(int, int)}.
 *
 * @param text           the normalized text
 * @param originalStarts original start offset of each normalized character
 * @param originalEnds   original end offset (exclusive) of each normalized character
 * @param originalLength length of the original text
 */
public record NormalizedText(String text, int[] originalStarts, int[] originalEnds, int originalLength) {

    public NormalizedText {
        if (originalStarts.length != text.length() || originalEnds.length != text.length()) {
            throw new IllegalArgumentException("Offset map does not match normalized text length");
        }
    }

    public static NormalizedText empty() {
        return new NormalizedText("", new int[0], new int[0], 0);
    }

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public String substring(int start, int end) {
        return text.substring(start, end);
    }

    /**
     * Map a normalized range {@code [start, end)} to the original text.
     */
    public OriginSpan toOriginal(int start, int end) {
        if (start < 0 || end > text.length() || start > end) {
            throw new IllegalArgumentException("Range [" + start + ", " + end + ") outside normalized text of length " + text.length());
        }
        if (start == end) {
            int pos = start < originalStarts.length ? originalStarts[start] : originalLength;
            return new OriginSpan(pos, pos);
        }
        return new OriginSpan(originalStarts[start], originalEnds[end - 1]);
    }
}
