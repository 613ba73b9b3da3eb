package com.witty.infrastructure.preprocessing;

import com.witty.domain.formalize.model.NormalizedText;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Arrays;

/**
 * Normalizes input text before formalization while remembering where every character came from:
 * - Unicode NFC normalization (per base character + combining marks)
 * - Invisible/control character removal
 * - Whitespace normalization (CRLF to LF, collapse runs, trim)
 */
@Component
public class TextNormalizer {

    private static final String INVISIBLE_CHARS = "\u200B\u200C\u200D\uFEFF\u00AD\u2060\u180E";

    /**
     * Normalize the input text.
     *
     * @param text raw user input
     * @return normalized text with an offset map into {@code text}
     */
    public NormalizedText normalize(String text) {
        if (text == null || text.isEmpty()) {
            return NormalizedText.empty();
        }

        Builder out = new Builder(text.length());
        int i = 0;
        while (i < text.length()) {
            int clusterEnd = clusterEnd(text, i);
            char c = text.charAt(i);

            // 1. Remove invisible and control characters (except \n, \r, \t)
            if (clusterEnd - i == 1 && (isInvisible(c) || isControl(c))) {
                i = clusterEnd;
                continue;
            }

            // 2. Normalize \r\n and lone \r to \n
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                    continue;
                }
                out.appendNewline(i, i + 1);
                i = clusterEnd;
                continue;
            }
            if (c == '\n') {
                out.appendNewline(i, i + 1);
                i = clusterEnd;
                continue;
            }

            // 3. Collapse multiple spaces/tabs to a single space
            if (c == ' ' || c == '\t') {
                out.appendSpace(i, i + 1);
                i = clusterEnd;
                continue;
            }

            // 4. Unicode NFC normalization of the cluster
            String normalized = Normalizer.normalize(text.substring(i, clusterEnd), Normalizer.Form.NFC);
            out.append(normalized, i, clusterEnd);
            i = clusterEnd;
        }

        // 5. Trim
        return out.build(text.length());
    }

    /**
     * End of the cluster starting at {@code start}: one code point followed by any combining marks.
     */
    private static int clusterEnd(String text, int start) {
        int end = start + Character.charCount(text.codePointAt(start));
        while (end < text.length()) {
            int cp = text.codePointAt(end);
            int type = Character.getType(cp);
            if (type != Character.NON_SPACING_MARK && type != Character.COMBINING_SPACING_MARK
                    && type != Character.ENCLOSING_MARK) {
                break;
            }
            end += Character.charCount(cp);
        }
        return end;
    }

    private static boolean isInvisible(char c) {
        return INVISIBLE_CHARS.indexOf(c) >= 0;
    }

    private static boolean isControl(char c) {
        return (c <= 0x08) || c == 0x0B || c == 0x0C || (c >= 0x0E && c <= 0x1F) || c == 0x7F;
    }

    private static final class Builder {
        private final StringBuilder text;
        private int[] starts;
        private int[] ends;
        private int newlineRun;

        Builder(int capacity) {
            this.text = new StringBuilder(capacity);
            this.starts = new int[Math.max(capacity, 1)];
            this.ends = new int[Math.max(capacity, 1)];
        }

        void appendSpace(int origStart, int origEnd) {
            if (text.length() > 0 && text.charAt(text.length() - 1) == ' ') {
                return;
            }
            put(' ', origStart, origEnd);
            newlineRun = 0;
        }

        void appendNewline(int origStart, int origEnd) {
            // 3+ consecutive newlines → 2 newlines
            if (newlineRun >= 2) {
                return;
            }
            put('\n', origStart, origEnd);
            newlineRun++;
        }

        void append(String chars, int origStart, int origEnd) {
            for (int k = 0; k < chars.length(); k++) {
                put(chars.charAt(k), origStart, origEnd);
            }
            newlineRun = 0;
        }

        private void put(char c, int origStart, int origEnd) {
            int pos = text.length();
            if (pos == starts.length) {
                starts = Arrays.copyOf(starts, pos * 2);
                ends = Arrays.copyOf(ends, pos * 2);
            }
            text.append(c);
            starts[pos] = origStart;
            ends[pos] = origEnd;
        }

        NormalizedText build(int originalLength) {
            int from = 0;
            int to = text.length();
            while (from < to && Character.isWhitespace(text.charAt(from))) {
                from++;
            }
            while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
                to--;
            }
            return new NormalizedText(
                    text.substring(from, to),
                    Arrays.copyOfRange(starts, from, to),
                    Arrays.copyOfRange(ends, from, to),
                    originalLength);
        }
    }
}
