package com.witty.infrastructure.preprocessing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based clause segmenter over normalized text. No adapter calls.
 *
 * Pipeline:
 *   1. Strong structural boundaries (blank lines)
 *   2. Sentence punctuation (.!? followed by whitespace or end) and semicolons
 *   3. Conditionals: "if/when X, then Y", "if X then Y", "if X, Y" → antecedent and consequent
 *   4. Coordination: ", and" / ", but" / "because"
 *   5. Cleanup: strip connectives and trailing punctuation, drop spans without letters or digits
 *
 * Positions are tracked through SplitUnit (no indexOf on the full text). Quoted and parenthesized
 * ranges are never split except at strong boundaries.
 */
@Slf4j
@Component
public class ClauseSegmenter {

    /**
     * A clause-bearing span of the normalized text, {@code [start, end)}.
     */
    public record ClauseSpan(String text, int start, int end) {}

    // ── Internal records ──

    private record SplitUnit(String text, int start, int end) {}

    private record ProtectedRange(int start, int end) {}

    // ── Patterns ──

    private static final Pattern BLANK_LINE = Pattern.compile("\\n\\n+");
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|;\\s*");
    private static final Pattern CONDITIONAL = Pattern.compile(
            "^(?:if|when|whenever)\\s+(.+?)(?:,?\\s+then\\s+|,\\s*)(.+)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern COORDINATION = Pattern.compile(
            ",\\s*(?:and|but)\\s+|\\s+because\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_CONNECTIVE = Pattern.compile(
            "^(?:and|but|so|then|because)\\s+", Pattern.CASE_INSENSITIVE);
    private static final String TRAILING_PUNCTUATION = ".,;:!?";

    private static final Pattern PAREN_PATTERN = Pattern.compile("\\([^)]*\\)");
    private static final Pattern QUOTE_PATTERN = Pattern.compile(
            "\"[^\"]*\"|“[^”]*”|‘[^’]*’");

    // ── Public API ──

    public List<ClauseSpan> segment(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<ProtectedRange> protectedRanges = collectProtectedRanges(text);

        List<SplitUnit> units = List.of(new SplitUnit(text, 0, text.length()));

        // Stage 1: Strong structural boundaries
        units = applySplitPattern(units, BLANK_LINE, List.of());

        // Stage 2: Sentence punctuation
        units = applySplitPattern(units, SENTENCE_BOUNDARY, protectedRanges);

        // Stage 3: Conditionals
        units = splitConditionals(units, protectedRanges);

        // Stage 4: Coordination
        units = applySplitPattern(units, COORDINATION, protectedRanges);

        // Stage 5: Cleanup
        List<ClauseSpan> clauses = new ArrayList<>();
        for (SplitUnit unit : units) {
            SplitUnit cleaned = cleanup(unit);
            if (cleaned != null) {
                clauses.add(new ClauseSpan(cleaned.text(), cleaned.start(), cleaned.end()));
            }
        }

        log.debug("[Segmenter] {} clauses from {} chars", clauses.size(), text.length());
        return clauses;
    }

    // ── Protected ranges ──

    private List<ProtectedRange> collectProtectedRanges(String text) {
        List<ProtectedRange> ranges = new ArrayList<>();
        for (Pattern pattern : List.of(PAREN_PATTERN, QUOTE_PATTERN)) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                ranges.add(new ProtectedRange(m.start(), m.end()));
            }
        }
        return ranges;
    }

    private boolean isInProtected(int globalPos, List<ProtectedRange> ranges) {
        for (ProtectedRange r : ranges) {
            if (globalPos >= r.start() && globalPos < r.end()) {
                return true;
            }
        }
        return false;
    }

    // ── Stage 3: Conditionals ──

    private List<SplitUnit> splitConditionals(List<SplitUnit> units, List<ProtectedRange> protectedRanges) {
        List<SplitUnit> result = new ArrayList<>();
        for (SplitUnit unit : units) {
            Matcher m = CONDITIONAL.matcher(unit.text());
            if (m.matches() && !isInProtected(unit.start() + m.end(1), protectedRanges)) {
                result.add(sub(unit, m.start(1), m.end(1)));
                result.add(sub(unit, m.start(2), m.end(2)));
            } else {
                result.add(unit);
            }
        }
        return result;
    }

    // ── Split helpers ──

    private List<SplitUnit> applySplitPattern(List<SplitUnit> units, Pattern pattern,
                                              List<ProtectedRange> protectedRanges) {
        List<SplitUnit> result = new ArrayList<>();

        for (SplitUnit unit : units) {
            Matcher m = pattern.matcher(unit.text());
            int lastEnd = 0;
            boolean split = false;

            while (m.find()) {
                if (m.start() == 0 || isInProtected(unit.start() + m.start(), protectedRanges)) {
                    continue;
                }
                SplitUnit head = trimmed(unit, lastEnd, m.start());
                if (head != null) {
                    result.add(head);
                    split = true;
                }
                lastEnd = m.end();
            }

            if (split) {
                SplitUnit tail = trimmed(unit, lastEnd, unit.text().length());
                if (tail != null) {
                    result.add(tail);
                }
            } else {
                result.add(unit);
            }
        }
        return result;
    }

    private SplitUnit sub(SplitUnit unit, int from, int to) {
        return new SplitUnit(unit.text().substring(from, to), unit.start() + from, unit.start() + to);
    }

    /**
     * Sub-unit {@code [from, to)} of {@code unit} with surrounding whitespace removed, or null if blank.
     */
    private SplitUnit trimmed(SplitUnit unit, int from, int to) {
        String text = unit.text();
        while (from < to && Character.isWhitespace(text.charAt(from))) {
            from++;
        }
        while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
            to--;
        }
        return from < to ? sub(unit, from, to) : null;
    }

    private SplitUnit cleanup(SplitUnit unit) {
        SplitUnit current = trimmed(unit, 0, unit.text().length());
        if (current == null) {
            return null;
        }
        Matcher lead = LEADING_CONNECTIVE.matcher(current.text());
        if (lead.find() && lead.end() < current.text().length()) {
            current = sub(current, lead.end(), current.text().length());
        }
        int end = current.text().length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(current.text().charAt(end - 1)) >= 0) {
            end--;
        }
        current = trimmed(current, 0, end);
        if (current == null || current.text().codePoints().noneMatch(Character::isLetterOrDigit)) {
            return null;
        }
        return current;
    }
}
