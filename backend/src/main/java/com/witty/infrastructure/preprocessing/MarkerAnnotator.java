package com.witty.infrastructure.preprocessing;

import com.witty.domain.formalize.model.AnnotatedSpan;
import com.witty.domain.formalize.model.MarkerType;
import com.witty.domain.formalize.model.TokenMarker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Annotates clause spans with negation, modal and quantifier markers.
 *
 * Patterns are applied in priority order; overlapping matches keep the earlier, then the longer one.
 */
@Component
public class MarkerAnnotator {

    private record PatternEntry(Pattern pattern, MarkerType type) {}

    private record RawMatch(int start, int end, String text, MarkerType type) {}

    private static final List<PatternEntry> PATTERNS = List.of(
            // Negative quantifiers before plain negation so "no one" is not read as "no"
            entry("\\b(?:no\\s+one|nobody|nothing|none|no)\\b", MarkerType.NEGATIVE_QUANTIFIER),
            entry("\\b(?:not|never|neither|nor)\\b|n't\\b", MarkerType.NEGATION),
            entry("\\b(?:must|necessarily|necessary|certainly|(?:has|have|needs?)\\s+to)\\b", MarkerType.NECESSITY),
            entry("\\b(?:might|may|could|can|possibly|perhaps|maybe)\\b", MarkerType.POSSIBILITY),
            entry("\\b(?:all|every|each|everyone|everybody|everything)\\b", MarkerType.UNIVERSAL),
            entry("\\b(?:some|someone|somebody|something|there\\s+(?:is|are|exists?)|exists?)\\b", MarkerType.EXISTENTIAL)
    );

    private static PatternEntry entry(String regex, MarkerType type) {
        return new PatternEntry(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), type);
    }

    /**
     * Annotate each clause of {@code text}.
     *
     * @param text    normalized text the clause offsets refer to
     * @param clauses clause spans from {@link ClauseSegmenter}
     * @return annotated spans, in the order given
     */
    public List<AnnotatedSpan> annotate(String text, List<ClauseSegmenter.ClauseSpan> clauses) {
        List<TokenMarker> markers = extract(text);
        List<AnnotatedSpan> annotated = new ArrayList<>(clauses.size());
        for (ClauseSegmenter.ClauseSpan clause : clauses) {
            List<TokenMarker> inside = markers.stream()
                    .filter(m -> m.start() >= clause.start() && m.end() <= clause.end())
                    .toList();
            annotated.add(new AnnotatedSpan(clause.start(), clause.end(), clause.text(), inside));
        }
        return annotated;
    }

    /**
     * All non-overlapping markers in {@code text}, sorted by start position.
     */
    public List<TokenMarker> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<RawMatch> rawMatches = new ArrayList<>();
        for (PatternEntry entry : PATTERNS) {
            Matcher matcher = entry.pattern().matcher(text);
            while (matcher.find()) {
                rawMatches.add(new RawMatch(matcher.start(), matcher.end(), matcher.group(), entry.type()));
            }
        }

        rawMatches.sort(Comparator
                .comparingInt(RawMatch::start)
                .thenComparingInt(m -> -(m.end() - m.start())));

        List<TokenMarker> markers = new ArrayList<>();
        int lastEnd = -1;
        for (RawMatch match : rawMatches) {
            if (match.start() >= lastEnd) {
                markers.add(new TokenMarker(match.type(), match.start(), match.end(), match.text()));
                lastEnd = match.end();
            }
        }
        return markers;
    }
}
