package com.witty.infrastructure.preprocessing;

import com.witty.infrastructure.preprocessing.ClauseSegmenter.ClauseSpan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClauseSegmenterTest {

    private ClauseSegmenter segmenter;

    @BeforeEach
    void setUp() {
        segmenter = new ClauseSegmenter();
    }

    private List<String> texts(String input) {
        return segmenter.segment(input).stream().map(ClauseSpan::text).toList();
    }

    @Test
    @DisplayName("Blank input has no clauses")
    void blankInput() {
        assertThat(segmenter.segment("  ")).isEmpty();
        assertThat(segmenter.segment(null)).isEmpty();
    }

    @Test
    @DisplayName("Sentences and semicolons split clauses")
    void sentenceBoundaries() {
        assertThat(texts("Alice runs. Bob walks; Carol swims!"))
                .containsExactly("Alice runs", "Bob walks", "Carol swims");
    }

    @Test
    @DisplayName("if/then conditional yields antecedent and consequent")
    void conditionalWithThen() {
        List<ClauseSpan> spans = segmenter.segment("If Alice owns a red car, then she prefers driving.");

        assertThat(spans).extracting(ClauseSpan::text)
                .containsExactly("Alice owns a red car", "she prefers driving");
        assertThat(spans.get(0).start()).isEqualTo(3);
        assertThat(spans.get(0).end()).isEqualTo(23);
        assertThat(spans.get(1).start()).isEqualTo(30);
        assertThat(spans.get(1).end()).isEqualTo(49);
    }

    @Test
    @DisplayName("Conditional without then splits at the comma")
    void conditionalWithComma() {
        assertThat(texts("When it rains, the street gets wet."))
                .containsExactly("it rains", "the street gets wet");
    }

    @Test
    @DisplayName("Coordination splits on ', and' ', but' and 'because'")
    void coordination() {
        assertThat(texts("Alice sings, and Bob dances, but Carol sleeps because she is tired."))
                .containsExactly("Alice sings", "Bob dances", "Carol sleeps", "she is tired");
    }

    @Test
    @DisplayName("Quoted text is never split")
    void quotedTextProtected() {
        assertThat(texts("Alice said \"stop. now\" loudly"))
                .containsExactly("Alice said \"stop. now\" loudly");
    }

    @Test
    @DisplayName("Offsets point at the clause text")
    void offsetsMatchText() {
        String input = "Alice runs. Bob walks, and Carol swims.";
        for (ClauseSpan span : segmenter.segment(input)) {
            assertThat(input.substring(span.start(), span.end())).isEqualTo(span.text());
        }
    }

    @Test
    @DisplayName("Spans with no letters or digits are dropped")
    void punctuationOnlyDropped() {
        assertThat(texts("Alice runs. ... !")).containsExactly("Alice runs");
    }
}
