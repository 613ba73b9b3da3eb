package com.witty.infrastructure.preprocessing;

import com.witty.domain.formalize.model.AnnotatedSpan;
import com.witty.domain.formalize.model.MarkerType;
import com.witty.domain.formalize.model.ModalTag;
import com.witty.domain.formalize.model.TokenMarker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkerAnnotatorTest {

    private MarkerAnnotator annotator;

    @BeforeEach
    void setUp() {
        annotator = new MarkerAnnotator();
    }

    @Test
    @DisplayName("Negation, modal and quantifier markers are found")
    void findsMarkers() {
        List<TokenMarker> markers = annotator.extract("Every student must not cheat, and some might.");

        assertThat(markers).extracting(TokenMarker::type).containsExactly(
                MarkerType.UNIVERSAL, MarkerType.NECESSITY, MarkerType.NEGATION,
                MarkerType.EXISTENTIAL, MarkerType.POSSIBILITY);
    }

    @Test
    @DisplayName("'no one' is a negative quantifier, not a negation")
    void negativeQuantifierWins() {
        List<TokenMarker> markers = annotator.extract("No one came");

        assertThat(markers).hasSize(1);
        assertThat(markers.get(0).type()).isEqualTo(MarkerType.NEGATIVE_QUANTIFIER);
        assertThat(markers.get(0).token()).isEqualTo("No one");
    }

    @Test
    @DisplayName("Contracted negation is detected")
    void contractedNegation() {
        assertThat(annotator.extract("Bob doesn't swim"))
                .extracting(TokenMarker::type)
                .containsExactly(MarkerType.NEGATION);
    }

    @Test
    @DisplayName("Clauses receive only the markers inside them")
    void annotatesPerClause() {
        String text = "Alice must leave. Bob may stay.";
        List<ClauseSegmenter.ClauseSpan> clauses = new ClauseSegmenter().segment(text);

        List<AnnotatedSpan> annotated = annotator.annotate(text, clauses);

        assertThat(annotated).hasSize(2);
        assertThat(annotated.get(0).modal()).contains(ModalTag.NECESSITY);
        assertThat(annotated.get(1).modal()).contains(ModalTag.POSSIBILITY);
        assertThat(annotated.get(0).isNegated()).isFalse();
    }

    @Test
    void emptyText() {
        assertThat(annotator.extract("")).isEmpty();
    }
}
