package com.witty.infrastructure.preprocessing;

import com.witty.domain.formalize.model.NormalizedText;
import com.witty.domain.formalize.model.OriginSpan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Test
    @DisplayName("null and empty input yield empty text")
    void nullAndEmpty() {
        assertThat(normalizer.normalize(null).isEmpty()).isTrue();
        assertThat(normalizer.normalize("").isEmpty()).isTrue();
    }

    @Nested
    @DisplayName("Text rules")
    class TextRules {

        @Test
        void removesInvisibleCharacters() {
            assertThat(normalizer.normalize("Al\u200Bice\uFEFF runs").text()).isEqualTo("Alice runs");
        }

        @Test
        void removesControlCharacters() {
            assertThat(normalizer.normalize("Alice\u0001 runs\u0007").text()).isEqualTo("Alice runs");
        }

        @Test
        void normalizesLineEndings() {
            assertThat(normalizer.normalize("one\r\ntwo\rthree").text()).isEqualTo("one\ntwo\nthree");
        }

        @Test
        void collapsesSpacesAndTabs() {
            assertThat(normalizer.normalize("Alice \t  runs    fast").text()).isEqualTo("Alice runs fast");
        }

        @Test
        void capsNewlineRunsAtTwo() {
            assertThat(normalizer.normalize("one\n\n\n\ntwo").text()).isEqualTo("one\n\ntwo");
        }

        @Test
        void trimsOuterWhitespace() {
            assertThat(normalizer.normalize("  \n Alice runs \n ").text()).isEqualTo("Alice runs");
        }

        @Test
        @DisplayName("Decomposed characters are composed to NFC")
        void composesToNfc() {
            NormalizedText result = normalizer.normalize("cafe\u0301");
            assertThat(result.text()).isEqualTo("caf\u00E9");
        }
    }

    @Nested
    @DisplayName("Offset map")
    class OffsetMap {

        @Test
        @DisplayName("Spans map back to the original text after trimming and collapsing")
        void mapsBackThroughTrimAndCollapse() {
            String original = "   Alice    owns a car";
            NormalizedText result = normalizer.normalize(original);

            assertThat(result.text()).isEqualTo("Alice owns a car");
            OriginSpan owns = result.toOriginal(6, 10);
            assertThat(original.substring(owns.start(), owns.end())).isEqualTo("owns");
        }

        @Test
        @DisplayName("A composed character maps to its whole decomposed cluster")
        void composedCharacterMapsToCluster() {
            String original = "cafe\u0301 open";
            NormalizedText result = normalizer.normalize(original);

            assertThat(result.toOriginal(3, 4)).isEqualTo(new OriginSpan(3, 5));
            OriginSpan open = result.toOriginal(5, 9);
            assertThat(original.substring(open.start(), open.end())).isEqualTo("open");
        }

        @Test
        @DisplayName("Removed invisible characters are skipped by the map")
        void invisibleCharactersSkipped() {
            String original = "\u200BBob";
            NormalizedText result = normalizer.normalize(original);

            assertThat(result.toOriginal(0, 3)).isEqualTo(new OriginSpan(1, 4));
        }
    }
}
