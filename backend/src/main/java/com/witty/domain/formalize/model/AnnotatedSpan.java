package com.witty.domain.formalize.model;

import java.util.List;
import java.util.Optional;

/**
 * A clause-bearing span of the normalized text with the markers that fall inside it.
 */
public record AnnotatedSpan(int start, int end, String text, List<TokenMarker> markers) {

    public AnnotatedSpan {
        markers = markers == null ? List.of() : List.copyOf(markers);
    }

    public int length() {
        return end - start;
    }

    public boolean hasQuantifier() {
        return markers.stream().anyMatch(m -> m.type().isQuantifier());
    }

    public boolean isNegated() {
        return markers.stream().anyMatch(m -> m.type() == MarkerType.NEGATION);
    }

    public Optional<ModalTag> modal() {
        return markers.stream().filter(m -> m.type().isModal()).map(m -> m.type().modalTag()).findFirst();
    }
}
