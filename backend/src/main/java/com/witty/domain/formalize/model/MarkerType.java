package com.witty.domain.formalize.model;

/**
 * Token annotations produced during preprocessing.
 */
public enum MarkerType {
    NEGATION(null, false),
    NECESSITY(ModalTag.NECESSITY, false),
    POSSIBILITY(ModalTag.POSSIBILITY, false),
    UNIVERSAL(null, true),
    EXISTENTIAL(null, true),
    NEGATIVE_QUANTIFIER(null, true);

    private final ModalTag modalTag;
    private final boolean quantifier;

    MarkerType(ModalTag modalTag, boolean quantifier) {
        this.modalTag = modalTag;
        this.quantifier = quantifier;
    }

    /**
     * Modal operator the marker signals, or null for non-modal markers.
     */
    public ModalTag modalTag() {
        return modalTag;
    }

    public boolean isModal() {
        return modalTag != null;
    }

    public boolean isQuantifier() {
        return quantifier;
    }
}
