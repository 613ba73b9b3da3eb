package com.witty.domain.formalize.model;

/**
 * Modal operators recognised in claims and logical forms.
 */
public enum ModalTag {
    NECESSITY("□"),
    POSSIBILITY("◇");

    private final String operatorSymbol;

    ModalTag(String operatorSymbol) {
        this.operatorSymbol = operatorSymbol;
    }

    public String operatorSymbol() {
        return operatorSymbol;
    }
}
