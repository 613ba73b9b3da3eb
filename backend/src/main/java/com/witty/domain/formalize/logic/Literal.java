package com.witty.domain.formalize.logic;

/**
 * A possibly negated atom or opaque MODAL subtree.
 *
 * @param positive polarity
 * @param node     the ATOM or MODAL node the literal stands for
 */
public record Literal(boolean positive, LogicalNode node) {

    public Literal {
        if (node == null || (node.kind() != NodeKind.ATOM && node.kind() != NodeKind.MODAL)) {
            throw new IllegalArgumentException("Literal must wrap an ATOM or MODAL node, got " + node);
        }
    }

    public static Literal positive(LogicalNode node) {
        return new Literal(true, node);
    }

    public static Literal negative(LogicalNode node) {
        return new Literal(false, node);
    }

    /**
     * Symbol for atoms, canonical serialization for MODAL subtrees.
     */
    public String token() {
        return node.render();
    }

    public boolean isModal() {
        return node.isModal();
    }

    public Literal negate() {
        return new Literal(!positive, node);
    }

    public LogicalNode toNode() {
        return positive ? node : LogicalNode.not(node);
    }

    @Override
    public String toString() {
        return positive ? token() : "¬" + token();
    }
}
