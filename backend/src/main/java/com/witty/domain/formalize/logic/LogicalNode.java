package com.witty.domain.formalize.logic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.witty.domain.formalize.model.ModalTag;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Node of a logical-form AST.
 * <p>
 * {@code ATOM} carries a symbol, {@code MODAL} carries an operator and exactly one child,
 * {@code NOT} has one child, {@code IMPLIES}/{@code IFF} have two, {@code AND}/{@code OR} one or more.
 * Structural equality is record equality.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record LogicalNode(NodeKind kind, String symbol, ModalTag operator, List<LogicalNode> children) {

    public LogicalNode {
        if (kind == null) {
            throw new IllegalArgumentException("Node kind is required");
        }
        children = children == null ? List.of() : List.copyOf(children);
        switch (kind) {
            case ATOM -> {
                if (symbol == null || symbol.isBlank()) {
                    throw new IllegalArgumentException("ATOM requires a symbol");
                }
                if (!children.isEmpty() || operator != null) {
                    throw new IllegalArgumentException("ATOM cannot have children or an operator");
                }
            }
            case NOT -> requireArity(kind, children, 1);
            case IMPLIES, IFF -> requireArity(kind, children, 2);
            case AND, OR -> {
                if (children.isEmpty()) {
                    throw new IllegalArgumentException(kind + " requires at least one child");
                }
            }
            case MODAL -> {
                if (operator == null) {
                    throw new IllegalArgumentException("MODAL requires an operator");
                }
                requireArity(kind, children, 1);
            }
        }
        if (kind != NodeKind.ATOM && symbol != null) {
            throw new IllegalArgumentException(kind + " cannot carry a symbol");
        }
        if (kind != NodeKind.MODAL && operator != null) {
            throw new IllegalArgumentException(kind + " cannot carry a modal operator");
        }
    }

    private static void requireArity(NodeKind kind, List<LogicalNode> children, int arity) {
        if (children.size() != arity) {
            throw new IllegalArgumentException(kind + " requires exactly " + arity + " child(ren), got " + children.size());
        }
    }

    // ===== Factories =====

    public static LogicalNode atom(String symbol) {
        return new LogicalNode(NodeKind.ATOM, symbol, null, List.of());
    }

    public static LogicalNode not(LogicalNode child) {
        return new LogicalNode(NodeKind.NOT, null, null, List.of(child));
    }

    public static LogicalNode and(LogicalNode... children) {
        return and(Arrays.asList(children));
    }

    public static LogicalNode and(List<LogicalNode> children) {
        return new LogicalNode(NodeKind.AND, null, null, children);
    }

    public static LogicalNode or(LogicalNode... children) {
        return or(Arrays.asList(children));
    }

    public static LogicalNode or(List<LogicalNode> children) {
        return new LogicalNode(NodeKind.OR, null, null, children);
    }

    public static LogicalNode implies(LogicalNode antecedent, LogicalNode consequent) {
        return new LogicalNode(NodeKind.IMPLIES, null, null, List.of(antecedent, consequent));
    }

    public static LogicalNode iff(LogicalNode left, LogicalNode right) {
        return new LogicalNode(NodeKind.IFF, null, null, List.of(left, right));
    }

    public static LogicalNode modal(ModalTag operator, LogicalNode child) {
        return new LogicalNode(NodeKind.MODAL, null, operator, List.of(child));
    }

    // ===== Accessors =====

    @JsonIgnore
    public LogicalNode child() {
        return children.get(0);
    }

    @JsonIgnore
    public LogicalNode left() {
        return children.get(0);
    }

    @JsonIgnore
    public LogicalNode right() {
        return children.get(1);
    }

    @JsonIgnore
    public boolean isModal() {
        return kind == NodeKind.MODAL;
    }

    /**
     * All ATOM symbols referenced anywhere in this subtree, MODAL subtrees included, in first-occurrence order.
     */
    public Set<String> symbols() {
        Set<String> out = new LinkedHashSet<>();
        collectSymbols(this, out);
        return out;
    }

    private static void collectSymbols(LogicalNode node, Set<String> out) {
        if (node.kind == NodeKind.ATOM) {
            out.add(node.symbol);
            return;
        }
        for (LogicalNode child : node.children) {
            collectSymbols(child, out);
        }
    }

    /**
     * Canonical infix serialization. Used as the token of opaque MODAL literals, so it must stay injective
     * over structurally distinct trees.
     */
    public String render() {
        return switch (kind) {
            case ATOM -> symbol;
            case NOT -> "¬" + renderOperand(child());
            case AND -> children.stream().map(LogicalNode::renderOperand).collect(Collectors.joining(" ∧ "));
            case OR -> children.stream().map(LogicalNode::renderOperand).collect(Collectors.joining(" ∨ "));
            case IMPLIES -> renderOperand(left()) + " → " + renderOperand(right());
            case IFF -> renderOperand(left()) + " ↔ " + renderOperand(right());
            case MODAL -> operator.operatorSymbol() + "(" + child().render() + ")";
        };
    }

    private static String renderOperand(LogicalNode node) {
        return switch (node.kind) {
            case ATOM, NOT, MODAL -> node.render();
            default -> "(" + node.render() + ")";
        };
    }

    @Override
    public String toString() {
        return render();
    }
}
