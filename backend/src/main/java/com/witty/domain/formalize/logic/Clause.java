package com.witty.domain.formalize.logic;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Disjunction of literals. Literal order is production order; equality for deduplication is set equality.
 */
public record Clause(List<Literal> literals) {

    public Clause {
        literals = List.copyOf(new LinkedHashSet<>(literals));
    }

    public Set<Literal> literalSet() {
        return Set.copyOf(literals);
    }

    public boolean sameLiteralsAs(Clause other) {
        return literalSet().equals(other.literalSet());
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public boolean isUnit() {
        return literals.size() == 1;
    }

    public Set<String> tokens() {
        return literals.stream().map(Literal::token).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<String> literalStrings() {
        return literals.stream().map(Literal::toString).toList();
    }

    public LogicalNode toNode() {
        return LogicalNode.or(literals.stream().map(Literal::toNode).toList());
    }

    public String render() {
        return String.join(" ∨ ", literalStrings());
    }
}
