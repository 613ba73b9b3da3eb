package com.witty.domain.formalize.logic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Output of the CNF transformer.
 *
 * @param clauses            clauses in first-production order
 * @param clauseToLegend     clause index → symbols and modal tokens the clause mentions
 * @param distributed        false when the size ceiling was hit and only the unexpanded form is reported
 * @param unexpandedForm     implication-free NNF, set only when {@code distributed} is false
 * @param droppedTautologies clauses removed because they held a literal and its negation
 * @param contradiction      true when a clause simplified to the empty clause
 */
public record CnfResult(
        List<Clause> clauses,
        Map<Integer, Set<String>> clauseToLegend,
        boolean distributed,
        LogicalNode unexpandedForm,
        List<Clause> droppedTautologies,
        boolean contradiction
) {

    public static final String TRUE_CONSTANT = "⊤";

    public CnfResult {
        clauses = List.copyOf(clauses);
        clauseToLegend = Collections.unmodifiableMap(new LinkedHashMap<>(clauseToLegend));
        droppedTautologies = droppedTautologies == null ? List.of() : List.copyOf(droppedTautologies);
    }

    public static CnfResult distributed(List<Clause> clauses, List<Clause> droppedTautologies, boolean contradiction) {
        Map<Integer, Set<String>> legend = new LinkedHashMap<>();
        for (int i = 0; i < clauses.size(); i++) {
            legend.put(i, Collections.unmodifiableSet(clauses.get(i).tokens()));
        }
        return new CnfResult(clauses, legend, true, null, droppedTautologies, contradiction);
    }

    public static CnfResult unexpanded(LogicalNode negationNormalForm) {
        return new CnfResult(List.of(), Map.of(), false, negationNormalForm, List.of(), false);
    }

    public CnfResult withContradiction() {
        return new CnfResult(clauses, clauseToLegend, distributed, unexpandedForm, droppedTautologies, true);
    }

    /**
     * Human-readable form: {@code ¬P1 ∨ P2} for one clause, {@code (¬P1 ∨ P2) ∧ P3} for several.
     */
    public String render() {
        if (!distributed) {
            return unexpandedForm.render();
        }
        if (clauses.isEmpty()) {
            return TRUE_CONSTANT;
        }
        if (clauses.size() == 1) {
            return clauses.get(0).render();
        }
        return clauses.stream()
                .map(c -> c.isUnit() ? c.render() : "(" + c.render() + ")")
                .collect(Collectors.joining(" ∧ "));
    }

    public List<List<String>> clauseStrings() {
        return clauses.stream().map(Clause::literalStrings).toList();
    }

    /**
     * Every literal token mentioned by any clause, in first-occurrence order.
     */
    public Set<Literal> literals() {
        Set<Literal> out = new LinkedHashSet<>();
        clauses.forEach(c -> out.addAll(c.literals()));
        return out;
    }

    public List<String> modalTokens() {
        Set<String> tokens = new LinkedHashSet<>();
        for (Clause clause : clauses) {
            clause.literals().stream().filter(Literal::isModal).map(Literal::token).forEach(tokens::add);
        }
        if (!distributed && unexpandedForm != null) {
            collectModalTokens(unexpandedForm, tokens);
        }
        return List.copyOf(tokens);
    }

    private static void collectModalTokens(LogicalNode node, Set<String> out) {
        if (node.isModal()) {
            out.add(node.render());
            return;
        }
        node.children().forEach(child -> collectModalTokens(child, out));
    }

    /**
     * The clause set read back as an AND-of-ORs tree; empty when there are no clauses.
     */
    public Optional<LogicalNode> asConjunction() {
        if (!distributed || clauses.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(LogicalNode.and(clauses.stream().map(Clause::toNode).toList()));
    }
}
