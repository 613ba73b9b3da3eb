package com.witty.infrastructure.cnf;

import com.witty.domain.formalize.logic.Clause;
import com.witty.domain.formalize.logic.CnfResult;
import com.witty.domain.formalize.logic.Literal;
import com.witty.domain.formalize.logic.LogicalNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts a logical form into conjunctive normal form.
 *
 * Passes, in order:
 *   1. Biconditional elimination: a ↔ b → (a → b) ∧ (b → a)
 *   2. Implication elimination: a → b → ¬a ∨ b
 *   3. Negation normal form (De Morgan, double negation)
 *   4. Distribution of ∨ over ∧, bounded by a clause ceiling
 *   5. Clause flattening and simplification
 *
 * MODAL subtrees are opaque throughout: no pass descends into them, and a NOT directly above a MODAL
 * node stays there, the pair forming one negative literal.
 */
@Slf4j
@Component
public class CnfTransformer {

    /**
     * @param ast        the chosen logical form
     * @param maxClauses clause ceiling for distribution
     * @return clauses in first-production order
     * @throws SizeLimitExceededException     if distribution exceeds {@code maxClauses}
     * @throws ContradictionDetectedException if a clause simplifies to the empty clause
     */
    public CnfResult transform(LogicalNode ast, int maxClauses) {
        LogicalNode implicationFree = eliminateImplications(eliminateBiconditionals(ast));
        LogicalNode nnf = toNegationNormalForm(implicationFree, false);

        List<List<Literal>> raw = distribute(nnf, maxClauses);
        if (raw == null) {
            log.warn("[CnfTransformer] Clause ceiling {} exceeded, reporting unexpanded form", maxClauses);
            throw new SizeLimitExceededException(nnf, maxClauses);
        }

        return simplify(raw);
    }

    /**
     * Implication-free negation normal form of {@code ast}.
     */
    public LogicalNode negationNormalForm(LogicalNode ast) {
        return toNegationNormalForm(eliminateImplications(eliminateBiconditionals(ast)), false);
    }

    // ── 1. Biconditional elimination ──

    LogicalNode eliminateBiconditionals(LogicalNode node) {
        return switch (node.kind()) {
            case ATOM, MODAL -> node;
            case IFF -> {
                LogicalNode a = eliminateBiconditionals(node.left());
                LogicalNode b = eliminateBiconditionals(node.right());
                yield LogicalNode.and(LogicalNode.implies(a, b), LogicalNode.implies(b, a));
            }
            default -> rebuild(node, node.children().stream().map(this::eliminateBiconditionals).toList());
        };
    }

    // ── 2. Implication elimination ──

    LogicalNode eliminateImplications(LogicalNode node) {
        return switch (node.kind()) {
            case ATOM, MODAL -> node;
            case IMPLIES -> LogicalNode.or(
                    LogicalNode.not(eliminateImplications(node.left())),
                    eliminateImplications(node.right()));
            case IFF -> throw new IllegalStateException("Biconditionals must be eliminated first");
            default -> rebuild(node, node.children().stream().map(this::eliminateImplications).toList());
        };
    }

    // ── 3. Negation normal form ──

    private LogicalNode toNegationNormalForm(LogicalNode node, boolean negated) {
        return switch (node.kind()) {
            case ATOM, MODAL -> negated ? LogicalNode.not(node) : node;
            case NOT -> toNegationNormalForm(node.child(), !negated);
            case AND -> {
                List<LogicalNode> children = node.children().stream()
                        .map(c -> toNegationNormalForm(c, negated)).toList();
                yield negated ? LogicalNode.or(children) : LogicalNode.and(children);
            }
            case OR -> {
                List<LogicalNode> children = node.children().stream()
                        .map(c -> toNegationNormalForm(c, negated)).toList();
                yield negated ? LogicalNode.and(children) : LogicalNode.or(children);
            }
            case IMPLIES, IFF -> throw new IllegalStateException(node.kind() + " must be eliminated before NNF");
        };
    }

    // ── 4. Distribution ──

    /**
     * Clause lists of an NNF tree, or null once more than {@code maxClauses} clauses are produced.
     */
    private List<List<Literal>> distribute(LogicalNode node, int maxClauses) {
        return switch (node.kind()) {
            case ATOM, MODAL -> List.of(List.of(Literal.positive(node)));
            case NOT -> List.of(List.of(Literal.negative(node.child())));
            case AND -> distributeConjunction(node, maxClauses);
            case OR -> distributeDisjunction(node, maxClauses);
            default -> throw new IllegalStateException("Unexpected " + node.kind() + " in negation normal form");
        };
    }

    private List<List<Literal>> distributeConjunction(LogicalNode node, int maxClauses) {
        List<List<Literal>> clauses = new ArrayList<>();
        for (LogicalNode child : node.children()) {
            List<List<Literal>> childClauses = distribute(child, maxClauses);
            if (childClauses == null) {
                return null;
            }
            clauses.addAll(childClauses);
            if (clauses.size() > maxClauses) {
                return null;
            }
        }
        return clauses;
    }

    /**
     * OR(x, AND(y, z)) → AND(OR(x, y), OR(x, z)), folded over the children left to right.
     */
    private List<List<Literal>> distributeDisjunction(LogicalNode node, int maxClauses) {
        List<List<Literal>> product = List.of(List.of());
        for (LogicalNode child : node.children()) {
            List<List<Literal>> childClauses = distribute(child, maxClauses);
            if (childClauses == null) {
                return null;
            }
            List<List<Literal>> next = new ArrayList<>();
            for (List<Literal> left : product) {
                for (List<Literal> right : childClauses) {
                    List<Literal> merged = new ArrayList<>(left.size() + right.size());
                    merged.addAll(left);
                    merged.addAll(right);
                    next.add(merged);
                    if (next.size() > maxClauses) {
                        return null;
                    }
                }
            }
            product = next;
        }
        return product;
    }

    // ── 5. Flattening and simplification ──

    private CnfResult simplify(List<List<Literal>> raw) {
        List<Clause> clauses = new ArrayList<>();
        List<Set<Literal>> seen = new ArrayList<>();
        List<Clause> tautologies = new ArrayList<>();
        List<Clause> emptied = new ArrayList<>();

        for (List<Literal> literals : raw) {
            Clause clause = new Clause(literals);
            Set<Literal> complementary = complementaryLiterals(clause);

            if (!complementary.isEmpty()) {
                if (complementary.size() == clause.literals().size()) {
                    log.warn("[CnfTransformer] Clause {} reduced to the empty clause", clause.render());
                    emptied.add(clause);
                } else {
                    log.warn("[CnfTransformer] Dropping tautological clause {}", clause.render());
                    tautologies.add(clause);
                }
                continue;
            }

            Set<Literal> literalSet = clause.literalSet();
            if (seen.contains(literalSet)) {
                continue;
            }
            seen.add(literalSet);
            clauses.add(clause);
        }

        CnfResult result = CnfResult.distributed(clauses, tautologies, !emptied.isEmpty());
        log.debug("[CnfTransformer] {} clauses, {} tautological dropped, {} emptied",
                clauses.size(), tautologies.size(), emptied.size());
        if (!emptied.isEmpty()) {
            throw new ContradictionDetectedException(result, emptied);
        }
        return result;
    }

    private static Set<Literal> complementaryLiterals(Clause clause) {
        Set<Literal> literals = clause.literalSet();
        Set<Literal> complementary = new LinkedHashSet<>();
        for (Literal literal : clause.literals()) {
            if (literals.contains(literal.negate())) {
                complementary.add(literal);
            }
        }
        return complementary;
    }

    private static LogicalNode rebuild(LogicalNode node, List<LogicalNode> children) {
        return new LogicalNode(node.kind(), node.symbol(), node.operator(), children);
    }
}
