package com.witty.infrastructure.validation;

import com.witty.domain.formalize.logic.Clause;
import com.witty.domain.formalize.logic.Literal;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Satisfiability of a clause set. Literal tokens are propositional variables; MODAL tokens are opaque.
 *
 * Exact DPLL with unit propagation up to {@link #MAX_EXACT_TOKENS} distinct tokens; above that only
 * complementary unit clauses are detected.
 */
@Component
public class SatisfiabilityChecker {

    static final int MAX_EXACT_TOKENS = 64;

    public boolean isSatisfiable(List<Clause> clauses) {
        if (clauses.stream().anyMatch(Clause::isEmpty)) {
            return false;
        }
        long tokens = clauses.stream().flatMap(c -> c.tokens().stream()).distinct().count();
        if (tokens > MAX_EXACT_TOKENS) {
            return !hasComplementaryUnits(clauses);
        }
        return dpll(clauses.stream().map(Clause::literals).toList());
    }

    /**
     * True when two unit clauses assert a literal and its negation.
     */
    public boolean hasComplementaryUnits(List<Clause> clauses) {
        Map<String, Boolean> units = new HashMap<>();
        for (Clause clause : clauses) {
            if (!clause.isUnit()) {
                continue;
            }
            Literal literal = clause.literals().get(0);
            Boolean previous = units.putIfAbsent(literal.token(), literal.positive());
            if (previous != null && previous != literal.positive()) {
                return true;
            }
        }
        return false;
    }

    private boolean dpll(List<List<Literal>> clauses) {
        List<List<Literal>> current = clauses;

        // Unit propagation
        while (true) {
            Optional<Literal> unit = current.stream().filter(c -> c.size() == 1).map(c -> c.get(0)).findFirst();
            if (unit.isEmpty()) {
                break;
            }
            current = assign(current, unit.get().token(), unit.get().positive());
            if (current == null) {
                return false;
            }
        }

        if (current.isEmpty()) {
            return true;
        }

        Literal branch = current.get(0).get(0);
        for (boolean value : new boolean[]{branch.positive(), !branch.positive()}) {
            List<List<Literal>> reduced = assign(current, branch.token(), value);
            if (reduced != null && dpll(reduced)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Clauses remaining after setting {@code token} to {@code value}, or null if a clause became empty.
     */
    private static List<List<Literal>> assign(List<List<Literal>> clauses, String token, boolean value) {
        List<List<Literal>> out = new ArrayList<>(clauses.size());
        for (List<Literal> clause : clauses) {
            boolean satisfied = false;
            List<Literal> remaining = new ArrayList<>(clause.size());
            for (Literal literal : clause) {
                if (literal.token().equals(token)) {
                    if (literal.positive() == value) {
                        satisfied = true;
                        break;
                    }
                } else {
                    remaining.add(literal);
                }
            }
            if (satisfied) {
                continue;
            }
            if (remaining.isEmpty()) {
                return null;
            }
            out.add(remaining);
        }
        return out;
    }
}
