package com.witty.infrastructure.pipeline.stage;

import com.witty.domain.formalize.logic.LogicalNode;
import com.witty.domain.formalize.model.AtomicClaim;
import com.witty.domain.formalize.model.Legend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Symbol assignment, the default conjunction, and candidate checks against the legend.
 */
@Slf4j
@Component
public class Symbolizer {

    static final String SYMBOL_PREFIX = "P";

    /**
     * Assign {@code P1..Pn} in claim emission order.
     */
    public List<AtomicClaim> assignSymbols(List<AtomicClaim> claims) {
        List<AtomicClaim> symbolized = new ArrayList<>(claims.size());
        for (int i = 0; i < claims.size(); i++) {
            symbolized.add(claims.get(i).withSymbol(SYMBOL_PREFIX + (i + 1)));
        }
        return symbolized;
    }

    /**
     * Flat conjunction of every claim symbol; modal claims enter wrapped in their MODAL node.
     * A single claim yields its atom alone.
     */
    public LogicalNode defaultConjunction(List<AtomicClaim> symbolized) {
        List<LogicalNode> conjuncts = symbolized.stream()
                .map(claim -> {
                    LogicalNode atom = LogicalNode.atom(claim.symbol());
                    return claim.modalContext() != null ? LogicalNode.modal(claim.modalContext(), atom) : atom;
                })
                .toList();
        return conjuncts.size() == 1 ? conjuncts.get(0) : LogicalNode.and(conjuncts);
    }

    /**
     * Check a candidate against the legend.
     *
     * Structural: every ATOM must resolve to a legend symbol. Semantic: when a basis is given, every
     * referenced symbol must be bound to a claim listed in it, and the basis may only name known claims.
     *
     * @return the rejection reason, empty when the candidate is valid
     */
    public Optional<String> check(LogicalNode ast, List<String> basis, Legend legend) {
        Set<String> symbols = ast.symbols();
        for (String symbol : symbols) {
            if (!legend.contains(symbol)) {
                return Optional.of("unknown symbol " + symbol);
            }
        }
        if (basis == null || basis.isEmpty()) {
            return Optional.empty();
        }
        Set<String> known = new HashSet<>(legend.claimBySymbol().values());
        for (String claim : basis) {
            if (!known.contains(claim)) {
                return Optional.of("basis names unknown claim " + claim);
            }
        }
        Set<String> allowed = new HashSet<>(basis);
        for (String symbol : symbols) {
            String claim = legend.claimIdentifier(symbol);
            if (!allowed.contains(claim)) {
                return Optional.of(symbol + " references claim " + claim + " outside the candidate basis");
            }
        }
        return Optional.empty();
    }
}
