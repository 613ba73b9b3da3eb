package com.witty.domain.formalize.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bijective mapping Symbol → AtomicClaim, kept in symbol assignment order.
 *
 * @param entries       symbol → claim text
 * @param claimBySymbol symbol → claim identifier
 */
public record Legend(Map<String, String> entries, Map<String, String> claimBySymbol) {

    public Legend {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        claimBySymbol = Collections.unmodifiableMap(new LinkedHashMap<>(claimBySymbol));
    }

    /**
     * Build the legend from symbolized claims.
     *
     * @throws IllegalArgumentException if a claim has no symbol, or a symbol or claim is bound twice
     */
    public static Legend bind(List<AtomicClaim> claims) {
        Map<String, String> entries = new LinkedHashMap<>();
        Map<String, String> claimBySymbol = new LinkedHashMap<>();
        Set<String> boundClaims = new HashSet<>();
        for (AtomicClaim claim : claims) {
            if (claim.symbol() == null) {
                throw new IllegalArgumentException("Claim " + claim.identifier() + " has no symbol");
            }
            if (entries.containsKey(claim.symbol())) {
                throw new IllegalArgumentException("Symbol " + claim.symbol() + " bound twice");
            }
            if (!boundClaims.add(claim.identifier())) {
                throw new IllegalArgumentException("Claim " + claim.identifier() + " bound twice");
            }
            entries.put(claim.symbol(), claim.text());
            claimBySymbol.put(claim.symbol(), claim.identifier());
        }
        return new Legend(entries, claimBySymbol);
    }

    @JsonValue
    public Map<String, String> entries() {
        return entries;
    }

    public boolean contains(String symbol) {
        return entries.containsKey(symbol);
    }

    public Set<String> symbols() {
        return entries.keySet();
    }

    public String claimIdentifier(String symbol) {
        return claimBySymbol.get(symbol);
    }

    public int size() {
        return entries.size();
    }

    /**
     * True when every symbol maps to a distinct claim and every symbol has a claim.
     */
    public boolean isBijective() {
        return entries.keySet().equals(claimBySymbol.keySet())
                && new HashSet<>(claimBySymbol.values()).size() == claimBySymbol.size();
    }
}
