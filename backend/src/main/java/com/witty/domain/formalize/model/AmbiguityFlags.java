package com.witty.domain.formalize.model;

import java.util.Collection;
import java.util.List;

/**
 * Ambiguity flags recorded in provenance, and the {@code flag:stage} warnings they surface as.
 */
public final class AmbiguityFlags {

    public static final String HUMAN_REVIEW = "human_review";
    public static final String DEFAULT_CONJUNCTION = "default_conjunction";
    public static final String CANDIDATE_REJECTED = "candidate_rejected";
    public static final String TAUTOLOGICAL_CLAUSE = "tautological_clause_dropped";
    public static final String CONTRADICTION = "contradiction_detected";
    public static final String SIZE_LIMIT = "size_limit_exceeded";

    private AmbiguityFlags() {
    }

    public static String warning(String flag, StageId stage) {
        return flag + ":" + stage.id();
    }

    public static List<String> warnings(Collection<String> flags, StageId stage) {
        return flags.stream().map(flag -> warning(flag, stage)).toList();
    }
}
