package com.witty.infrastructure.pipeline;

import java.util.Locale;

/**
 * Whether a stage consults the adapter.
 */
public enum StageMode {
    ASSISTED,
    DETERMINISTIC;

    public static StageMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ASSISTED;
        }
        try {
            return valueOf(raw.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown stage mode '" + raw + "', expected assisted or deterministic", e);
        }
    }
}
