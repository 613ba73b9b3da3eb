package com.witty.domain.formalize.model;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.time.Duration;

/**
 * Immutable per-request options. Resolved once, outside the pipeline, and passed into every stage.
 *
 * @param privacyMode                 DEFAULT passes provenance through, STRICT redacts excerpts and URLs
 * @param reproducibleMode            forces the mock adapter, a logical clock and no retrieval
 * @param retrievalEnabled            consult the retrieval adapter during claim reduction
 * @param retrievalTopK               documents requested from the retrieval adapter
 * @param topKSymbolizations          validated logical-form candidates kept
 * @param deterministicSalt           salt mixed into every provenance id
 * @param adapterId                   adapter used when not in reproducible mode
 * @param adapterTimeout              bound on each adapter call
 * @param claimConfidenceThreshold    minimum parsed confidence accepted from claim segmentation hints
 * @param symbolConfidenceThreshold   minimum parsed confidence accepted from logical-form suggestions
 * @param maxClauses                  CNF clause ceiling
 * @param provenanceCoverageThreshold warn when provenance coverage falls below this ratio
 * @param confidenceFloor             confidence forced when a contradiction is detected
 * @param fallbackConfidence          stage confidence reported after a deterministic fallback
 * @param maxInputLength              longest accepted input, in characters
 */
@Builder(toBuilder = true)
public record FormalizeOptions(
        @NotNull PrivacyMode privacyMode,
        boolean reproducibleMode,
        boolean retrievalEnabled,
        @Min(1) @Max(50) int retrievalTopK,
        @Min(1) @Max(20) int topKSymbolizations,
        @NotNull String deterministicSalt,
        @NotBlank String adapterId,
        @NotNull Duration adapterTimeout,
        @DecimalMin("0.0") @DecimalMax("1.0") double claimConfidenceThreshold,
        @DecimalMin("0.0") @DecimalMax("1.0") double symbolConfidenceThreshold,
        @Min(1) int maxClauses,
        @DecimalMin("0.0") @DecimalMax("1.0") double provenanceCoverageThreshold,
        @DecimalMin("0.0") @DecimalMax("1.0") double confidenceFloor,
        @DecimalMin("0.0") @DecimalMax("1.0") double fallbackConfidence,
        @Min(1) int maxInputLength
) {

    public static final String MOCK_ADAPTER_ID = "mock";

    public static FormalizeOptions defaults() {
        return FormalizeOptions.builder()
                .privacyMode(PrivacyMode.DEFAULT)
                .reproducibleMode(false)
                .retrievalEnabled(false)
                .retrievalTopK(3)
                .topKSymbolizations(3)
                .deterministicSalt("")
                .adapterId(MOCK_ADAPTER_ID)
                .adapterTimeout(Duration.ofSeconds(30))
                .claimConfidenceThreshold(0.6)
                .symbolConfidenceThreshold(0.6)
                .maxClauses(256)
                .provenanceCoverageThreshold(1.0)
                .confidenceFloor(0.0)
                .fallbackConfidence(0.5)
                .maxInputLength(10_000)
                .build();
    }

    @AssertTrue(message = "adapterTimeout must be positive")
    public boolean isAdapterTimeoutPositive() {
        return adapterTimeout == null || (!adapterTimeout.isNegative() && !adapterTimeout.isZero());
    }

    /**
     * Adapter actually consulted: reproducible mode always resolves the mock.
     */
    public String effectiveAdapterId() {
        return reproducibleMode ? MOCK_ADAPTER_ID : adapterId;
    }

    public boolean retrievalActive() {
        return retrievalEnabled && !reproducibleMode;
    }
}
