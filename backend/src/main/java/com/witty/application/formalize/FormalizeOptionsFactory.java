package com.witty.application.formalize;

import com.witty.application.formalize.exception.InvalidOptionsException;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.domain.formalize.model.PrivacyMode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves configured defaults and per-request overrides into one immutable {@link FormalizeOptions}.
 */
@Component
@RequiredArgsConstructor
public class FormalizeOptionsFactory {

    private final Validator validator;

    @Value("${formalizer.privacy-mode:default}")
    private String privacyMode;

    @Value("${formalizer.reproducible-mode:false}")
    private boolean reproducibleMode;

    @Value("${formalizer.retrieval.enabled:false}")
    private boolean retrievalEnabled;

    @Value("${formalizer.retrieval.top-k:3}")
    private int retrievalTopK;

    @Value("${formalizer.symbolization.top-k:3}")
    private int topKSymbolizations;

    @Value("${formalizer.deterministic-salt:}")
    private String deterministicSalt;

    @Value("${formalizer.adapter.id:mock}")
    private String adapterId;

    @Value("${formalizer.adapter.timeout:30s}")
    private Duration adapterTimeout;

    @Value("${formalizer.thresholds.claim-confidence:0.6}")
    private double claimConfidenceThreshold;

    @Value("${formalizer.thresholds.symbol-confidence:0.6}")
    private double symbolConfidenceThreshold;

    @Value("${formalizer.cnf.max-clauses:256}")
    private int maxClauses;

    @Value("${formalizer.thresholds.provenance-coverage:1.0}")
    private double provenanceCoverageThreshold;

    @Value("${formalizer.confidence.floor:0.0}")
    private double confidenceFloor;

    @Value("${formalizer.confidence.fallback:0.5}")
    private double fallbackConfidence;

    @Value("${formalizer.max-input-length:10000}")
    private int maxInputLength;

    /**
     * Configured options with no per-request overrides.
     */
    public FormalizeOptions defaults() {
        return resolve(null, null, null, null, null);
    }

    /**
     * @param privacy      {@code default} or {@code strict}, case-insensitive; null keeps the configured mode
     * @param reproducible null keeps the configured flag
     * @param salt         null keeps the configured salt
     * @param retrieval    null keeps the configured flag
     * @param topK         null keeps the configured number of kept symbolizations
     * @throws InvalidOptionsException if the resolved options are malformed
     */
    public FormalizeOptions resolve(String privacy, Boolean reproducible, String salt, Boolean retrieval, Integer topK) {
        FormalizeOptions options = FormalizeOptions.builder()
                .privacyMode(parsePrivacyMode(privacy != null ? privacy : privacyMode))
                .reproducibleMode(reproducible != null ? reproducible : reproducibleMode)
                .retrievalEnabled(retrieval != null ? retrieval : retrievalEnabled)
                .retrievalTopK(retrievalTopK)
                .topKSymbolizations(topK != null ? topK : topKSymbolizations)
                .deterministicSalt(salt != null ? salt : deterministicSalt)
                .adapterId(adapterId)
                .adapterTimeout(adapterTimeout)
                .claimConfidenceThreshold(claimConfidenceThreshold)
                .symbolConfidenceThreshold(symbolConfidenceThreshold)
                .maxClauses(maxClauses)
                .provenanceCoverageThreshold(provenanceCoverageThreshold)
                .confidenceFloor(confidenceFloor)
                .fallbackConfidence(fallbackConfidence)
                .maxInputLength(maxInputLength)
                .build();

        Set<ConstraintViolation<FormalizeOptions>> violations = validator.validate(options);
        if (!violations.isEmpty()) {
            throw new InvalidOptionsException(violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; ")));
        }
        return options;
    }

    private static PrivacyMode parsePrivacyMode(String raw) {
        try {
            return PrivacyMode.valueOf(raw.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException("Unknown privacy mode '" + raw + "', expected default or strict");
        }
    }
}
