package com.witty.infrastructure.pipeline.stage;

import com.witty.domain.formalize.model.AmbiguityFlags;
import com.witty.domain.formalize.model.AtomicClaim;
import com.witty.domain.formalize.model.CandidateOrigin;
import com.witty.domain.formalize.model.ClaimSet;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.Legend;
import com.witty.domain.formalize.model.LogicalFormCandidate;
import com.witty.domain.formalize.model.StageId;
import com.witty.domain.formalize.model.StageResult;
import com.witty.domain.formalize.model.Symbolization;
import com.witty.infrastructure.adapter.AdapterRequest;
import com.witty.infrastructure.adapter.AdapterResponse;
import com.witty.infrastructure.adapter.AdapterResponseParser;
import com.witty.infrastructure.adapter.AdapterResponseParser.CandidateSuggestion;
import com.witty.infrastructure.adapter.AdapterResponseParser.CandidateSuggestions;
import com.witty.infrastructure.adapter.template.PromptTemplate;
import com.witty.infrastructure.adapter.template.PromptTemplateRegistry;
import com.witty.infrastructure.pipeline.AssistedCallPolicy;
import com.witty.infrastructure.pipeline.AssistedCallPolicy.Outcome;
import com.witty.infrastructure.pipeline.FormalizationContext;
import com.witty.infrastructure.pipeline.FormalizationStage;
import com.witty.infrastructure.provenance.StageEventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Symbolization with adapter-suggested logical forms ({@code symbolize_v1}).
 *
 * Each suggestion is checked against the legend; invalid ones are rejected and flagged, never repaired.
 * Up to {@code topKSymbolizations} valid candidates are kept and the highest-confidence one is chosen,
 * the first on ties. When nothing validates, or the adapter fails twice, the default conjunction is chosen.
 */
@Slf4j
@RequiredArgsConstructor
public class AssistedSymbolizationStage implements FormalizationStage<ClaimSet, Symbolization> {

    private final DeterministicSymbolizationStage fallback;
    private final Symbolizer symbolizer;
    private final AssistedCallPolicy policy;
    private final PromptTemplateRegistry templates;
    private final AdapterResponseParser parser;

    @Override
    public StageId stageId() {
        return StageId.SYMBOLIZATION;
    }

    @Override
    public StageResult<Symbolization> execute(ClaimSet input, FormalizationContext context) {
        StageEventLog events = context.newEventLog();
        Instant start = events.mark();
        List<AtomicClaim> symbolized = symbolizer.assignSymbols(input.claims());
        Legend legend = Legend.bind(symbolized);
        PromptTemplate template = templates.get(PromptTemplateRegistry.SYMBOLIZE);
        String promptContext = legendContext(symbolized);

        Outcome<CandidateSuggestions> outcome = policy.call(context, new AssistedCallPolicy.AssistedCall<>() {
            @Override
            public AdapterRequest request(int attempt) {
                return template.toRequest(context.normalizedInput(), promptContext, attempt);
            }

            @Override
            public CandidateSuggestions parse(AdapterResponse response) {
                return parser.parseCandidates(response);
            }

            @Override
            public double confidence(CandidateSuggestions parsed) {
                return parsed.confidence();
            }
        }, context.getOptions().symbolConfidenceThreshold(), events);

        Set<String> flags = new TreeSet<>();
        if (!outcome.succeeded()) {
            LogicalFormCandidate conjunction = fallback.defaultCandidate(symbolized, context.getOptions().fallbackConfidence());
            events.record(EventKind.FALLBACK_SUCCEEDED, "default conjunction " + conjunction.notation());
            flags.add(AmbiguityFlags.HUMAN_REVIEW);
            flags.add(AmbiguityFlags.DEFAULT_CONJUNCTION);
            log.warn("[Symbolization] Adapter exhausted after {} attempts, using default conjunction", outcome.attempts());
            return fallback.assemble(context, start, symbolized, legend, List.of(conjunction), conjunction, events,
                    null, template.id(), context.getOptions().fallbackConfidence(), flags);
        }

        List<LogicalFormCandidate> valid = new ArrayList<>();
        List<CandidateSuggestion> suggestions = outcome.value().candidates();
        for (int i = 0; i < suggestions.size(); i++) {
            CandidateSuggestion suggestion = suggestions.get(i);
            Optional<String> rejection = suggestion.ast() == null
                    ? Optional.of("malformed: " + suggestion.error())
                    : symbolizer.check(suggestion.ast(), suggestion.basis(), legend);
            if (rejection.isPresent()) {
                events.record(EventKind.CANDIDATE_REJECTED, "candidate " + (i + 1) + ": " + rejection.get());
                flags.add(AmbiguityFlags.CANDIDATE_REJECTED);
                continue;
            }
            if (valid.size() < context.getOptions().topKSymbolizations()) {
                valid.add(LogicalFormCandidate.of(suggestion.ast(), suggestion.confidence(),
                        suggestion.basis().isEmpty() ? allClaims(symbolized) : suggestion.basis(),
                        CandidateOrigin.ADAPTER));
            }
        }

        if (valid.isEmpty()) {
            LogicalFormCandidate conjunction = fallback.defaultCandidate(symbolized, outcome.value().confidence());
            events.record(EventKind.FALLBACK_SUCCEEDED, "no valid candidate, default conjunction " + conjunction.notation());
            flags.add(AmbiguityFlags.DEFAULT_CONJUNCTION);
            return fallback.assemble(context, start, symbolized, legend, List.of(conjunction), conjunction, events,
                    outcome.provenance(), template.id(), outcome.value().confidence(), flags);
        }

        // first candidate wins ties
        LogicalFormCandidate chosen = valid.get(0);
        for (LogicalFormCandidate candidate : valid) {
            if (candidate.confidence() > chosen.confidence()) {
                chosen = candidate;
            }
        }
        return fallback.assemble(context, start, symbolized, legend, valid, chosen, events,
                outcome.provenance(), template.id(), Math.min(outcome.value().confidence(), chosen.confidence()), flags);
    }

    private static List<String> allClaims(List<AtomicClaim> symbolized) {
        return symbolized.stream().map(AtomicClaim::identifier).toList();
    }

    /**
     * One line per symbol: {@code P1 (E1): text}.
     */
    static String legendContext(List<AtomicClaim> symbolized) {
        return symbolized.stream()
                .map(c -> c.symbol() + " (" + c.identifier() + "): " + c.text())
                .collect(Collectors.joining("\n"));
    }
}
