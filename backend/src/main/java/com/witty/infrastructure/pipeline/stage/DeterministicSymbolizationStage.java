package com.witty.infrastructure.pipeline.stage;

import com.witty.domain.formalize.model.AmbiguityFlags;
import com.witty.domain.formalize.model.AtomicClaim;
import com.witty.domain.formalize.model.CandidateOrigin;
import com.witty.domain.formalize.model.ClaimSet;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.Legend;
import com.witty.domain.formalize.model.LogicalFormCandidate;
import com.witty.domain.formalize.model.ProvenanceRecord;
import com.witty.domain.formalize.model.StageId;
import com.witty.domain.formalize.model.StageResult;
import com.witty.domain.formalize.model.Symbolization;
import com.witty.infrastructure.adapter.AdapterProvenance;
import com.witty.infrastructure.pipeline.FormalizationContext;
import com.witty.infrastructure.pipeline.FormalizationStage;
import com.witty.infrastructure.provenance.ProvenanceLedger;
import com.witty.infrastructure.provenance.StageEventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Symbolization without the adapter: symbols in emission order and the default conjunction as the only candidate.
 */
@Slf4j
@RequiredArgsConstructor
public class DeterministicSymbolizationStage implements FormalizationStage<ClaimSet, Symbolization> {

    private final Symbolizer symbolizer;
    private final ProvenanceLedger ledger;

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

        LogicalFormCandidate conjunction = defaultCandidate(symbolized, 1.0);
        events.recordSince(start, EventKind.DETERMINISTIC_PASS,
                legend.size() + " symbols, default conjunction " + conjunction.notation());

        return assemble(context, start, symbolized, legend, List.of(conjunction), conjunction, events, null, null,
                1.0, Set.of(AmbiguityFlags.DEFAULT_CONJUNCTION));
    }

    LogicalFormCandidate defaultCandidate(List<AtomicClaim> symbolized, double confidence) {
        return LogicalFormCandidate.of(symbolizer.defaultConjunction(symbolized), confidence,
                symbolized.stream().map(AtomicClaim::identifier).toList(), CandidateOrigin.DEFAULT_CONJUNCTION);
    }

    StageResult<Symbolization> assemble(FormalizationContext context, Instant start, List<AtomicClaim> symbolized,
                                        Legend legend, List<LogicalFormCandidate> candidates,
                                        LogicalFormCandidate chosen, StageEventLog events,
                                        AdapterProvenance adapter, String templateId,
                                        double confidence, Set<String> flags) {
        Set<String> chosenClaims = new LinkedHashSet<>();
        chosen.ast().symbols().forEach(symbol -> chosenClaims.add(legend.claimIdentifier(symbol)));

        ProvenanceRecord provenance = ledger.begin(context.normalizedInput(), StageId.SYMBOLIZATION,
                        context.getOptions().deterministicSalt(), start)
                .adapterId(adapter != null ? adapter.adapterId() : null)
                .templateId(templateId)
                .adapterRequestId(adapter != null ? adapter.requestId() : null)
                .confidence(confidence)
                .originSpans(symbolized.stream()
                        .filter(claim -> chosenClaims.contains(claim.identifier()))
                        .flatMap(claim -> claim.originSpans().stream())
                        .distinct()
                        .toList())
                .ambiguityFlags(flags)
                .reductionRationale("chosen " + chosen.origin().name().toLowerCase() + " candidate " + chosen.notation())
                .eventLog(events.events())
                .build();

        log.info("[Symbolization] {} symbols, {} candidates, chosen {} (confidence={})",
                legend.size(), candidates.size(), chosen.notation(), confidence);
        return new StageResult<>(new Symbolization(symbolized, legend, candidates, chosen), provenance, confidence,
                AmbiguityFlags.warnings(provenance.ambiguityFlags(), StageId.SYMBOLIZATION));
    }
}
