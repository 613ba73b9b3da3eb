package com.witty.infrastructure.pipeline.stage;

import com.witty.domain.formalize.model.AmbiguityFlags;
import com.witty.domain.formalize.model.AtomicClaim;
import com.witty.domain.formalize.model.ClaimDraft;
import com.witty.domain.formalize.model.ClaimSet;
import com.witty.domain.formalize.model.EnrichmentSource;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.PreprocessedText;
import com.witty.domain.formalize.model.ProvenanceRecord;
import com.witty.domain.formalize.model.StageId;
import com.witty.domain.formalize.model.StageResult;
import com.witty.infrastructure.adapter.AdapterProvenance;
import com.witty.infrastructure.pipeline.FormalizationContext;
import com.witty.infrastructure.pipeline.FormalizationStage;
import com.witty.infrastructure.provenance.ProvenanceLedger;
import com.witty.infrastructure.provenance.StageEventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Claim reduction without the adapter: the offset-ordered walk over clause spans.
 */
@Slf4j
@RequiredArgsConstructor
public class DeterministicClaimReductionStage implements FormalizationStage<PreprocessedText, ClaimSet> {

    private final ClaimReducer reducer;
    private final EnrichmentCollector enrichment;
    private final ProvenanceLedger ledger;

    @Override
    public StageId stageId() {
        return StageId.CLAIM_REDUCTION;
    }

    @Override
    public StageResult<ClaimSet> execute(PreprocessedText input, FormalizationContext context) {
        StageEventLog events = context.newEventLog();
        Instant start = events.mark();
        List<EnrichmentSource> sources = enrichment.collect(context, events);

        List<ClaimDraft> drafts = reducer.draftsFromSpans(input);
        events.recordSince(start, EventKind.DETERMINISTIC_PASS, "offset walk over " + drafts.size() + " clause spans");

        return assemble(context, start, drafts, events, sources, null, null, 1.0, Set.of(),
                "offset-ordered walk over clause spans");
    }

    /**
     * Reduce drafts into a claim set and wrap it with the stage provenance.
     *
     * @param adapter    provenance of the accepted adapter response (nullable)
     * @param templateId prompt template consulted (nullable)
     */
    StageResult<ClaimSet> assemble(FormalizationContext context, Instant start, List<ClaimDraft> drafts,
                                   StageEventLog events, List<EnrichmentSource> sources,
                                   AdapterProvenance adapter, String templateId,
                                   double confidence, Set<String> flags, String rationale) {
        ProvenanceRecord base = ledger.begin(context.normalizedInput(), StageId.CLAIM_REDUCTION,
                        context.getOptions().deterministicSalt(), start)
                .adapterId(adapter != null ? adapter.adapterId() : null)
                .templateId(templateId)
                .adapterRequestId(adapter != null ? adapter.requestId() : null)
                .confidence(confidence)
                .build();

        List<AtomicClaim> claims = reducer.reduce(drafts, base, rationale, context);

        ProvenanceRecord provenance = base.toBuilder()
                .originSpans(claims.stream().flatMap(c -> c.originSpans().stream()).distinct().toList())
                .enrichmentSources(sources)
                .ambiguityFlags(flags)
                .reductionRationale(rationale)
                .eventLog(events.events())
                .build();

        log.info("[ClaimReduction] {} claims (confidence={}, flags={})", claims.size(), confidence, flags);
        return new StageResult<>(new ClaimSet(context.normalizedInput(), claims), provenance, confidence,
                AmbiguityFlags.warnings(provenance.ambiguityFlags(), StageId.CLAIM_REDUCTION));
    }
}
