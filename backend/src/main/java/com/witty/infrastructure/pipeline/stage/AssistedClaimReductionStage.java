package com.witty.infrastructure.pipeline.stage;

import com.witty.domain.formalize.model.AmbiguityFlags;
import com.witty.domain.formalize.model.ClaimDraft;
import com.witty.domain.formalize.model.ClaimSet;
import com.witty.domain.formalize.model.EnrichmentSource;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.PreprocessedText;
import com.witty.domain.formalize.model.StageId;
import com.witty.domain.formalize.model.StageResult;
import com.witty.infrastructure.adapter.AdapterRequest;
import com.witty.infrastructure.adapter.AdapterResponse;
import com.witty.infrastructure.adapter.AdapterResponseParser;
import com.witty.infrastructure.adapter.AdapterResponseParser.SegmentationHints;
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
import java.util.List;
import java.util.Set;

/**
 * Claim reduction guided by adapter segmentation hints ({@code segment_v1}), with the deterministic
 * offset walk as fallback once the retry is exhausted.
 */
@Slf4j
@RequiredArgsConstructor
public class AssistedClaimReductionStage implements FormalizationStage<PreprocessedText, ClaimSet> {

    private final DeterministicClaimReductionStage fallback;
    private final ClaimReducer reducer;
    private final EnrichmentCollector enrichment;
    private final AssistedCallPolicy policy;
    private final PromptTemplateRegistry templates;
    private final AdapterResponseParser parser;

    @Override
    public StageId stageId() {
        return StageId.CLAIM_REDUCTION;
    }

    @Override
    public StageResult<ClaimSet> execute(PreprocessedText input, FormalizationContext context) {
        StageEventLog events = context.newEventLog();
        Instant start = events.mark();
        List<EnrichmentSource> sources = enrichment.collect(context, events);
        PromptTemplate template = templates.get(PromptTemplateRegistry.SEGMENT);

        Outcome<SegmentationHints> outcome = policy.call(context, new AssistedCallPolicy.AssistedCall<>() {
            @Override
            public AdapterRequest request(int attempt) {
                return template.toRequest(context.normalizedInput(), null, attempt);
            }

            @Override
            public SegmentationHints parse(AdapterResponse response) {
                return parser.parseSegmentation(response, context.getNormalized().length());
            }

            @Override
            public double confidence(SegmentationHints parsed) {
                return parsed.confidence();
            }
        }, context.getOptions().claimConfidenceThreshold(), events);

        if (outcome.succeeded()) {
            List<ClaimDraft> drafts = reducer.completeFromMarkers(outcome.value().claims(), input);
            return fallback.assemble(context, start, drafts, events, sources, outcome.provenance(), template.id(),
                    outcome.value().confidence(), Set.of(), "adapter segmentation hints");
        }

        List<ClaimDraft> drafts = reducer.draftsFromSpans(input);
        events.record(EventKind.FALLBACK_SUCCEEDED, "deterministic offset walk produced " + drafts.size() + " claims");
        log.warn("[ClaimReduction] Adapter exhausted after {} attempts, using deterministic fallback", outcome.attempts());
        return fallback.assemble(context, start, drafts, events, sources, null, template.id(),
                context.getOptions().fallbackConfidence(), Set.of(AmbiguityFlags.HUMAN_REVIEW),
                "deterministic fallback after adapter failures");
    }
}
