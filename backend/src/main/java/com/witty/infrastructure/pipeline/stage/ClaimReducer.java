package com.witty.infrastructure.pipeline.stage;

import com.witty.domain.formalize.model.AnnotatedSpan;
import com.witty.domain.formalize.model.AtomicClaim;
import com.witty.domain.formalize.model.ClaimCategory;
import com.witty.domain.formalize.model.ClaimDraft;
import com.witty.domain.formalize.model.ModalTag;
import com.witty.domain.formalize.model.NormalizedText;
import com.witty.domain.formalize.model.OriginSpan;
import com.witty.domain.formalize.model.PreprocessedText;
import com.witty.domain.formalize.model.ProvenanceRecord;
import com.witty.domain.formalize.model.StageId;
import com.witty.infrastructure.pipeline.FormalizationContext;
import com.witty.infrastructure.provenance.ProvenanceLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns clause drafts into identified atomic claims.
 *
 * Drafts are walked in ascending start offset, ties broken by ascending span length. Each draft gets the
 * next identifier of its category ({@code E{n}} event-like, {@code R{n}} relational or quantifier-reduced),
 * counters being per category in first-occurrence order. Presuppositions become RELATIONAL claims inserted
 * right after the claim that introduced them and share its origin span.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClaimReducer {

    static final Comparator<ClaimDraft> WALK_ORDER = Comparator
            .comparingInt(ClaimDraft::start)
            .thenComparingInt(ClaimDraft::length);

    private final ProvenanceLedger ledger;

    /**
     * Deterministic drafts: one per clause span, no expansion beyond literal clause boundaries.
     */
    public List<ClaimDraft> draftsFromSpans(PreprocessedText preprocessed) {
        List<ClaimDraft> drafts = new ArrayList<>();
        for (AnnotatedSpan span : preprocessed.clauses()) {
            ClaimCategory category = span.hasQuantifier() ? ClaimCategory.RELATIONAL : ClaimCategory.EVENT;
            drafts.add(new ClaimDraft(span.text(), span.start(), span.end(), category,
                    span.modal().orElse(null), List.of()));
        }
        return drafts;
    }

    /**
     * Fill in category and modal context the adapter left out, from the markers of the overlapping clause.
     */
    public List<ClaimDraft> completeFromMarkers(List<ClaimDraft> drafts, PreprocessedText preprocessed) {
        List<ClaimDraft> completed = new ArrayList<>(drafts.size());
        for (ClaimDraft draft : drafts) {
            AnnotatedSpan span = preprocessed.clauses().stream()
                    .filter(s -> s.start() < draft.end() && draft.start() < s.end())
                    .findFirst()
                    .orElse(null);
            ClaimCategory category = draft.category();
            if (category == null) {
                category = span != null && span.hasQuantifier() ? ClaimCategory.RELATIONAL : ClaimCategory.EVENT;
            }
            ModalTag modal = draft.modal() != null || span == null ? draft.modal() : span.modal().orElse(null);
            completed.add(new ClaimDraft(draft.text(), draft.start(), draft.end(), category, modal, draft.presuppositions()));
        }
        return completed;
    }

    /**
     * Assign identifiers and claim-level provenance.
     *
     * @param drafts        drafts in any order
     * @param stageTemplate stage-level record the claim records are derived from (adapter, template, confidence)
     * @param rationale     how the drafts were obtained
     */
    public List<AtomicClaim> reduce(List<ClaimDraft> drafts, ProvenanceRecord stageTemplate,
                                    String rationale, FormalizationContext context) {
        NormalizedText normalized = context.getNormalized();
        List<ClaimDraft> ordered = drafts.stream().sorted(WALK_ORDER).toList();
        Map<ClaimCategory, Integer> counters = new EnumMap<>(ClaimCategory.class);
        List<AtomicClaim> claims = new ArrayList<>();

        for (ClaimDraft draft : ordered) {
            OriginSpan span = normalized.toOriginal(draft.start(), draft.end());
            String identifier = nextIdentifier(draft.category(), counters);
            claims.add(claim(identifier, draft.text(), span, draft.category(), draft.modal(), null,
                    stageTemplate, rationale, context));

            for (String presupposition : draft.presuppositions()) {
                String presupposed = nextIdentifier(ClaimCategory.RELATIONAL, counters);
                claims.add(claim(presupposed, presupposition, span, ClaimCategory.RELATIONAL, null, identifier,
                        stageTemplate, "presupposition of " + identifier, context));
            }
        }

        log.debug("[ClaimReducer] {} drafts → {} claims", drafts.size(), claims.size());
        return claims;
    }

    private AtomicClaim claim(String identifier, String text, OriginSpan span, ClaimCategory category,
                              ModalTag modal, String introducedBy,
                              ProvenanceRecord stageTemplate, String rationale, FormalizationContext context) {
        ProvenanceRecord provenance = stageTemplate.toBuilder()
                .id(ledger.claimId(context.normalizedInput(), StageId.CLAIM_REDUCTION,
                        context.getOptions().deterministicSalt(), identifier))
                .createdAt(context.getClock().now())
                .originSpans(List.of(span))
                .enrichmentSources(List.of())
                .ambiguityFlags(Set.of())
                .reductionRationale(rationale)
                .eventLog(List.of())
                .build();
        return new AtomicClaim(identifier, text, List.of(span), category, modal, null, introducedBy, provenance);
    }

    private static String nextIdentifier(ClaimCategory category, Map<ClaimCategory, Integer> counters) {
        int n = counters.merge(category, 1, Integer::sum);
        return category.prefix() + n;
    }
}
