package com.witty.infrastructure.pipeline.stage;

import com.witty.domain.formalize.model.AnnotatedSpan;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.IngestedText;
import com.witty.domain.formalize.model.NormalizedText;
import com.witty.domain.formalize.model.OriginSpan;
import com.witty.domain.formalize.model.PreprocessedText;
import com.witty.domain.formalize.model.ProvenanceRecord;
import com.witty.domain.formalize.model.StageId;
import com.witty.domain.formalize.model.StageResult;
import com.witty.infrastructure.pipeline.FormalizationContext;
import com.witty.infrastructure.pipeline.FormalizationStage;
import com.witty.infrastructure.preprocessing.ClauseSegmenter;
import com.witty.infrastructure.preprocessing.ClauseSegmenter.ClauseSpan;
import com.witty.infrastructure.preprocessing.MarkerAnnotator;
import com.witty.infrastructure.provenance.ProvenanceLedger;
import com.witty.infrastructure.provenance.StageEventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Clause segmentation and marker annotation. One event per clause, carrying its excerpt and original span.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PreprocessingStage implements FormalizationStage<IngestedText, PreprocessedText> {

    private final ClauseSegmenter segmenter;
    private final MarkerAnnotator annotator;
    private final ProvenanceLedger ledger;

    @Override
    public StageId stageId() {
        return StageId.PREPROCESSING;
    }

    @Override
    public StageResult<PreprocessedText> execute(IngestedText input, FormalizationContext context) {
        StageEventLog events = context.newEventLog();
        Instant start = events.mark();
        NormalizedText normalized = input.normalized();

        List<ClauseSpan> spans = segmenter.segment(normalized.text());
        if (spans.isEmpty()) {
            spans = List.of(new ClauseSpan(normalized.text(), 0, normalized.length()));
        }
        List<AnnotatedSpan> clauses = annotator.annotate(normalized.text(), spans);

        List<OriginSpan> originSpans = new ArrayList<>();
        for (AnnotatedSpan clause : clauses) {
            OriginSpan origin = normalized.toOriginal(clause.start(), clause.end());
            originSpans.add(origin);
            events.recordExcerpt(EventKind.DETERMINISTIC_PASS,
                    "clause with " + clause.markers().size() + " markers", clause.text(), origin);
        }

        ProvenanceRecord provenance = ledger.begin(normalized.text(), StageId.PREPROCESSING,
                        context.getOptions().deterministicSalt(), start)
                .confidence(1.0)
                .originSpans(originSpans)
                .reductionRationale("rule-based clause segmentation")
                .eventLog(events.events())
                .build();

        log.debug("[Preprocessing] {} clauses", clauses.size());
        return StageResult.of(new PreprocessedText(normalized, clauses), provenance);
    }
}
