package com.witty.infrastructure.pipeline.stage;

import com.witty.application.formalize.exception.InvalidInputException;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.IngestedText;
import com.witty.domain.formalize.model.NormalizedText;
import com.witty.domain.formalize.model.OriginSpan;
import com.witty.domain.formalize.model.ProvenanceRecord;
import com.witty.domain.formalize.model.StageId;
import com.witty.domain.formalize.model.StageResult;
import com.witty.infrastructure.pipeline.FormalizationContext;
import com.witty.infrastructure.pipeline.FormalizationStage;
import com.witty.infrastructure.preprocessing.TextNormalizer;
import com.witty.infrastructure.provenance.ProvenanceLedger;
import com.witty.infrastructure.provenance.StageEventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Rejects unusable input, normalizes it and fixes the request id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestStage implements FormalizationStage<String, IngestedText> {

    private final TextNormalizer normalizer;
    private final ProvenanceLedger ledger;

    @Override
    public StageId stageId() {
        return StageId.INGEST;
    }

    @Override
    public StageResult<IngestedText> execute(String input, FormalizationContext context) {
        if (input == null || input.isBlank()) {
            throw new InvalidInputException("Input text is empty");
        }
        int maxLength = context.getOptions().maxInputLength();
        if (input.length() > maxLength) {
            throw new InvalidInputException("Input text exceeds " + maxLength + " characters");
        }
        if (input.codePoints().noneMatch(Character::isLetterOrDigit)) {
            throw new InvalidInputException("Input text has no letters or digits");
        }

        StageEventLog events = context.newEventLog();
        Instant start = events.mark();
        NormalizedText normalized = normalizer.normalize(input);
        context.setNormalized(normalized);
        String salt = context.getOptions().deterministicSalt();
        context.setRequestId(ledger.requestId(normalized.text(), salt, context.getOptions().reproducibleMode()));
        events.recordSince(start, EventKind.DETERMINISTIC_PASS,
                "normalized " + input.length() + " → " + normalized.length() + " chars");

        ProvenanceRecord provenance = ledger.begin(normalized.text(), StageId.INGEST, salt, start)
                .confidence(1.0)
                .originSpans(List.of(new OriginSpan(0, input.length())))
                .eventLog(events.events())
                .build();

        log.debug("[Ingest] request {} ({} chars)", context.getRequestId(), normalized.length());
        return StageResult.of(new IngestedText(input, normalized), provenance);
    }
}
