package com.witty.infrastructure.pipeline.stage;

import com.witty.domain.formalize.logic.Clause;
import com.witty.domain.formalize.logic.CnfResult;
import com.witty.domain.formalize.model.AmbiguityFlags;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.ProvenanceRecord;
import com.witty.domain.formalize.model.StageId;
import com.witty.domain.formalize.model.StageResult;
import com.witty.domain.formalize.model.Symbolization;
import com.witty.infrastructure.cnf.CnfTransformer;
import com.witty.infrastructure.cnf.ContradictionDetectedException;
import com.witty.infrastructure.cnf.SizeLimitExceededException;
import com.witty.infrastructure.pipeline.FormalizationContext;
import com.witty.infrastructure.pipeline.FormalizationStage;
import com.witty.infrastructure.provenance.ProvenanceLedger;
import com.witty.infrastructure.provenance.StageEventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * CNF of the chosen logical form. Size-limit and contradiction outcomes are recorded, not fatal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CnfStage implements FormalizationStage<Symbolization, CnfResult> {

    private final CnfTransformer transformer;
    private final ProvenanceLedger ledger;

    @Override
    public StageId stageId() {
        return StageId.CNF;
    }

    @Override
    public StageResult<CnfResult> execute(Symbolization input, FormalizationContext context) {
        StageEventLog events = context.newEventLog();
        Instant start = events.mark();
        int maxClauses = context.getOptions().maxClauses();
        Set<String> flags = new TreeSet<>();
        CnfResult cnf;

        try {
            cnf = transformer.transform(input.chosen().ast(), maxClauses);
            events.recordSince(start, EventKind.DETERMINISTIC_PASS, cnf.clauses().size() + " clauses: " + cnf.render());
        } catch (SizeLimitExceededException e) {
            cnf = CnfResult.unexpanded(e.getNegationNormalForm());
            events.recordSince(start, EventKind.SIZE_LIMIT_EXCEEDED,
                    "clause ceiling " + e.getMaxClauses() + " exceeded, unexpanded form " + cnf.render());
            flags.add(AmbiguityFlags.SIZE_LIMIT);
        } catch (ContradictionDetectedException e) {
            cnf = e.getPartialResult();
            for (Clause emptied : e.getEmptiedClauses()) {
                events.recordSince(start, EventKind.CONTRADICTION_DETECTED, "clause simplified to empty: " + emptied.render());
            }
            flags.add(AmbiguityFlags.CONTRADICTION);
        }

        for (Clause dropped : cnf.droppedTautologies()) {
            events.record(EventKind.CLAUSE_DROPPED, "tautological clause " + dropped.render());
            flags.add(AmbiguityFlags.TAUTOLOGICAL_CLAUSE);
        }

        ProvenanceRecord provenance = ledger.begin(context.normalizedInput(), StageId.CNF,
                        context.getOptions().deterministicSalt(), start)
                .confidence(1.0)
                .originSpans(context.getSymbolization() != null
                        ? context.getSymbolization().provenance().originSpans()
                        : List.of())
                .ambiguityFlags(flags)
                .reductionRationale("CNF of " + input.chosen().notation())
                .eventLog(events.events())
                .build();

        log.info("[CnfStage] {} (distributed={}, flags={})", cnf.render(), cnf.distributed(), flags);
        return new StageResult<>(cnf, provenance, 1.0, AmbiguityFlags.warnings(flags, StageId.CNF));
    }
}
