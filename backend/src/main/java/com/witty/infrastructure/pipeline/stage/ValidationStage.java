package com.witty.infrastructure.pipeline.stage;

import com.witty.application.formalize.exception.StageValidationException;
import com.witty.domain.formalize.logic.CnfResult;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.ProvenanceRecord;
import com.witty.domain.formalize.model.StageId;
import com.witty.domain.formalize.model.StageResult;
import com.witty.domain.formalize.model.Symbolization;
import com.witty.domain.formalize.model.ValidationIssue;
import com.witty.domain.formalize.model.ValidationIssueType;
import com.witty.domain.formalize.model.ValidationReport;
import com.witty.infrastructure.pipeline.FormalizationContext;
import com.witty.infrastructure.pipeline.FormalizationStage;
import com.witty.infrastructure.provenance.ProvenanceLedger;
import com.witty.infrastructure.provenance.StageEventLog;
import com.witty.infrastructure.validation.FormalizationValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Final checks over the symbolization and its CNF. A symbol coverage failure is fatal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidationStage implements FormalizationStage<ValidationStage.ValidationInput, ValidationReport> {

    /**
     * @param stageConfidences confidences of every stage on the chosen path
     */
    public record ValidationInput(Symbolization symbolization, CnfResult cnf, List<Double> stageConfidences) {}

    private static final Set<ValidationIssueType> RAISED_BY_CNF =
            EnumSet.of(ValidationIssueType.TAUTOLOGICAL_CLAUSE, ValidationIssueType.SIZE_LIMIT);

    private final FormalizationValidator validator;
    private final ProvenanceLedger ledger;

    @Override
    public StageId stageId() {
        return StageId.VALIDATION;
    }

    @Override
    public StageResult<ValidationReport> execute(ValidationInput input, FormalizationContext context) {
        StageEventLog events = context.newEventLog();
        Instant start = events.mark();

        ValidationReport report = validator.validate(input.symbolization().claims(), input.symbolization().legend(),
                input.cnf(), input.stageConfidences(), context.getOptions());

        if (!report.symbolCoverageOk()) {
            String unknown = report.errors().stream()
                    .map(ValidationIssue::matchedText)
                    .collect(Collectors.joining(", "));
            throw new StageValidationException(StageId.VALIDATION.id(), "tokens outside the legend: " + unknown);
        }

        events.recordSince(start, EventKind.DETERMINISTIC_PASS, String.format(
                "provenance coverage %.2f, tautology=%s, contradiction=%s, %d issues",
                report.provenanceCoverage(), report.tautology(), report.contradiction(), report.issues().size()));

        ProvenanceRecord provenance = ledger.begin(context.normalizedInput(), StageId.VALIDATION,
                        context.getOptions().deterministicSalt(), start)
                .confidence(report.confidence())
                .reductionRationale("minimum of stage confidences"
                        + (report.contradiction() ? ", floored on contradiction" : ""))
                .eventLog(events.events())
                .build();

        // clause-level findings were already raised by the CNF stage
        List<String> warnings = report.warnings().stream()
                .filter(issue -> !RAISED_BY_CNF.contains(issue.type()))
                .filter(issue -> issue.type() != ValidationIssueType.CONTRADICTION || !input.cnf().contradiction())
                .map(issue -> issue.type().name().toLowerCase() + ":" + StageId.VALIDATION.id())
                .distinct()
                .toList();
        return new StageResult<>(report, provenance, report.confidence(), warnings);
    }
}
