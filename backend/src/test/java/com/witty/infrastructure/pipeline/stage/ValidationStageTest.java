package com.witty.infrastructure.pipeline.stage;

import com.witty.application.formalize.exception.StageValidationException;
import com.witty.domain.formalize.logic.Clause;
import com.witty.domain.formalize.logic.CnfResult;
import com.witty.domain.formalize.logic.Literal;
import com.witty.domain.formalize.model.AtomicClaim;
import com.witty.domain.formalize.model.CandidateOrigin;
import com.witty.domain.formalize.model.ClaimCategory;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.domain.formalize.model.Legend;
import com.witty.domain.formalize.model.LogicalFormCandidate;
import com.witty.domain.formalize.model.OriginSpan;
import com.witty.domain.formalize.model.StageResult;
import com.witty.domain.formalize.model.Symbolization;
import com.witty.domain.formalize.model.ValidationReport;
import com.witty.infrastructure.pipeline.CancellationToken;
import com.witty.infrastructure.pipeline.FormalizationContext;
import com.witty.infrastructure.provenance.ProvenanceIdGenerator;
import com.witty.infrastructure.provenance.ProvenanceLedger;
import com.witty.infrastructure.provenance.ProvenanceRedactor;
import com.witty.infrastructure.provenance.RequestClock;
import com.witty.infrastructure.validation.FormalizationValidator;
import com.witty.infrastructure.validation.SatisfiabilityChecker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.witty.domain.formalize.logic.LogicalNode.atom;
import static com.witty.domain.formalize.logic.LogicalNode.or;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationStageTest {

    private final ValidationStage stage = new ValidationStage(
            new FormalizationValidator(new SatisfiabilityChecker()),
            new ProvenanceLedger(new ProvenanceIdGenerator(), new ProvenanceRedactor()));

    private final FormalizationContext context = new FormalizationContext("Alice runs or Bob walks.",
            FormalizeOptions.defaults(), RequestClock.logical(), new CancellationToken(), null);

    private static Symbolization symbolization() {
        List<AtomicClaim> claims = List.of(
                new AtomicClaim("E1", "Alice runs", List.of(new OriginSpan(0, 10)), ClaimCategory.EVENT, null, "P1", null, null),
                new AtomicClaim("E2", "Bob walks", List.of(new OriginSpan(14, 23)), ClaimCategory.EVENT, null, "P2", null, null));
        LogicalFormCandidate chosen = LogicalFormCandidate.of(or(atom("P1"), atom("P2")), 0.9,
                List.of("E1", "E2"), CandidateOrigin.ADAPTER);
        return new Symbolization(claims, Legend.bind(claims), List.of(chosen), chosen);
    }

    private static CnfResult clause(Literal... literals) {
        return CnfResult.distributed(List.of(new Clause(List.of(literals))), List.of(), false);
    }

    @Test
    @DisplayName("A covered clause set yields the minimum stage confidence")
    void coveredClauses() {
        CnfResult cnf = clause(Literal.positive(atom("P1")), Literal.positive(atom("P2")));

        StageResult<ValidationReport> result = stage.execute(
                new ValidationStage.ValidationInput(symbolization(), cnf, List.of(1.0, 0.9, 0.8)), context);

        assertThat(result.payload().symbolCoverageOk()).isTrue();
        assertThat(result.confidence()).isEqualTo(0.8);
        assertThat(result.provenance().stageId()).isEqualTo("validation");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("A clause token missing from the legend aborts the stage")
    void tokenOutsideLegend() {
        CnfResult cnf = clause(Literal.positive(atom("P1")), Literal.negative(atom("P9")));

        assertThatThrownBy(() -> stage.execute(
                new ValidationStage.ValidationInput(symbolization(), cnf, List.of(1.0)), context))
                .isInstanceOf(StageValidationException.class)
                .hasMessageContaining("tokens outside the legend: P9")
                .extracting("stageId").isEqualTo("validation");
    }
}
