package com.witty.infrastructure.validation;

import com.witty.domain.formalize.logic.CnfResult;
import com.witty.domain.formalize.logic.LogicalNode;
import com.witty.domain.formalize.model.AtomicClaim;
import com.witty.domain.formalize.model.ClaimCategory;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.domain.formalize.model.Legend;
import com.witty.domain.formalize.model.OriginSpan;
import com.witty.domain.formalize.model.ValidationIssue.Severity;
import com.witty.domain.formalize.model.ValidationIssueType;
import com.witty.domain.formalize.model.ValidationReport;
import com.witty.infrastructure.cnf.CnfTransformer;
import com.witty.infrastructure.cnf.ContradictionDetectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.witty.domain.formalize.logic.LogicalNode.and;
import static com.witty.domain.formalize.logic.LogicalNode.atom;
import static com.witty.domain.formalize.logic.LogicalNode.implies;
import static com.witty.domain.formalize.logic.LogicalNode.not;
import static com.witty.domain.formalize.logic.LogicalNode.or;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class FormalizationValidatorTest {

    private FormalizationValidator validator;
    private final CnfTransformer transformer = new CnfTransformer();
    private final FormalizeOptions options = FormalizeOptions.defaults().toBuilder().confidenceFloor(0.05).build();

    private List<AtomicClaim> claims;
    private Legend legend;

    @BeforeEach
    void setUp() {
        validator = new FormalizationValidator(new SatisfiabilityChecker());
        claims = List.of(
                new AtomicClaim("E1", "Alice owns a car", List.of(new OriginSpan(3, 19)), ClaimCategory.EVENT, null, "P1", null, null),
                new AtomicClaim("E2", "she drives", List.of(new OriginSpan(26, 36)), ClaimCategory.EVENT, null, "P2", null, null));
        legend = Legend.bind(claims);
    }

    private ValidationReport validate(LogicalNode ast, List<Double> confidences) {
        return validator.validate(claims, legend, transformer.transform(ast, 256), confidences, options);
    }

    @Test
    @DisplayName("Clean implication passes every check")
    void cleanForm() {
        ValidationReport report = validate(implies(atom("P1"), atom("P2")), List.of(1.0, 0.9, 0.8));

        assertThat(report.symbolCoverageOk()).isTrue();
        assertThat(report.provenanceCoverage()).isEqualTo(1.0);
        assertThat(report.tautology()).isFalse();
        assertThat(report.contradiction()).isFalse();
        assertThat(report.confidence()).isEqualTo(0.8);
        assertThat(report.issues()).isEmpty();
    }

    @Nested
    @DisplayName("Coverage")
    class Coverage {

        @Test
        @DisplayName("Unknown symbols are coverage errors")
        void unknownSymbol() {
            ValidationReport report = validate(or(atom("P1"), atom("P9")), List.of(1.0));

            assertThat(report.symbolCoverageOk()).isFalse();
            assertThat(report.hasErrors()).isTrue();
            assertThat(report.errors()).singleElement().satisfies(issue -> {
                assertThat(issue.type()).isEqualTo(ValidationIssueType.SYMBOL_COVERAGE);
                assertThat(issue.matchedText()).isEqualTo("P9");
            });
        }

        @Test
        @DisplayName("Claims without a non-empty origin span lower provenance coverage")
        void provenanceCoverage() {
            claims = List.of(claims.get(0),
                    new AtomicClaim("E2", "she drives", List.of(new OriginSpan(5, 5)), ClaimCategory.EVENT, null, "P2", null, null));

            ValidationReport report = validate(and(atom("P1"), atom("P2")), List.of(1.0));

            assertThat(report.provenanceCoverage()).isEqualTo(0.5);
            assertThat(report.warnings()).extracting(i -> i.type()).contains(ValidationIssueType.PROVENANCE_COVERAGE);
            assertThat(report.warnings()).allMatch(i -> i.severity() == Severity.WARNING);
        }
    }

    @Nested
    @DisplayName("Tautology and contradiction")
    class TautologyAndContradiction {

        @Test
        @DisplayName("Form that simplifies to TRUE is a tautology")
        void tautology() {
            ValidationReport report = validate(or(atom("P1"), not(atom("P1")), atom("P2")), List.of(1.0));

            assertThat(report.tautology()).isTrue();
            assertThat(report.warnings()).extracting(i -> i.type())
                    .contains(ValidationIssueType.TAUTOLOGY, ValidationIssueType.TAUTOLOGICAL_CLAUSE);
        }

        @Test
        @DisplayName("Unsatisfiable clause set forces the confidence floor")
        void unsatisfiable() {
            ValidationReport report = validate(and(atom("P1"), not(atom("P1"))), List.of(1.0, 0.9));

            assertThat(report.contradiction()).isTrue();
            assertThat(report.confidence()).isEqualTo(0.05);
        }

        @Test
        @DisplayName("Contradiction signalled by the transformer is reported")
        void signalledContradiction() {
            ContradictionDetectedException e = catchThrowableOfType(
                    () -> transformer.transform(and(or(atom("P1"), not(atom("P1"))), atom("P2")), 256),
                    ContradictionDetectedException.class);

            ValidationReport report = validator.validate(claims, legend, e.getPartialResult(), List.of(0.9), options);

            assertThat(report.contradiction()).isTrue();
            assertThat(report.confidence()).isEqualTo(0.05);
        }
    }

    @Test
    @DisplayName("Unexpanded form is reported as a size-limit warning and still checked for coverage")
    void unexpanded() {
        CnfResult unexpanded = CnfResult.unexpanded(or(and(atom("P1"), atom("P2")), atom("P3")));

        ValidationReport report = validator.validate(claims, legend, unexpanded, List.of(1.0), options);

        assertThat(report.symbolCoverageOk()).isFalse();
        assertThat(report.issues()).extracting(i -> i.type()).contains(ValidationIssueType.SIZE_LIMIT);
    }
}
