package com.witty.infrastructure.validation;

import com.witty.domain.formalize.logic.Clause;
import com.witty.domain.formalize.logic.CnfResult;
import com.witty.domain.formalize.logic.Literal;
import com.witty.domain.formalize.model.AtomicClaim;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.domain.formalize.model.Legend;
import com.witty.domain.formalize.model.ValidationIssue;
import com.witty.domain.formalize.model.ValidationIssue.Severity;
import com.witty.domain.formalize.model.ValidationIssueType;
import com.witty.domain.formalize.model.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure, re-runnable checks over a finished formalization:
 * symbol coverage, provenance coverage, tautology, contradiction, and confidence aggregation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FormalizationValidator {

    private final SatisfiabilityChecker satisfiabilityChecker;

    /**
     * @param claims           symbolized atomic claims
     * @param legend           symbol legend
     * @param cnf              CNF of the chosen logical form
     * @param stageConfidences confidences of the stages on the chosen path
     * @param options          thresholds and the contradiction floor
     */
    public ValidationReport validate(List<AtomicClaim> claims,
                                     Legend legend,
                                     CnfResult cnf,
                                     Collection<Double> stageConfidences,
                                     FormalizeOptions options) {
        List<ValidationIssue> issues = new ArrayList<>();

        boolean symbolCoverageOk = checkSymbolCoverage(cnf, legend, issues);
        double provenanceCoverage = checkProvenanceCoverage(claims, options.provenanceCoverageThreshold(), issues);
        boolean tautology = checkTautology(cnf, issues);
        boolean contradiction = checkContradiction(cnf, issues);
        checkDroppedClauses(cnf, issues);
        checkSizeLimit(cnf, issues);

        double confidence = stageConfidences.stream().mapToDouble(Double::doubleValue).min().orElse(1.0);
        if (contradiction) {
            confidence = options.confidenceFloor();
        }

        if (!issues.isEmpty()) {
            log.info("[Validator] {} issues ({} errors, {} warnings)",
                    issues.size(),
                    issues.stream().filter(i -> i.severity() == Severity.ERROR).count(),
                    issues.stream().filter(i -> i.severity() == Severity.WARNING).count());
        }

        return new ValidationReport(symbolCoverageOk, provenanceCoverage, tautology, contradiction, confidence, issues);
    }

    // ===== Checks =====

    /**
     * Every clause token is a legend symbol, or a MODAL subtree whose atoms are all legend symbols.
     */
    private boolean checkSymbolCoverage(CnfResult cnf, Legend legend, List<ValidationIssue> issues) {
        Set<String> unknown = new LinkedHashSet<>();
        if (cnf.distributed()) {
            for (Clause clause : cnf.clauses()) {
                for (Literal literal : clause.literals()) {
                    literal.node().symbols().stream().filter(s -> !legend.contains(s)).forEach(unknown::add);
                }
            }
        } else {
            cnf.unexpandedForm().symbols().stream().filter(s -> !legend.contains(s)).forEach(unknown::add);
        }

        for (String symbol : unknown) {
            issues.add(new ValidationIssue(ValidationIssueType.SYMBOL_COVERAGE, Severity.ERROR,
                    "Token does not resolve to the legend", symbol));
        }
        return unknown.isEmpty();
    }

    private double checkProvenanceCoverage(List<AtomicClaim> claims, double threshold, List<ValidationIssue> issues) {
        if (claims.isEmpty()) {
            return 0.0;
        }
        long covered = claims.stream().filter(AtomicClaim::hasOriginSpan).count();
        double ratio = (double) covered / claims.size();
        if (ratio < threshold) {
            issues.add(new ValidationIssue(ValidationIssueType.PROVENANCE_COVERAGE, Severity.WARNING,
                    String.format("Provenance coverage %.2f below threshold %.2f", ratio, threshold), null));
        }
        return ratio;
    }

    /**
     * The chosen form is equivalent to TRUE: every clause simplified away without a contradiction.
     */
    private boolean checkTautology(CnfResult cnf, List<ValidationIssue> issues) {
        boolean tautology = cnf.distributed() && cnf.clauses().isEmpty() && !cnf.contradiction();
        if (tautology) {
            issues.add(new ValidationIssue(ValidationIssueType.TAUTOLOGY, Severity.WARNING,
                    "Logical form simplifies to TRUE", CnfResult.TRUE_CONSTANT));
        }
        return tautology;
    }

    private boolean checkContradiction(CnfResult cnf, List<ValidationIssue> issues) {
        if (cnf.contradiction()) {
            issues.add(new ValidationIssue(ValidationIssueType.CONTRADICTION, Severity.WARNING,
                    "A clause simplified to the empty clause", null));
            return true;
        }
        if (cnf.distributed() && !satisfiabilityChecker.isSatisfiable(cnf.clauses())) {
            issues.add(new ValidationIssue(ValidationIssueType.CONTRADICTION, Severity.WARNING,
                    "Clause set is unsatisfiable", cnf.render()));
            return true;
        }
        return false;
    }

    private void checkDroppedClauses(CnfResult cnf, List<ValidationIssue> issues) {
        for (Clause clause : cnf.droppedTautologies()) {
            issues.add(new ValidationIssue(ValidationIssueType.TAUTOLOGICAL_CLAUSE, Severity.WARNING,
                    "Clause contains a literal and its negation and was dropped", clause.render()));
        }
    }

    private void checkSizeLimit(CnfResult cnf, List<ValidationIssue> issues) {
        if (!cnf.distributed()) {
            issues.add(new ValidationIssue(ValidationIssueType.SIZE_LIMIT, Severity.WARNING,
                    "Clause ceiling exceeded; reporting the unexpanded form", null));
        }
    }
}
