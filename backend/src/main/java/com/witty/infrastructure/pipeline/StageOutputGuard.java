package com.witty.infrastructure.pipeline;

import com.witty.application.formalize.exception.StageValidationException;
import com.witty.domain.formalize.model.AtomicClaim;
import com.witty.domain.formalize.model.ClaimSet;
import com.witty.domain.formalize.model.Legend;
import com.witty.domain.formalize.model.StageId;
import com.witty.domain.formalize.model.StageResult;
import com.witty.domain.formalize.model.Symbolization;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Schema and invariant checks on a stage's own output. A failure here is fatal for the request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageOutputGuard {

    private final Validator validator;

    public <T> StageResult<T> check(StageId stage, StageResult<T> result) {
        if (result == null) {
            throw fail(stage, "no result");
        }
        Set<ConstraintViolation<StageResult<T>>> violations = validator.validate(result);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw fail(stage, message);
        }
        return result;
    }

    /**
     * Claim identifiers are unique and every claim has a non-empty origin span.
     */
    public StageResult<ClaimSet> checkClaims(StageResult<ClaimSet> result) {
        check(StageId.CLAIM_REDUCTION, result);
        Set<String> identifiers = new HashSet<>();
        for (AtomicClaim claim : result.payload().claims()) {
            if (!identifiers.add(claim.identifier())) {
                throw fail(StageId.CLAIM_REDUCTION, "duplicate claim identifier " + claim.identifier());
            }
            if (!claim.hasOriginSpan()) {
                throw fail(StageId.CLAIM_REDUCTION, "claim " + claim.identifier() + " has no non-empty origin span");
            }
        }
        return result;
    }

    /**
     * The legend is a bijection over the claims, and the chosen form references only legend symbols.
     */
    public StageResult<Symbolization> checkSymbolization(StageResult<Symbolization> result) {
        check(StageId.SYMBOLIZATION, result);
        Symbolization symbolization = result.payload();
        Legend legend = symbolization.legend();

        if (!legend.isBijective() || legend.size() != symbolization.claims().size()) {
            throw fail(StageId.SYMBOLIZATION, "legend is not a bijection over the claims");
        }
        for (AtomicClaim claim : symbolization.claims()) {
            if (claim.symbol() == null || !claim.identifier().equals(legend.claimIdentifier(claim.symbol()))) {
                throw fail(StageId.SYMBOLIZATION, "claim " + claim.identifier() + " is not bound in the legend");
            }
        }
        if (!symbolization.candidates().contains(symbolization.chosen())) {
            throw fail(StageId.SYMBOLIZATION, "chosen form is not one of the candidates");
        }
        for (String symbol : symbolization.chosen().ast().symbols()) {
            if (!legend.contains(symbol)) {
                throw fail(StageId.SYMBOLIZATION, "chosen form references unknown symbol " + symbol);
            }
        }
        return result;
    }

    private StageValidationException fail(StageId stage, String message) {
        log.error("[StageGuard] {} output invalid: {}", stage.id(), message);
        return new StageValidationException(stage.id(), message);
    }
}
