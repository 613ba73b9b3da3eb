package com.witty.infrastructure.pipeline;

import com.witty.application.formalize.exception.InvalidOptionsException;
import com.witty.domain.formalize.logic.CnfResult;
import com.witty.domain.formalize.model.AtomicClaim;
import com.witty.domain.formalize.model.ClaimSet;
import com.witty.domain.formalize.model.FormalizationResult;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.domain.formalize.model.IngestedText;
import com.witty.domain.formalize.model.ModalMetadata;
import com.witty.domain.formalize.model.ModalTag;
import com.witty.domain.formalize.model.PreprocessedText;
import com.witty.domain.formalize.model.PrivacyMode;
import com.witty.domain.formalize.model.ProvenanceEvent;
import com.witty.domain.formalize.model.ProvenanceRecord;
import com.witty.domain.formalize.model.StageResult;
import com.witty.domain.formalize.model.Symbolization;
import com.witty.domain.formalize.model.ValidationReport;
import com.witty.infrastructure.adapter.AdapterRegistry;
import com.witty.infrastructure.adapter.TextInterpretationAdapter;
import com.witty.infrastructure.pipeline.stage.CnfStage;
import com.witty.infrastructure.pipeline.stage.IngestStage;
import com.witty.infrastructure.pipeline.stage.PreprocessingStage;
import com.witty.infrastructure.pipeline.stage.ValidationStage;
import com.witty.infrastructure.pipeline.stage.ValidationStage.ValidationInput;
import com.witty.infrastructure.provenance.ProvenanceLedger;
import com.witty.infrastructure.provenance.RequestClock;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one formalization request end to end:
 * <p>
 * ingest → preprocess → claim reduction → symbolization → CNF → validation → assembly
 * </p>
 * Each stage consumes the guarded output of its predecessor. Cancellation is checked between stages;
 * a cancelled or failed request produces no result. Assembly is all-or-nothing.
 */
@Slf4j
@Component
public class FormalizationOrchestrator {

    private final IngestStage ingestStage;
    private final PreprocessingStage preprocessingStage;
    private final FormalizationStage<PreprocessedText, ClaimSet> claimReductionStage;
    private final FormalizationStage<ClaimSet, Symbolization> symbolizationStage;
    private final CnfStage cnfStage;
    private final ValidationStage validationStage;
    private final StageOutputGuard guard;
    private final AdapterRegistry adapters;
    private final ProvenanceLedger ledger;
    private final Validator validator;

    public FormalizationOrchestrator(IngestStage ingestStage,
                                     PreprocessingStage preprocessingStage,
                                     FormalizationStage<PreprocessedText, ClaimSet> claimReductionStage,
                                     FormalizationStage<ClaimSet, Symbolization> symbolizationStage,
                                     CnfStage cnfStage,
                                     ValidationStage validationStage,
                                     StageOutputGuard guard,
                                     AdapterRegistry adapters,
                                     ProvenanceLedger ledger,
                                     Validator validator) {
        this.ingestStage = ingestStage;
        this.preprocessingStage = preprocessingStage;
        this.claimReductionStage = claimReductionStage;
        this.symbolizationStage = symbolizationStage;
        this.cnfStage = cnfStage;
        this.validationStage = validationStage;
        this.guard = guard;
        this.adapters = adapters;
        this.ledger = ledger;
        this.validator = validator;
    }

    public FormalizationResult run(String text, FormalizeOptions options) {
        return run(text, options, new CancellationToken());
    }

    public FormalizationResult run(String text, FormalizeOptions options, CancellationToken cancellation) {
        FormalizationContext ctx = new FormalizationContext(text, checkOptions(options),
                RequestClock.forMode(options.reproducibleMode()), cancellation, resolveAdapter(options));

        ctx.setIngested(guard.check(ingestStage.stageId(), ingestStage.execute(text, ctx)));
        cancellation.throwIfCancelled();

        ctx.setPreprocessed(guard.check(preprocessingStage.stageId(),
                preprocessingStage.execute(ctx.getIngested().payload(), ctx)));
        cancellation.throwIfCancelled();

        ctx.setClaims(guard.checkClaims(claimReductionStage.execute(ctx.getPreprocessed().payload(), ctx)));
        cancellation.throwIfCancelled();

        ctx.setSymbolization(guard.checkSymbolization(symbolizationStage.execute(ctx.getClaims().payload(), ctx)));
        cancellation.throwIfCancelled();

        ctx.setCnf(guard.check(cnfStage.stageId(), cnfStage.execute(ctx.getSymbolization().payload(), ctx)));
        cancellation.throwIfCancelled();

        List<Double> confidences = stageResults(ctx).stream().map(StageResult::confidence).toList();
        ValidationInput validationInput = new ValidationInput(
                ctx.getSymbolization().payload(), ctx.getCnf().payload(), confidences);
        ctx.setValidation(guard.check(validationStage.stageId(), validationStage.execute(validationInput, ctx)));
        cancellation.throwIfCancelled();

        FormalizationResult result = assemble(ctx);
        log.info("[Orchestrator] {} done: {} claims, cnf={}, confidence={}, warnings={}",
                result.requestId(), result.atomicClaims().size(), result.cnf(), result.confidence(), result.warnings());
        return result;
    }

    // ===== Setup =====

    private FormalizeOptions checkOptions(FormalizeOptions options) {
        if (options == null) {
            throw new InvalidOptionsException("Options are required");
        }
        Set<ConstraintViolation<FormalizeOptions>> violations = validator.validate(options);
        if (!violations.isEmpty()) {
            throw new InvalidOptionsException(violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; ")));
        }
        return options;
    }

    private TextInterpretationAdapter resolveAdapter(FormalizeOptions options) {
        return adapters.resolve(options).orElseThrow(() -> new InvalidOptionsException(
                "Unknown adapter '" + options.effectiveAdapterId() + "', available: " + adapters.ids()));
    }

    // ===== Assembly =====

    private static List<StageResult<?>> stageResults(FormalizationContext ctx) {
        List<StageResult<?>> results = new ArrayList<>();
        results.add(ctx.getIngested());
        results.add(ctx.getPreprocessed());
        results.add(ctx.getClaims());
        results.add(ctx.getSymbolization());
        results.add(ctx.getCnf());
        if (ctx.getValidation() != null) {
            results.add(ctx.getValidation());
        }
        return results;
    }

    private FormalizationResult assemble(FormalizationContext ctx) {
        PrivacyMode privacy = ctx.getOptions().privacyMode();
        Symbolization symbolization = ctx.getSymbolization().payload();
        CnfResult cnf = ctx.getCnf().payload();
        ValidationReport report = ctx.getValidation().payload();

        List<ProvenanceRecord> records = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (StageResult<?> result : stageResults(ctx)) {
            records.add(ledger.redact(result.provenance(), privacy));
            warnings.addAll(result.warnings());
        }

        List<AtomicClaim> claims = symbolization.claims().stream()
                .map(claim -> claim.withProvenance(ledger.redact(claim.provenance(), privacy)))
                .toList();

        // stable: events with equal timestamps keep stage order
        List<ProvenanceEvent> eventLog = records.stream()
                .flatMap(record -> record.eventLog().stream())
                .sorted(Comparator.comparing(ProvenanceEvent::timestamp))
                .toList();

        Map<String, ModalTag> modalities = new LinkedHashMap<>();
        claims.stream()
                .filter(claim -> claim.modalContext() != null)
                .forEach(claim -> modalities.put(claim.identifier(), claim.modalContext()));

        return FormalizationResult.builder()
                .requestId(ctx.getRequestId())
                .originalText(ctx.getOriginalText())
                .canonicalText(ctx.getClaims().payload().canonicalText())
                .atomicClaims(claims)
                .legend(symbolization.legend())
                .logicalFormCandidates(symbolization.candidates())
                .chosenLogicalForm(symbolization.chosen().ast())
                .cnf(cnf.render())
                .cnfClauses(cnf.clauseStrings())
                .modalMetadata(new ModalMetadata(modalities, cnf.modalTokens()))
                .warnings(warnings)
                .confidence(report.confidence())
                .provenance(records)
                .validationReport(report)
                .eventLog(eventLog)
                .build();
    }
}
