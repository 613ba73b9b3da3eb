package com.witty.infrastructure.pipeline;

import com.witty.domain.formalize.model.ClaimSet;
import com.witty.domain.formalize.model.PreprocessedText;
import com.witty.domain.formalize.model.Symbolization;
import com.witty.infrastructure.adapter.AdapterResponseParser;
import com.witty.infrastructure.adapter.template.PromptTemplateRegistry;
import com.witty.infrastructure.pipeline.stage.AssistedClaimReductionStage;
import com.witty.infrastructure.pipeline.stage.AssistedSymbolizationStage;
import com.witty.infrastructure.pipeline.stage.ClaimReducer;
import com.witty.infrastructure.pipeline.stage.DeterministicClaimReductionStage;
import com.witty.infrastructure.pipeline.stage.DeterministicSymbolizationStage;
import com.witty.infrastructure.pipeline.stage.EnrichmentCollector;
import com.witty.infrastructure.pipeline.stage.Symbolizer;
import com.witty.infrastructure.provenance.ProvenanceLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the assisted or deterministic variant of the adapter-facing stages.
 */
@Slf4j
@Configuration
public class StageConfig {

    @Bean
    public FormalizationStage<PreprocessedText, ClaimSet> claimReductionStage(
            @Value("${formalizer.stages.claim-reduction.mode:assisted}") String mode,
            ClaimReducer reducer,
            EnrichmentCollector enrichment,
            ProvenanceLedger ledger,
            AssistedCallPolicy policy,
            PromptTemplateRegistry templates,
            AdapterResponseParser parser) {
        DeterministicClaimReductionStage deterministic = new DeterministicClaimReductionStage(reducer, enrichment, ledger);
        StageMode stageMode = StageMode.parse(mode);
        log.info("[StageConfig] claim_reduction mode: {}", stageMode);
        return switch (stageMode) {
            case DETERMINISTIC -> deterministic;
            case ASSISTED -> new AssistedClaimReductionStage(deterministic, reducer, enrichment, policy, templates, parser);
        };
    }

    @Bean
    public FormalizationStage<ClaimSet, Symbolization> symbolizationStage(
            @Value("${formalizer.stages.symbolization.mode:assisted}") String mode,
            Symbolizer symbolizer,
            ProvenanceLedger ledger,
            AssistedCallPolicy policy,
            PromptTemplateRegistry templates,
            AdapterResponseParser parser) {
        DeterministicSymbolizationStage deterministic = new DeterministicSymbolizationStage(symbolizer, ledger);
        StageMode stageMode = StageMode.parse(mode);
        log.info("[StageConfig] symbolization mode: {}", stageMode);
        return switch (stageMode) {
            case DETERMINISTIC -> deterministic;
            case ASSISTED -> new AssistedSymbolizationStage(deterministic, symbolizer, policy, templates, parser);
        };
    }
}
