package com.witty.infrastructure.pipeline;

import com.witty.infrastructure.pipeline.stage.AssistedClaimReductionStage;
import com.witty.infrastructure.pipeline.stage.AssistedSymbolizationStage;
import com.witty.infrastructure.pipeline.stage.ClaimReducer;
import com.witty.infrastructure.pipeline.stage.DeterministicClaimReductionStage;
import com.witty.infrastructure.pipeline.stage.DeterministicSymbolizationStage;
import com.witty.infrastructure.pipeline.stage.Symbolizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageConfigTest {

    private final PipelineFixture fixture = new PipelineFixture();
    private final StageConfig config = new StageConfig();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    @DisplayName("Stage modes parse case-insensitively, blank meaning assisted")
    void modesParseCaseInsensitively() {
        assertThat(StageMode.parse(" Deterministic ")).isEqualTo(StageMode.DETERMINISTIC);
        assertThat(StageMode.parse("ASSISTED")).isEqualTo(StageMode.ASSISTED);
        assertThat(StageMode.parse(null)).isEqualTo(StageMode.ASSISTED);
        assertThatThrownBy(() -> StageMode.parse("magic"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("magic");
    }

    @Test
    @DisplayName("Claim reduction variant follows the configured mode")
    void claimReductionVariant() {
        ClaimReducer reducer = new ClaimReducer(fixture.ledger);

        assertThat(config.claimReductionStage("assisted", reducer, fixture.enrichment(), fixture.ledger,
                fixture.policy, fixture.templates, fixture.parser)).isInstanceOf(AssistedClaimReductionStage.class);
        assertThat(config.claimReductionStage("deterministic", reducer, fixture.enrichment(), fixture.ledger,
                fixture.policy, fixture.templates, fixture.parser)).isInstanceOf(DeterministicClaimReductionStage.class);
    }

    @Test
    @DisplayName("Symbolization variant follows the configured mode")
    void symbolizationVariant() {
        Symbolizer symbolizer = new Symbolizer();

        assertThat(config.symbolizationStage("assisted", symbolizer, fixture.ledger,
                fixture.policy, fixture.templates, fixture.parser)).isInstanceOf(AssistedSymbolizationStage.class);
        assertThat(config.symbolizationStage("deterministic", symbolizer, fixture.ledger,
                fixture.policy, fixture.templates, fixture.parser)).isInstanceOf(DeterministicSymbolizationStage.class);
    }
}
