package com.witty.infrastructure.pipeline;

import com.witty.domain.formalize.logic.CnfResult;
import com.witty.domain.formalize.model.ClaimSet;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.domain.formalize.model.IngestedText;
import com.witty.domain.formalize.model.NormalizedText;
import com.witty.domain.formalize.model.PreprocessedText;
import com.witty.domain.formalize.model.StageResult;
import com.witty.domain.formalize.model.Symbolization;
import com.witty.domain.formalize.model.ValidationReport;
import com.witty.infrastructure.adapter.TextInterpretationAdapter;
import com.witty.infrastructure.provenance.RequestClock;
import com.witty.infrastructure.provenance.StageEventLog;
import lombok.Data;

/**
 * Mutable context object passed through pipeline stages of one request.
 * Accumulates the validated result of each stage for the next. Never shared between requests.
 */
@Data
public class FormalizationContext {

    // --- Input ---
    private final String originalText;
    private final FormalizeOptions options;
    private final RequestClock clock;
    private final CancellationToken cancellation;
    private final TextInterpretationAdapter adapter;

    // --- Ingest ---
    private String requestId;
    private NormalizedText normalized;
    private StageResult<IngestedText> ingested;

    // --- Stages ---
    private StageResult<PreprocessedText> preprocessed;
    private StageResult<ClaimSet> claims;
    private StageResult<Symbolization> symbolization;
    private StageResult<CnfResult> cnf;
    private StageResult<ValidationReport> validation;

    /**
     * Normalized input text; empty until ingest has run.
     */
    public String normalizedInput() {
        return normalized != null ? normalized.text() : "";
    }

    public StageEventLog newEventLog() {
        return new StageEventLog(clock);
    }
}
