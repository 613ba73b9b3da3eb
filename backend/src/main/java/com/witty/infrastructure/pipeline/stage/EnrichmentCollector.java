package com.witty.infrastructure.pipeline.stage;

import com.witty.application.formalize.exception.FormalizationCancelledException;
import com.witty.domain.formalize.model.EnrichmentSource;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.infrastructure.adapter.RetrievalAdapter;
import com.witty.infrastructure.adapter.RetrievedDocument;
import com.witty.infrastructure.pipeline.FormalizationContext;
import com.witty.infrastructure.provenance.StageEventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects enrichment sources from the optional retrieval adapter.
 * Skipped in reproducible mode; failures are recorded as events and never fail the request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnrichmentCollector {

    private final ObjectProvider<RetrievalAdapter> retrievalAdapter;

    public List<EnrichmentSource> collect(FormalizationContext context, StageEventLog events) {
        FormalizeOptions options = context.getOptions();
        if (!options.retrievalActive()) {
            return List.of();
        }

        RetrievalAdapter retrieval = retrievalAdapter.getIfAvailable();
        if (retrieval == null) {
            events.record(EventKind.RETRIEVAL_FAILED, "retrieval enabled but no retrieval adapter is configured");
            return List.of();
        }

        Instant start = events.mark();
        try {
            List<RetrievedDocument> documents = retrieval.retrieve(context.normalizedInput(), options.retrievalTopK());
            List<EnrichmentSource> sources = new ArrayList<>();
            for (RetrievedDocument document : documents) {
                context.getCancellation().throwIfCancelled();
                String summary = retrieval.summarize(document, null);
                sources.add(new EnrichmentSource(document.id(), document.url(), summary, null));
            }
            events.recordSince(start, EventKind.RETRIEVAL, "retrieved " + sources.size() + " of top "
                    + options.retrievalTopK() + ": " + sources.stream()
                    .map(s -> s.sourceId() + (s.url() != null ? " (" + s.url() + ")" : ""))
                    .toList());
            return sources;
        } catch (RuntimeException e) {
            if (e instanceof FormalizationCancelledException cancelled) {
                throw cancelled;
            }
            log.warn("[Enrichment] Retrieval failed: {}", e.getMessage());
            events.recordSince(start, EventKind.RETRIEVAL_FAILED, "retrieval failed: " + e.getClass().getSimpleName());
            return List.of();
        }
    }
}
