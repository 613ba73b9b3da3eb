package com.witty.application.formalize;

import com.witty.application.formalize.exception.FormalizationCancelledException;
import com.witty.domain.formalize.model.FormalizationResult;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.infrastructure.pipeline.CancellationToken;
import com.witty.infrastructure.pipeline.FormalizationOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class FormalizationAppService {

    /**
     * Handle on an asynchronously running request.
     */
    public record FormalizationTicket(String ticketId, CompletableFuture<FormalizationResult> result) {}

    private final FormalizationOrchestrator orchestrator;
    private final Executor formalizationExecutor;
    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();

    public FormalizationAppService(FormalizationOrchestrator orchestrator,
                                   @Qualifier("formalizationExecutor") Executor formalizationExecutor) {
        this.orchestrator = orchestrator;
        this.formalizationExecutor = formalizationExecutor;
    }

    public FormalizationResult formalize(String text, FormalizeOptions options) {
        return orchestrator.run(text, options, new CancellationToken());
    }

    /**
     * Run on the formalization executor. The future completes exceptionally with
     * {@link FormalizationCancelledException} when {@link #cancel(String)} is called first.
     */
    public FormalizationTicket formalizeAsync(String text, FormalizeOptions options) {
        String ticketId = UUID.randomUUID().toString();
        CancellationToken token = new CancellationToken();
        inFlight.put(ticketId, token);

        CompletableFuture<FormalizationResult> future = CompletableFuture
                .supplyAsync(() -> {
                    token.throwIfCancelled();
                    return orchestrator.run(text, options, token);
                }, formalizationExecutor)
                .whenComplete((result, error) -> inFlight.remove(ticketId));
        return new FormalizationTicket(ticketId, future);
    }

    /**
     * @return false when the ticket is unknown or already finished
     */
    public boolean cancel(String ticketId) {
        CancellationToken token = inFlight.remove(ticketId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("[FormalizationAppService] Cancelled {}", ticketId);
        return true;
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
