package com.witty.infrastructure.pipeline;

import com.witty.application.formalize.exception.FormalizationCancelledException;
import com.witty.domain.formalize.model.EventKind;
import com.witty.infrastructure.adapter.AdapterException;
import com.witty.infrastructure.adapter.AdapterParseException;
import com.witty.infrastructure.adapter.AdapterProvenance;
import com.witty.infrastructure.adapter.AdapterRequest;
import com.witty.infrastructure.adapter.AdapterResponse;
import com.witty.infrastructure.adapter.TextInterpretationAdapter;
import com.witty.infrastructure.provenance.StageEventLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Validate → retry → fallback policy for stages that consult the adapter.
 *
 * The adapter is called with a schema-constrained request and the response parsed. A parse failure,
 * a transport error, a timeout, or a parsed confidence below the stage threshold counts as a failed
 * attempt; exactly one retry follows, with no backoff. Every attempt is appended to the stage event log.
 * When both attempts fail the caller runs its deterministic fallback.
 */
@Slf4j
@Component
public class AssistedCallPolicy {

    static final int MAX_ATTEMPTS = 2;

    private final ExecutorService adapterExecutor;

    public AssistedCallPolicy(@Qualifier("adapterExecutor") ExecutorService adapterExecutor) {
        this.adapterExecutor = adapterExecutor;
    }

    /**
     * A stage's adapter interaction.
     */
    public interface AssistedCall<T> {

        /**
         * Request for attempt 1 or 2; the retry is an adjusted request.
         */
        AdapterRequest request(int attempt);

        /**
         * @throws AdapterParseException if the response does not match the schema
         */
        T parse(AdapterResponse response);

        double confidence(T parsed);
    }

    /**
     * @param value      parsed response, null when every attempt failed
     * @param provenance provenance of the accepted response, null when every attempt failed
     * @param attempts   attempts made
     */
    public record Outcome<T>(T value, AdapterProvenance provenance, int attempts) {
        public boolean succeeded() {
            return value != null;
        }
    }

    public <T> Outcome<T> call(FormalizationContext context, AssistedCall<T> call, double threshold, StageEventLog events) {
        TextInterpretationAdapter adapter = context.getAdapter();
        Duration timeout = context.getOptions().adapterTimeout();

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            context.getCancellation().throwIfCancelled();
            String label = "attempt " + attempt + "/" + MAX_ATTEMPTS;
            Instant start = events.mark();
            try {
                AdapterRequest request = call.request(attempt);
                AdapterResponse response = invoke(adapter, request, timeout, context.getCancellation());
                T parsed = call.parse(response);
                double confidence = call.confidence(parsed);

                if (confidence < threshold) {
                    events.recordSince(start, EventKind.ADAPTER_ATTEMPT_FAILED, String.format(
                            "%s: confidence %.2f below threshold %.2f", label, confidence, threshold));
                    log.info("[AssistedCall] {} {} below threshold ({} < {})", request.templateId(), label, confidence, threshold);
                    continue;
                }

                AdapterProvenance provenance = response.adapterProvenance();
                events.recordSince(start, EventKind.ADAPTER_ATTEMPT_SUCCEEDED, String.format(
                        "%s: adapter=%s request=%s confidence=%.2f", label,
                        provenance.adapterId(), provenance.requestId(), confidence));
                return new Outcome<>(parsed, provenance, attempt);
            } catch (AdapterParseException e) {
                events.recordSince(start, EventKind.ADAPTER_ATTEMPT_FAILED, label + ": parse error: " + e.getMessage());
                log.warn("[AssistedCall] {} parse failure: {}", label, e.getMessage());
            } catch (AdapterException e) {
                events.recordSince(start, EventKind.ADAPTER_ATTEMPT_FAILED, label + ": adapter error: " + e.getMessage());
                log.warn("[AssistedCall] {} adapter failure: {}", label, e.getMessage());
            }
        }
        return new Outcome<>(null, null, MAX_ATTEMPTS);
    }

    private AdapterResponse invoke(TextInterpretationAdapter adapter, AdapterRequest request,
                                   Duration timeout, CancellationToken cancellation) {
        // a FutureTask, so cancel(true) interrupts the worker
        Future<AdapterResponse> future = adapterExecutor.submit(() -> adapter.request(request, timeout));
        cancellation.track(future);
        try {
            AdapterResponse response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response == null) {
                throw new AdapterParseException("adapter returned no response");
            }
            return response;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AdapterException("timed out after " + timeout.toMillis() + " ms", e);
        } catch (CancellationException e) {
            throw new FormalizationCancelledException("Adapter call abandoned: request cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new FormalizationCancelledException("Interrupted while waiting for the adapter", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AdapterException ae) {
                throw ae;
            }
            throw new AdapterException("adapter failed: " + cause.getClass().getSimpleName(), cause);
        } finally {
            cancellation.untrack(future);
        }
    }
}
