package com.witty.infrastructure.pipeline;

import com.witty.application.formalize.exception.FormalizationCancelledException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for one request. Cancelling also cancels any in-flight adapter call.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            inFlight.forEach(f -> f.cancel(true));
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new FormalizationCancelledException("Formalization request was cancelled");
        }
    }

    void track(Future<?> future) {
        inFlight.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    void untrack(Future<?> future) {
        inFlight.remove(future);
    }
}
