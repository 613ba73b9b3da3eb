package com.witty.infrastructure.adapter;

import java.time.Duration;

/**
 * Capability boundary for non-deterministic text interpretation.
 * Implementations must be safe to call from several requests at once.
 */
public interface TextInterpretationAdapter {

    String id();

    String version();

    /**
     * @param request schema-constrained request
     * @param timeout upper bound the caller will wait
     * @throws AdapterException on transport failure or timeout
     */
    AdapterResponse request(AdapterRequest request, Duration timeout);
}
