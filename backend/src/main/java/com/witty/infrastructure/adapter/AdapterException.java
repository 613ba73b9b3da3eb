package com.witty.infrastructure.adapter;

/**
 * Transport failure or timeout of an adapter call. Recovered by retry/fallback, never surfaced to callers.
 */
public class AdapterException extends RuntimeException {

    public AdapterException(String message) {
        super(message);
    }

    public AdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}
