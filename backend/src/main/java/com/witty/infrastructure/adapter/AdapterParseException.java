package com.witty.infrastructure.adapter;

/**
 * The adapter answered, but the response does not match the requested schema.
 */
public class AdapterParseException extends AdapterException {

    public AdapterParseException(String message) {
        super(message);
    }

    public AdapterParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
