package com.witty.application.formalize.exception;

/**
 * Fatal outcome of a formalization request. No result is produced when one of these is thrown.
 */
public abstract class FormalizationException extends RuntimeException {

    protected FormalizationException(String message) {
        super(message);
    }

    protected FormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
