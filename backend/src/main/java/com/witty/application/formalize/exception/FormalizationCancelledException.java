package com.witty.application.formalize.exception;

public class FormalizationCancelledException extends FormalizationException {
    public FormalizationCancelledException(String message) {
        super(message);
    }

    public FormalizationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
