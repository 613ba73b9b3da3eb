package com.witty.application.formalize.exception;

public class InvalidOptionsException extends FormalizationException {
    public InvalidOptionsException(String message) {
        super(message);
    }
}
