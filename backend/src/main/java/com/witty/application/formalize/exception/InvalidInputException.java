package com.witty.application.formalize.exception;

public class InvalidInputException extends FormalizationException {
    public InvalidInputException(String message) {
        super(message);
    }
}
