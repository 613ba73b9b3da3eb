package com.witty.application.formalize.exception;

import lombok.Getter;

/**
 * A stage's own output failed its schema or invariants. Aborts the request.
 */
@Getter
public class StageValidationException extends FormalizationException {

    private final String stageId;

    public StageValidationException(String stageId, String message) {
        super("Stage '" + stageId + "' produced invalid output: " + message);
        this.stageId = stageId;
    }
}
