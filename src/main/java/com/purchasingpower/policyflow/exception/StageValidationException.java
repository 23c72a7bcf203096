package com.purchasingpower.policyflow.exception;

import lombok.Getter;

/**
 * A stage produced an artifact the next stage cannot use, even after retries
 * and default substitution.
 */
@Getter
public class StageValidationException extends RuntimeException {

    private final String stage;

    public StageValidationException(String stage, String message) {
        super(message);
        this.stage = stage;
    }
}
