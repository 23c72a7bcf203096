package com.purchasingpower.policyflow.exception;

/**
 * A generation reply yielded no usable structured value. Raised inside a
 * round-trip attempt to trigger a retry; never escapes the executor.
 */
public class ExtractionFailedException extends RuntimeException {

    public ExtractionFailedException(String message) {
        super(message);
    }
}
