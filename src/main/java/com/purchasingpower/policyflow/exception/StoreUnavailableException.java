package com.purchasingpower.policyflow.exception;

import lombok.Getter;

/**
 * The durable store cannot be reached for a collection. Callers switch that
 * collection to the in-memory mirror.
 */
@Getter
public class StoreUnavailableException extends RuntimeException {

    private final String collection;

    public StoreUnavailableException(String collection, String message, Throwable cause) {
        super(message, cause);
        this.collection = collection;
    }
}
