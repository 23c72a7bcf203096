package com.purchasingpower.policyflow.exception;

import lombok.Getter;

/**
 * The store is reachable but the operation failed (bad data, constraint, mapping).
 */
@Getter
public class StoreQueryException extends RuntimeException {

    private final String collection;

    public StoreQueryException(String collection, String message, Throwable cause) {
        super(message, cause);
        this.collection = collection;
    }
}
