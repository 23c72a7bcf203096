package com.purchasingpower.policyflow.persistence;

import com.purchasingpower.policyflow.exception.StoreQueryException;
import com.purchasingpower.policyflow.exception.StoreUnavailableException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Backend holding documents in named collections, addressed by their {@code id} field.
 *
 * Implementations signal connection problems with {@link StoreUnavailableException}
 * and every other failure with {@link StoreQueryException}.
 */
public interface DocumentStore {

    String getName();

    /**
     * Cheap round trip proving the collection can be read.
     *
     * @throws StoreUnavailableException when the backend cannot be reached
     */
    void probe(String collection);

    List<Map<String, Object>> findAll(String collection);

    Optional<Map<String, Object>> findById(String collection, String id);

    /**
     * Whether the store keeps the numeric part of {@code field} in an indexed column,
     * so {@link #maxSequenceValue} can answer without loading the collection.
     */
    default boolean indexesSequence(String field) {
        return false;
    }

    /**
     * Highest indexed sequence value in the collection. Only valid when
     * {@link #indexesSequence} is true for the field being allocated.
     */
    default OptionalLong maxSequenceValue(String collection) {
        throw new UnsupportedOperationException(getName() + " store has no sequence index");
    }

    /**
     * Insert the document or replace the one stored under the same id.
     */
    void upsert(String collection, String id, Map<String, Object> document);
}
