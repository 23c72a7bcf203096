package com.purchasingpower.policyflow.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.policyflow.configuration.AppProperties;
import com.purchasingpower.policyflow.configuration.IdentifierProperties;
import com.purchasingpower.policyflow.exception.StoreQueryException;
import com.purchasingpower.policyflow.exception.StoreUnavailableException;
import com.purchasingpower.policyflow.model.CallContext;
import com.purchasingpower.policyflow.model.ServiceType;
import com.purchasingpower.policyflow.model.StoredDocument;
import com.purchasingpower.policyflow.repository.StoredDocumentRepository;
import com.purchasingpower.policyflow.util.ExternalCallLogger;
import com.purchasingpower.policyflow.util.SequenceNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Durable document store on a relational table (one JSON CLOB per document).
 *
 * The numeric part of each document's sequence field is copied to an indexed
 * column so sequence allocation runs a MAX query instead of a scan.
 *
 * Spring data-access exceptions are translated: connection and resource
 * failures become {@link StoreUnavailableException}, everything else
 * {@link StoreQueryException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaDocumentStore implements DocumentStore {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final StoredDocumentRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final AppProperties props;

    @Override
    public String getName() {
        return "jpa";
    }

    @Override
    public void probe(String collection) {
        try {
            long count = repository.countByCollectionName(collection);
            log.debug("Probed collection {}: {} documents", collection, count);
        } catch (DataAccessException | TransactionException e) {
            throw translate(collection, "probe", e);
        }
    }

    @Override
    public List<Map<String, Object>> findAll(String collection) {
        try {
            List<StoredDocument> rows = repository.findByCollectionName(collection);
            List<Map<String, Object>> documents = new ArrayList<>(rows.size());
            for (StoredDocument row : rows) {
                documents.add(readBody(collection, row));
            }
            return documents;
        } catch (DataAccessException | TransactionException e) {
            throw translate(collection, "findAll", e);
        }
    }

    @Override
    public Optional<Map<String, Object>> findById(String collection, String id) {
        try {
            return repository.findByCollectionNameAndDocumentId(collection, id)
                    .map(row -> readBody(collection, row));
        } catch (DataAccessException | TransactionException e) {
            throw translate(collection, "findById", e);
        }
    }

    @Override
    public boolean indexesSequence(String field) {
        return props.getIdentifiers().getSequenceField().equals(field);
    }

    @Override
    public OptionalLong maxSequenceValue(String collection) {
        try {
            Long max = repository.findMaxSequenceValue(collection);
            return max != null ? OptionalLong.of(max) : OptionalLong.empty();
        } catch (DataAccessException | TransactionException e) {
            throw translate(collection, "maxSequenceValue", e);
        }
    }

    @Override
    public void upsert(String collection, String id, Map<String, Object> document) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.DOCUMENT_STORE, "upsert " + collection, id, log);
        callCtx.logRequest("Upserting document", "Collection", collection, "Id", id);

        String body;
        try {
            body = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            callCtx.logError("Document is not serializable", e);
            throw new StoreQueryException(collection, "Cannot serialize document " + id, e);
        }

        try {
            transactionTemplate.executeWithoutResult(status -> {
                StoredDocument row = repository.findByCollectionNameAndDocumentId(collection, id)
                        .orElseGet(() -> StoredDocument.builder()
                                .collectionName(collection)
                                .documentId(id)
                                .build());
                row.setBodyJson(body);
                row.setSequenceValue(sequenceValueOf(document));
                repository.save(row);
            });
            callCtx.logResponse("Document stored", "Size", body.length() + " chars");
        } catch (DataAccessException | TransactionException e) {
            callCtx.logError(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            throw translate(collection, "upsert", e);
        }
    }

    private Long sequenceValueOf(Map<String, Object> document) {
        IdentifierProperties ids = props.getIdentifiers();
        OptionalLong value = SequenceNumbers.numericPortionOf(document.get(ids.getSequenceField()), ids.knownPrefixes());
        return value.isPresent() ? value.getAsLong() : null;
    }

    private Map<String, Object> readBody(String collection, StoredDocument row) {
        try {
            return objectMapper.readValue(row.getBodyJson(), DOCUMENT_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreQueryException(collection, "Corrupt document " + row.getDocumentId(), e);
        }
    }

    private RuntimeException translate(String collection, String operation, RuntimeException e) {
        String message = operation + " on " + collection + " failed: " + e.getMessage();
        if (e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessResourceException
                || e instanceof CannotCreateTransactionException) {
            return new StoreUnavailableException(collection, message, e);
        }
        return new StoreQueryException(collection, message, e);
    }
}
