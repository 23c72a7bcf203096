package com.purchasingpower.policyflow.persistence;

import com.google.common.base.Preconditions;
import com.purchasingpower.policyflow.configuration.AppProperties;
import com.purchasingpower.policyflow.exception.StoreQueryException;
import com.purchasingpower.policyflow.exception.StoreUnavailableException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Uniform query/upsert/sequence access to named collections.
 *
 * <p>Each collection is served by the durable store or, when that store cannot
 * be reached, by the in-memory mirror. The choice is made per collection: at
 * startup every configured collection is probed on its own, and a collection
 * that later reports a connection failure is demoted on the spot. Partial
 * availability is a normal operating mode.
 *
 * <p>Every durable write is also applied to the mirror, so demotion never
 * hides documents this process has written. A document whose durable write
 * was rejected while the collection stayed reachable is read back from the
 * mirror until a later durable write of the same id succeeds.
 *
 * <p>Queries never throw. Failures come back as an error envelope, except for
 * reference collections, which fall back to their built-in dataset when the
 * query fails or the collection holds no documents.
 */
@Slf4j
@Service
public class PersistenceGateway {

    private static final String ID = "id";

    private final DocumentStore durableStore;
    private final InMemoryDocumentStore mirror;
    private final SequenceAllocator sequenceAllocator;
    private final ReferenceDatasets referenceDatasets;
    private final AppProperties props;

    private final Set<String> durableCollections = ConcurrentHashMap.newKeySet();
    private final Set<String> probedCollections = ConcurrentHashMap.newKeySet();
    private final Map<String, Set<String>> mirrorOnlyIds = new ConcurrentHashMap<>();

    @Autowired
    public PersistenceGateway(JpaDocumentStore durableStore,
                              InMemoryDocumentStore mirror,
                              SequenceAllocator sequenceAllocator,
                              ReferenceDatasets referenceDatasets,
                              AppProperties props) {
        this((DocumentStore) durableStore, mirror, sequenceAllocator, referenceDatasets, props);
    }

    PersistenceGateway(DocumentStore durableStore,
                       InMemoryDocumentStore mirror,
                       SequenceAllocator sequenceAllocator,
                       ReferenceDatasets referenceDatasets,
                       AppProperties props) {
        this.durableStore = durableStore;
        this.mirror = mirror;
        this.sequenceAllocator = sequenceAllocator;
        this.referenceDatasets = referenceDatasets;
        this.props = props;
    }

    @PostConstruct
    public void initialize() {
        log.info("🗄️ Initializing persistence gateway (durable store: {})", durableStore.getName());
        for (String collection : props.getPersistence().collections()) {
            probe(collection);
        }
        log.info("   Durable collections: {}", durableCollections);
        log.info("   Mirrored collections: {}", probedCollections.stream()
                .filter(c -> !durableCollections.contains(c))
                .collect(Collectors.toSet()));
    }

    /**
     * Documents of {@code collection} whose top-level fields equal every entry of {@code filter}.
     * A filter on {@code id} alone is answered by an id lookup.
     */
    public QueryResult query(String collection, Map<String, Object> filter) {
        Map<String, Object> criteria = filter != null ? filter : Map.of();
        if (isIdLookup(collection, criteria)) {
            return lookup(collection, criteria.get(ID).toString());
        }

        QueryResult result;
        boolean collectionEmpty = false;
        DocumentStore backend = backendFor(collection);
        try {
            List<Map<String, Object>> documents = backend == mirror
                    ? mirror.findAll(collection)
                    : withMirrorOnlyDocuments(collection, backend.findAll(collection));
            collectionEmpty = documents.isEmpty();
            result = QueryResult.ok(matching(documents, criteria), backend.getName());
        } catch (StoreUnavailableException e) {
            demote(collection, e);
            List<Map<String, Object>> documents = mirror.findAll(collection);
            collectionEmpty = documents.isEmpty();
            result = QueryResult.ok(matching(documents, criteria), mirror.getName());
        } catch (StoreQueryException e) {
            log.error("Query on {} failed: {}", collection, e.getMessage());
            result = QueryResult.error(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure querying {}", collection, e);
            result = QueryResult.error("Query on " + collection + " failed: " + e.getMessage());
        }
        return withReferenceDefaults(collection, criteria, result, collectionEmpty);
    }

    public Optional<Map<String, Object>> findById(String collection, String id) {
        QueryResult result = lookup(collection, id);
        if (!result.isSuccess() || result.getData().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(result.getData().get(0));
    }

    /**
     * Write a document keyed by its {@code id} field. Store failures are logged and absorbed:
     * the mirror always receives the document.
     */
    public void upsert(String collection, Map<String, Object> document) {
        Preconditions.checkNotNull(document, "Document cannot be null");
        Object id = document.get(ID);
        Preconditions.checkArgument(id != null && !id.toString().isBlank(), "Document for %s has no id", collection);
        String documentId = id.toString();

        mirror.upsert(collection, documentId, document);
        if (!isDurable(collection)) {
            log.debug("Stored {}/{} in mirror only", collection, documentId);
            return;
        }

        try {
            durableStore.upsert(collection, documentId, document);
            clearMirrorOnly(collection, documentId);
        } catch (StoreUnavailableException e) {
            demote(collection, e);
        } catch (StoreQueryException e) {
            mirrorOnlyIds.computeIfAbsent(collection, c -> ConcurrentHashMap.newKeySet()).add(documentId);
            log.warn("⚠️ Durable write of {}/{} failed, serving it from mirror: {}",
                    collection, documentId, e.getMessage());
        }
    }

    public long nextSequence(String field, String collection, int increment, long defaultStart) {
        Preconditions.checkArgument(increment > 0, "Increment must be > 0");
        if (isDurable(collection)) {
            try {
                return sequenceAllocator.allocate(durableStore, true, field, collection, increment, defaultStart);
            } catch (StoreUnavailableException e) {
                demote(collection, e);
            } catch (StoreQueryException e) {
                log.warn("⚠️ Sequence scan on {} failed, using mirror: {}", collection, e.getMessage());
            }
        }
        return sequenceAllocator.allocate(mirror, false, field, collection, increment, defaultStart);
    }

    public boolean isDurable(String collection) {
        if (!probedCollections.contains(collection)) {
            probe(collection);
        }
        return durableCollections.contains(collection);
    }

    private DocumentStore backendFor(String collection) {
        return isDurable(collection) ? durableStore : mirror;
    }

    private void probe(String collection) {
        probedCollections.add(collection);
        mirror.probe(collection);
        if (!props.getPersistence().isDurableEnabled()) {
            return;
        }
        try {
            durableStore.probe(collection);
            durableCollections.add(collection);
        } catch (RuntimeException e) {
            log.warn("⚠️ Collection {} unavailable on {} store, using in-memory mirror: {}",
                    collection, durableStore.getName(), e.getMessage());
        }
    }

    private void demote(String collection, StoreUnavailableException e) {
        if (durableCollections.remove(collection)) {
            log.warn("⚠️ Lost durable store for {}, switching to in-memory mirror: {}", collection, e.getMessage());
        }
    }

    private boolean isIdLookup(String collection, Map<String, Object> criteria) {
        return criteria.size() == 1
                && criteria.get(ID) != null
                && !referenceDatasets.isReference(collection);
    }

    private QueryResult lookup(String collection, String id) {
        if (!isDurable(collection) || isMirrorOnly(collection, id)) {
            return found(mirror.findById(collection, id), mirror.getName());
        }
        try {
            return found(durableStore.findById(collection, id), durableStore.getName());
        } catch (StoreUnavailableException e) {
            demote(collection, e);
            return found(mirror.findById(collection, id), mirror.getName());
        } catch (StoreQueryException e) {
            Optional<Map<String, Object>> mirrored = mirror.findById(collection, id);
            if (mirrored.isPresent()) {
                log.warn("⚠️ Lookup of {}/{} failed, answering from mirror: {}", collection, id, e.getMessage());
                return QueryResult.ok(List.of(mirrored.get()), mirror.getName());
            }
            log.error("Lookup of {}/{} failed: {}", collection, id, e.getMessage());
            return QueryResult.error(e.getMessage());
        }
    }

    private static QueryResult found(Optional<Map<String, Object>> document, String source) {
        return QueryResult.ok(document.map(List::of).orElseGet(List::of), source);
    }

    private boolean isMirrorOnly(String collection, String id) {
        Set<String> ids = mirrorOnlyIds.get(collection);
        return ids != null && ids.contains(id);
    }

    private void clearMirrorOnly(String collection, String id) {
        Set<String> ids = mirrorOnlyIds.get(collection);
        if (ids != null && ids.remove(id)) {
            log.info("Durable copy of {}/{} is current again", collection, id);
        }
    }

    /**
     * Durable documents with the mirror's copy substituted for ids whose durable write failed.
     */
    private List<Map<String, Object>> withMirrorOnlyDocuments(String collection, List<Map<String, Object>> durable) {
        Set<String> ids = mirrorOnlyIds.get(collection);
        if (ids == null || ids.isEmpty()) {
            return durable;
        }
        Map<String, Map<String, Object>> byId = new LinkedHashMap<>();
        durable.forEach(doc -> byId.put(String.valueOf(doc.get(ID)), doc));
        ids.forEach(id -> mirror.findById(collection, id).ifPresent(doc -> byId.put(id, doc)));
        return new ArrayList<>(byId.values());
    }

    private static List<Map<String, Object>> matching(List<Map<String, Object>> documents,
                                                      Map<String, Object> criteria) {
        return documents.stream()
                .filter(doc -> DocumentFilter.matches(doc, criteria))
                .collect(Collectors.toList());
    }

    private QueryResult withReferenceDefaults(String collection,
                                              Map<String, Object> criteria,
                                              QueryResult result,
                                              boolean collectionEmpty) {
        if (!referenceDatasets.isReference(collection)) {
            return result;
        }
        if (result.isSuccess() && !collectionEmpty) {
            return result;
        }
        String reason = result.isSuccess() ? "collection is empty" : result.getMessage();
        log.info("Using built-in {} dataset ({})", collection, reason);
        return referenceDatasets.defaultsFor(collection)
                .map(defaults -> matching(defaults, criteria))
                .map(defaults -> QueryResult.defaulted(defaults, "Built-in dataset used: " + reason))
                .orElse(result);
    }
}
