package com.purchasingpower.policyflow.persistence;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local mirror used when a durable collection is unreachable.
 *
 * Every durable write is also applied here, so a collection that is demoted
 * mid-run keeps the documents this process already wrote. Stored and returned
 * documents are copies.
 */
@Component
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public void probe(String collection) {
        collections.computeIfAbsent(collection, c -> new ConcurrentHashMap<>());
    }

    @Override
    public List<Map<String, Object>> findAll(String collection) {
        Map<String, Map<String, Object>> docs = collections.get(collection);
        if (docs == null) {
            return new ArrayList<>();
        }
        List<Map<String, Object>> copies = new ArrayList<>(docs.size());
        docs.values().forEach(doc -> copies.add(new LinkedHashMap<>(doc)));
        return copies;
    }

    @Override
    public Optional<Map<String, Object>> findById(String collection, String id) {
        Map<String, Map<String, Object>> docs = collections.get(collection);
        if (docs == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(docs.get(id)).map(LinkedHashMap::new);
    }

    @Override
    public void upsert(String collection, String id, Map<String, Object> document) {
        collections.computeIfAbsent(collection, c -> new ConcurrentHashMap<>())
                .put(id, new LinkedHashMap<>(document));
    }

    public int size(String collection) {
        Map<String, Map<String, Object>> docs = collections.get(collection);
        return docs == null ? 0 : docs.size();
    }
}
