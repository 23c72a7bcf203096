package com.purchasingpower.policyflow.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Built-in datasets substituted when a reference collection cannot be read or is empty.
 *
 * Loaded from {@code classpath:reference/*.yaml}:
 * <pre>
 * collection: UnderwritingQuestions
 * version: 1.0
 * documents:
 *   - id: UW-LICENSE
 *     text: Do you hold a valid driver's license?
 *     mandatory: true
 * </pre>
 */
@Slf4j
@Component
public class ReferenceDatasets {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, List<Map<String, Object>>> datasets = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadDatasets() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:reference/*.yaml");

            for (Resource resource : resources) {
                DatasetFile file = yamlMapper.readValue(resource.getInputStream(), DatasetFile.class);
                datasets.put(file.getCollection(), file.getDocuments());
                log.info("Loaded reference dataset: {} ({} documents, version {})",
                        file.getCollection(), file.getDocuments().size(), file.getVersion());
            }
        } catch (Exception e) {
            log.error("Failed to load reference datasets", e);
            throw new IllegalStateException("Reference dataset initialization failed", e);
        }
    }

    public boolean isReference(String collection) {
        return datasets.containsKey(collection);
    }

    /**
     * Copies of the default documents for a reference collection.
     */
    public Optional<List<Map<String, Object>>> defaultsFor(String collection) {
        List<Map<String, Object>> documents = datasets.get(collection);
        if (documents == null) {
            return Optional.empty();
        }
        List<Map<String, Object>> copies = new ArrayList<>(documents.size());
        documents.forEach(doc -> copies.add(new LinkedHashMap<>(doc)));
        return Optional.of(copies);
    }

    @Data
    static class DatasetFile {
        private String collection;
        private String version;
        private List<Map<String, Object>> documents = new ArrayList<>();
    }
}
