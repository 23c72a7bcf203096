package com.purchasingpower.policyflow.extraction.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.policyflow.extraction.ExtractionStrategy;

import java.util.Optional;

/**
 * Base class for strategies that cut a candidate out of the text and parse it.
 *
 * Only objects and arrays count as structured values. Scalars, blanks and
 * syntax errors all map to empty.
 */
public abstract class JsonCandidateStrategy implements ExtractionStrategy {

    protected final ObjectMapper mapper;

    protected JsonCandidateStrategy(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    protected Optional<JsonNode> parseStructured(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(candidate.trim());
            if (node != null && (node.isObject() || node.isArray())) {
                return Optional.of(node);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Greedy span from the first opening brace to the last closing brace.
     */
    protected static String outermostBraceSpan(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }
}
