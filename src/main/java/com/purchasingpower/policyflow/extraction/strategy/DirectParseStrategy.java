package com.purchasingpower.policyflow.extraction.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Strategy 1: the whole reply is already valid JSON.
 */
public class DirectParseStrategy extends JsonCandidateStrategy {

    public DirectParseStrategy(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public String getName() {
        return "direct";
    }

    @Override
    public Optional<JsonNode> extract(String text) {
        return parseStructured(text);
    }
}
