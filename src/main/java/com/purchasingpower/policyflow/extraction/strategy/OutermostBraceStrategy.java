package com.purchasingpower.policyflow.extraction.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Strategy 4: greedy first-brace-to-last-brace span, parsed as is.
 */
public class OutermostBraceStrategy extends JsonCandidateStrategy {

    public OutermostBraceStrategy(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public String getName() {
        return "outermost-brace";
    }

    @Override
    public Optional<JsonNode> extract(String text) {
        return parseStructured(outermostBraceSpan(text));
    }
}
