package com.purchasingpower.policyflow.extraction.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Strategy 5: outermost brace span with bare object keys quoted.
 *
 * {@code {name: "x", age: 5}} becomes {@code {"name": "x", "age": 5}}.
 */
public class BareKeyRepairStrategy extends JsonCandidateStrategy {

    private static final Pattern BARE_KEY = Pattern.compile("([{,]\\s*)([A-Za-z_][A-Za-z0-9_]*)(\\s*):");

    public BareKeyRepairStrategy(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public String getName() {
        return "bare-key-repair";
    }

    @Override
    public Optional<JsonNode> extract(String text) {
        String span = outermostBraceSpan(text);
        if (span == null) {
            return Optional.empty();
        }
        return parseStructured(BARE_KEY.matcher(span).replaceAll("$1\"$2\"$3:"));
    }
}
