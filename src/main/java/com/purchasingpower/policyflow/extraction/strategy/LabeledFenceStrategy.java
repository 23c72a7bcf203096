package com.purchasingpower.policyflow.extraction.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strategy 2: content of a fenced block labelled {@code json}.
 */
public class LabeledFenceStrategy extends JsonCandidateStrategy {

    private static final Pattern JSON_FENCE =
            Pattern.compile("```\\s*json[ \\t]*\\r?\\n?(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    public LabeledFenceStrategy(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public String getName() {
        return "json-fence";
    }

    @Override
    public Optional<JsonNode> extract(String text) {
        Matcher matcher = JSON_FENCE.matcher(text);
        while (matcher.find()) {
            Optional<JsonNode> parsed = parseStructured(matcher.group(1));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }
}
