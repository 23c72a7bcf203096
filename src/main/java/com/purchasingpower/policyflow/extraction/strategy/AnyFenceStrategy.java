package com.purchasingpower.policyflow.extraction.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strategy 3: content of any fenced block, whatever its label.
 */
public class AnyFenceStrategy extends JsonCandidateStrategy {

    private static final Pattern ANY_FENCE =
            Pattern.compile("```[\\w+-]*[ \\t]*\\r?\\n?(.*?)```", Pattern.DOTALL);

    public AnyFenceStrategy(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public String getName() {
        return "any-fence";
    }

    @Override
    public Optional<JsonNode> extract(String text) {
        Matcher matcher = ANY_FENCE.matcher(text);
        while (matcher.find()) {
            Optional<JsonNode> parsed = parseStructured(matcher.group(1));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }
}
