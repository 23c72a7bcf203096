package com.purchasingpower.policyflow.extraction.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Strategy 7: an object that was serialized twice and arrives as a string
 * literal, e.g. {@code "{\"a\": 1}"}.
 */
@Slf4j
public class EscapedLiteralStrategy extends JsonCandidateStrategy {

    public EscapedLiteralStrategy(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public String getName() {
        return "escaped-literal";
    }

    @Override
    public Optional<JsonNode> extract(String text) {
        if (!text.contains("\\\"")) {
            return Optional.empty();
        }

        // Whole reply is a JSON string literal
        String trimmed = text.trim();
        if (trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            try {
                JsonNode literal = mapper.readTree(trimmed);
                if (literal.isTextual()) {
                    Optional<JsonNode> inner = parseStructured(literal.textValue());
                    if (inner.isPresent()) {
                        return inner;
                    }
                }
            } catch (JsonProcessingException e) {
                log.debug("Reply is not a well-formed string literal, unescaping manually: {}", e.getOriginalMessage());
            }
        }

        String span = outermostBraceSpan(text);
        if (span == null) {
            return Optional.empty();
        }
        String unescaped = span
                .replace("\\\\", "\u0000")
                .replace("\\\"", "\"")
                .replace("\u0000", "\\");
        return parseStructured(unescaped);
    }
}
