package com.purchasingpower.policyflow.extraction.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Strategy 6: drop commentary lines before and after the data.
 *
 * Keeps everything from the first line that opens an object or array to the
 * last line that closes one. This is the only positional strategy that also
 * recovers top-level arrays surrounded by prose.
 */
public class LineTrimStrategy extends JsonCandidateStrategy {

    public LineTrimStrategy(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public String getName() {
        return "line-trim";
    }

    @Override
    public Optional<JsonNode> extract(String text) {
        String[] lines = text.split("\\r?\\n");
        int first = -1;
        int last = -1;
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            if (first < 0 && (trimmed.startsWith("{") || trimmed.startsWith("["))) {
                first = i;
            }
            if (trimmed.endsWith("}") || trimmed.endsWith("]")) {
                last = i;
            }
        }
        if (first < 0 || last < first) {
            return Optional.empty();
        }

        StringBuilder candidate = new StringBuilder();
        for (int i = first; i <= last; i++) {
            candidate.append(lines[i]).append('\n');
        }
        return parseStructured(candidate.toString());
    }
}
