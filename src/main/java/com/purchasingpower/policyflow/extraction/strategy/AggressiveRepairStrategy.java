package com.purchasingpower.policyflow.extraction.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Strategy 8, last resort: rewrite the whole text into something Jackson
 * accepts, then parse from the first opening bracket.
 *
 * Converts single-quoted strings, quotes any key-looking token in front of a
 * colon (hyphens allowed) and drops trailing commas.
 */
public class AggressiveRepairStrategy extends JsonCandidateStrategy {

    private static final Pattern SINGLE_QUOTED = Pattern.compile("'([^'\\\\\\r\\n]*)'");
    private static final Pattern UNQUOTED_KEY = Pattern.compile("(?<=[{,\\s])([A-Za-z_][A-Za-z0-9_\\-]*)\\s*:(?!//)");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");

    public AggressiveRepairStrategy(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public String getName() {
        return "aggressive-repair";
    }

    @Override
    public Optional<JsonNode> extract(String text) {
        String repaired = SINGLE_QUOTED.matcher(text).replaceAll("\"$1\"");
        repaired = UNQUOTED_KEY.matcher(repaired).replaceAll("\"$1\":");
        repaired = TRAILING_COMMA.matcher(repaired).replaceAll("$1");

        int start = firstOpening(repaired);
        if (start < 0) {
            return Optional.empty();
        }
        int end = Math.max(repaired.lastIndexOf('}'), repaired.lastIndexOf(']'));
        if (end <= start) {
            return Optional.empty();
        }
        return parseStructured(repaired.substring(start, end + 1));
    }

    private static int firstOpening(String text) {
        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace < 0) {
            return bracket;
        }
        if (bracket < 0) {
            return brace;
        }
        return Math.min(brace, bracket);
    }
}
