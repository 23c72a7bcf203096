package com.purchasingpower.policyflow.util;

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Parsing of prefixed sequence values such as {@code MV100010} or {@code QUOTE100010}.
 */
@Slf4j
public final class SequenceNumbers {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private SequenceNumbers() {
    }

    /**
     * Numeric part of a sequence value after stripping the longest matching prefix
     * (case-insensitive): {@code "MV25"} gives 25, {@code 25} gives 25, {@code "N/A"} gives empty.
     */
    public static OptionalLong numericPortionOf(Object value, List<String> knownPrefixes) {
        if (value == null) {
            return OptionalLong.empty();
        }
        if (value instanceof Number number) {
            return OptionalLong.of(number.longValue());
        }

        String text = value.toString().trim();
        String stripped = knownPrefixes.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .filter(prefix -> text.regionMatches(true, 0, prefix, 0, prefix.length()))
                .findFirst()
                .map(prefix -> text.substring(prefix.length()))
                .orElse(text);

        if (!DIGITS.matcher(stripped).matches()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(stripped));
        } catch (NumberFormatException e) {
            log.debug("Ignoring sequence value {}: more digits than a long holds", text);
            return OptionalLong.empty();
        }
    }
}
