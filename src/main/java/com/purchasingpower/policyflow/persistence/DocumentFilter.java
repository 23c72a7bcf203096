package com.purchasingpower.policyflow.persistence;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * Equality filter on top-level document fields. Numbers compare by value, so a
 * filter of {@code 100010L} matches a stored {@code 100010} integer.
 */
final class DocumentFilter {

    private DocumentFilter() {
    }

    static boolean matches(Map<String, Object> document, Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> criterion : filter.entrySet()) {
            if (!valueEquals(document.get(criterion.getKey()), criterion.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return new BigDecimal(actual.toString()).compareTo(new BigDecimal(expected.toString())) == 0;
        }
        return Objects.equals(actual, expected);
    }
}
