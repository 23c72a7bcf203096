package com.purchasingpower.policyflow.extraction;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One independent heuristic for recovering structured data from free text.
 *
 * Implementations are pure: the same text always yields the same result and
 * no state is kept between calls. An empty result means "this heuristic did
 * not find anything", which the extractor treats as a normal outcome.
 *
 * @see ResponseExtractor
 */
public interface ExtractionStrategy {

    /**
     * Short name used in debug logging.
     */
    String getName();

    /**
     * Try to recover a JSON object or array from the given text.
     *
     * @param text raw generation output, never null
     * @return the parsed object/array, or empty when this heuristic does not apply
     */
    Optional<JsonNode> extract(String text);
}
