package com.purchasingpower.policyflow.extraction;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.purchasingpower.policyflow.extraction.strategy.AggressiveRepairStrategy;
import com.purchasingpower.policyflow.extraction.strategy.AnyFenceStrategy;
import com.purchasingpower.policyflow.extraction.strategy.BareKeyRepairStrategy;
import com.purchasingpower.policyflow.extraction.strategy.DirectParseStrategy;
import com.purchasingpower.policyflow.extraction.strategy.EscapedLiteralStrategy;
import com.purchasingpower.policyflow.extraction.strategy.LabeledFenceStrategy;
import com.purchasingpower.policyflow.extraction.strategy.LineTrimStrategy;
import com.purchasingpower.policyflow.extraction.strategy.OutermostBraceStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Recovers structured data from free-text generation output.
 *
 * Strategies run in a fixed priority order and the first object or array
 * found wins. A strategy that throws is skipped; it never stops the chain.
 * Empty means "no result" and is an expected outcome callers handle with
 * their own defaults.
 *
 * Usage:
 * <pre>
 * Optional&lt;JsonNode&gt; risk = extractor.extract(reply);
 * </pre>
 */
@Slf4j
@Component
public class ResponseExtractor {

    private final List<ExtractionStrategy> strategies;

    public ResponseExtractor() {
        this(defaultStrategies(strictMapper()));
    }

    public ResponseExtractor(List<ExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public static List<ExtractionStrategy> defaultStrategies(ObjectMapper mapper) {
        return List.of(
                new DirectParseStrategy(mapper),
                new LabeledFenceStrategy(mapper),
                new AnyFenceStrategy(mapper),
                new OutermostBraceStrategy(mapper),
                new BareKeyRepairStrategy(mapper),
                new LineTrimStrategy(mapper),
                new EscapedLiteralStrategy(mapper),
                new AggressiveRepairStrategy(mapper)
        );
    }

    /**
     * Mapper that rejects trailing garbage, so "{...} Thanks!" is not
     * mistaken for a clean document by the direct strategy.
     */
    public static ObjectMapper strictMapper() {
        return JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    public Optional<JsonNode> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        for (ExtractionStrategy strategy : strategies) {
            try {
                Optional<JsonNode> result = strategy.extract(text);
                if (result.isPresent()) {
                    log.debug("Extracted structured value with strategy '{}'", strategy.getName());
                    return result;
                }
            } catch (RuntimeException e) {
                log.debug("Strategy '{}' failed: {}", strategy.getName(), e.getMessage());
            }
        }

        log.debug("No strategy recovered structured data ({} chars)", text.length());
        return Optional.empty();
    }

    public List<ExtractionStrategy> getStrategies() {
        return strategies;
    }
}
