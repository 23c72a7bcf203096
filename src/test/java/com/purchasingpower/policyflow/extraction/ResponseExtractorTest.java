package com.purchasingpower.policyflow.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.policyflow.extraction.strategy.AggressiveRepairStrategy;
import com.purchasingpower.policyflow.extraction.strategy.AnyFenceStrategy;
import com.purchasingpower.policyflow.extraction.strategy.BareKeyRepairStrategy;
import com.purchasingpower.policyflow.extraction.strategy.DirectParseStrategy;
import com.purchasingpower.policyflow.extraction.strategy.EscapedLiteralStrategy;
import com.purchasingpower.policyflow.extraction.strategy.LabeledFenceStrategy;
import com.purchasingpower.policyflow.extraction.strategy.LineTrimStrategy;
import com.purchasingpower.policyflow.extraction.strategy.OutermostBraceStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("Response Extractor Tests")
class ResponseExtractorTest {

    private final ObjectMapper mapper = ResponseExtractor.strictMapper();
    private final ResponseExtractor extractor = new ResponseExtractor();

    private JsonNode json(String text) throws Exception {
        return new ObjectMapper().readTree(text);
    }

    @Test
    @DisplayName("Should keep strategies in priority order")
    void strategies_ShouldRunInPriorityOrder() {
        List<String> names = new ArrayList<>();
        extractor.getStrategies().forEach(s -> names.add(s.getName()));

        assertThat(names).containsExactly("direct", "json-fence", "any-fence", "outermost-brace",
                "bare-key-repair", "line-trim", "escaped-literal", "aggressive-repair");
    }

    @Test
    @DisplayName("Should extract pure JSON unchanged")
    void extract_PureJson_ShouldReturnSameValue() throws Exception {
        // Given
        String text = "{\"riskScore\": 4.5, \"riskFactors\": [\"Young driver\"]}";

        // When
        Optional<JsonNode> result = extractor.extract(text);

        // Then
        assertThat(result).contains(json(text));
    }

    @Test
    @DisplayName("Should extract a labeled fence like the inner text")
    void extract_LabeledFence_ShouldMatchInnerText() throws Exception {
        // Given
        String inner = "{\"coverages\": [\"Collision\"], \"limits\": {\"collision\": 40000}}";
        String text = "Here you go:\n```json\n" + inner + "\n```\nLet me know.";

        // When
        Optional<JsonNode> result = extractor.extract(text);

        // Then
        assertThat(result).contains(json(inner));
    }

    @Test
    @DisplayName("Should cut an object out of surrounding prose")
    void extract_ObjectInProse_ShouldReturnObject() throws Exception {
        Optional<JsonNode> result = extractor.extract("Here is the result: {\"a\":1} Thanks!");

        assertThat(result).contains(json("{\"a\":1}"));
    }

    @Test
    @DisplayName("Should quote bare keys")
    void extract_UnquotedKeys_ShouldRepair() throws Exception {
        Optional<JsonNode> result = extractor.extract("{name: \"x\", age: 5}");

        assertThat(result).contains(json("{\"name\":\"x\",\"age\":5}"));
    }

    @Test
    @DisplayName("Should signal no result for plain text without throwing")
    void extract_PlainText_ShouldReturnEmpty() {
        assertThatCode(() -> extractor.extract("no idea")).doesNotThrowAnyException();
        assertThat(extractor.extract("no idea")).isEmpty();
        assertThat(extractor.extract("")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    @DisplayName("Should ignore bare scalars")
    void extract_Scalar_ShouldReturnEmpty() {
        assertThat(extractor.extract("42")).isEmpty();
        assertThat(extractor.extract("\"just a string\"")).isEmpty();
    }

    @Test
    @DisplayName("Should continue after a strategy throws")
    void extract_ThrowingStrategy_ShouldFallThrough() throws Exception {
        // Given
        ExtractionStrategy broken = new ExtractionStrategy() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public Optional<JsonNode> extract(String text) {
                throw new IllegalStateException("boom");
            }
        };
        ResponseExtractor chain = new ResponseExtractor(List.of(broken, new OutermostBraceStrategy(mapper)));

        // When
        Optional<JsonNode> result = chain.extract("prefix {\"ok\": true} suffix");

        // Then
        assertThat(result).contains(json("{\"ok\": true}"));
    }

    @Nested
    @DisplayName("Individual strategies")
    class Strategies {

        @Test
        @DisplayName("direct rejects trailing commentary")
        void direct_ShouldRejectTrailingTokens() {
            DirectParseStrategy strategy = new DirectParseStrategy(mapper);

            assertThat(strategy.extract("[1, 2, 3]")).isPresent();
            assertThat(strategy.extract("{\"a\": 1} Thanks!")).isEmpty();
        }

        @Test
        @DisplayName("json-fence only reads blocks labeled json")
        void labeledFence_ShouldRequireJsonLabel() throws Exception {
            LabeledFenceStrategy strategy = new LabeledFenceStrategy(mapper);

            assertThat(strategy.extract("```JSON\n{\"a\": 1}\n```")).contains(json("{\"a\": 1}"));
            assertThat(strategy.extract("```yaml\n{\"a\": 1}\n```")).isEmpty();
        }

        @Test
        @DisplayName("any-fence reads unlabeled and other-labeled blocks")
        void anyFence_ShouldIgnoreLabel() throws Exception {
            AnyFenceStrategy strategy = new AnyFenceStrategy(mapper);

            assertThat(strategy.extract("```\n{\"a\": 1}\n```")).contains(json("{\"a\": 1}"));
            assertThat(strategy.extract("text ```javascript\n[\"x\"]\n``` more")).contains(json("[\"x\"]"));
        }

        @Test
        @DisplayName("outermost-brace spans nested objects greedily")
        void outermostBrace_ShouldSpanNestedObjects() throws Exception {
            OutermostBraceStrategy strategy = new OutermostBraceStrategy(mapper);

            assertThat(strategy.extract("Result -> {\"a\": {\"b\": 2}} done"))
                    .contains(json("{\"a\": {\"b\": 2}}"));
        }

        @Test
        @DisplayName("bare-key-repair quotes nested bare keys")
        void bareKeyRepair_ShouldQuoteNestedKeys() throws Exception {
            BareKeyRepairStrategy strategy = new BareKeyRepairStrategy(mapper);

            assertThat(strategy.extract("Profile: {vehicle: {make: \"Ford\", year: 2018}}"))
                    .contains(json("{\"vehicle\": {\"make\": \"Ford\", \"year\": 2018}}"));
        }

        @Test
        @DisplayName("line-trim recovers an array between commentary lines")
        void lineTrim_ShouldRecoverArray() throws Exception {
            LineTrimStrategy strategy = new LineTrimStrategy(mapper);
            String text = "Sure, the factors are:\n[\n  \"Urban area\",\n  \"New driver\"\n]\nHope this helps.";

            assertThat(strategy.extract(text)).contains(json("[\"Urban area\", \"New driver\"]"));
        }

        @Test
        @DisplayName("escaped-literal unwraps a double-encoded object")
        void escapedLiteral_ShouldUnwrapString() throws Exception {
            EscapedLiteralStrategy strategy = new EscapedLiteralStrategy(mapper);

            assertThat(strategy.extract("\"{\\\"a\\\": 1, \\\"b\\\": \\\"x\\\"}\""))
                    .contains(json("{\"a\": 1, \"b\": \"x\"}"));
            assertThat(strategy.extract("result: {\\\"a\\\": 2}"))
                    .contains(json("{\"a\": 2}"));
            assertThat(strategy.extract("{\"a\": 1}")).isEmpty();
        }

        @Test
        @DisplayName("aggressive-repair fixes single quotes, hyphenated keys and trailing commas")
        void aggressiveRepair_ShouldFixMixedMalformations() throws Exception {
            AggressiveRepairStrategy strategy = new AggressiveRepairStrategy(mapper);
            String text = "Answer:\n{ risk-score: 7, 'factors': ['Speeding', 'Night driving',], }";

            assertThat(strategy.extract(text))
                    .contains(json("{\"risk-score\": 7, \"factors\": [\"Speeding\", \"Night driving\"]}"));
        }
    }
}
