package com.purchasingpower.policyflow.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.policyflow.client.LLMProviderFactory;
import com.purchasingpower.policyflow.client.PromptMessage;
import com.purchasingpower.policyflow.config.StageRetryConfig;
import com.purchasingpower.policyflow.model.policy.RiskAssessment;
import com.purchasingpower.policyflow.support.ScriptedLLMProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Structured Call Executor Tests")
class StructuredCallExecutorTest {

    private static final List<PromptMessage> PROMPT = List.of(
            PromptMessage.system("You score risk."),
            PromptMessage.user("Score this driver."));

    private ScriptedLLMProvider provider;
    private StageRetryConfig retryConfig;
    private StructuredCallExecutor executor;

    @BeforeEach
    void setUp() {
        provider = new ScriptedLLMProvider();
        LLMProviderFactory factory = new LLMProviderFactory(List.of(provider));
        ReflectionTestUtils.setField(factory, "providerName", ScriptedLLMProvider.NAME);

        retryConfig = new StageRetryConfig();
        retryConfig.setMaxAttempts(3);
        retryConfig.setBackoffMs(1);
        retryConfig.setMaxBackoffMs(5);
        retryConfig.setJitter(0.0);
        retryConfig.setTimeoutMs(2000);

        executor = new StructuredCallExecutor(factory, new ResponseExtractor(), retryConfig, new ObjectMapper());
    }

    private RoundTripResult<RiskAssessment> callRisk() {
        return executor.callForObject("risk-test", "QUOTE100000", PROMPT, List.of("riskScore"),
                RiskAssessment.class, () -> RiskAssessment.builder().riskScore(5.0).build());
    }

    @Test
    @DisplayName("Should accept the first usable reply")
    void callForObject_UsableReply_ShouldNotRetry() {
        // Given
        provider.script("risk-test", "Result: {\"riskScore\": 2.5, \"riskFactors\": [\"Garage parking\"]}");

        // When
        RoundTripResult<RiskAssessment> result = callRisk();

        // Then
        assertThat(result.defaulted()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.value().getRiskScore()).isEqualTo(2.5);
        assertThat(result.value().getRiskFactors()).containsExactly("Garage parking");
    }

    @Test
    @DisplayName("Should retry when a required field is missing")
    void callForObject_MissingRequiredField_ShouldRetry() {
        // Given
        provider.script("risk-test",
                "{\"riskFactors\": [\"No score given\"]}",
                "{\"riskScore\": 6}");

        // When
        RoundTripResult<RiskAssessment> result = callRisk();

        // Then
        assertThat(result.defaulted()).isFalse();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.value().getRiskScore()).isEqualTo(6.0);
    }

    @Test
    @DisplayName("Should substitute the default after three unusable replies")
    void callForObject_NoStructuredReply_ShouldUseDefault() {
        // Given
        provider.script("risk-test", "no idea", "still no idea", "sorry");

        // When
        RoundTripResult<RiskAssessment> result = callRisk();

        // Then
        assertThat(result.defaulted()).isTrue();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.value().getRiskScore()).isEqualTo(5.0);
        assertThat(provider.callsFor("risk-test")).isEqualTo(3);
    }

    @Test
    @DisplayName("Should substitute the default when the provider keeps failing")
    void callForObject_ProviderFailure_ShouldUseDefault() {
        // Given
        provider.failStage("risk-test");

        // When
        RoundTripResult<RiskAssessment> result = callRisk();

        // Then
        assertThat(result.defaulted()).isTrue();
        assertThat(provider.callsFor("risk-test")).isEqualTo(3);
    }

    @Test
    @DisplayName("Should honor a per-stage attempt override")
    void callForObject_StageOverride_ShouldLimitAttempts() {
        // Given
        StageRetryConfig.StageOverride override = new StageRetryConfig.StageOverride();
        override.setMaxAttempts(1);
        retryConfig.getStages().put("risk-test", override);
        provider.script("risk-test", "no idea", "{\"riskScore\": 1}");

        // When
        RoundTripResult<RiskAssessment> result = callRisk();

        // Then
        assertThat(result.defaulted()).isTrue();
        assertThat(provider.callsFor("risk-test")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should retry blank text replies")
    void callForText_BlankReply_ShouldRetry() {
        // Given
        provider.script("drafting-test", "   ", "Policy wording");

        // When
        RoundTripResult<String> result = executor.callForText("drafting-test", null, PROMPT,
                () -> "Standard policy language.");

        // Then
        assertThat(result.defaulted()).isFalse();
        assertThat(result.value()).isEqualTo("Policy wording");
        assertThat(result.attempts()).isEqualTo(2);
    }
}
