package com.purchasingpower.policyflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Tuning for Google Gemini calls.
 *
 * <p>Connection settings (key, model, URL) live in
 * {@link com.purchasingpower.policyflow.configuration.GeminiProperties}; this class holds
 * sampling temperatures per workflow stage and HTTP-level retry behavior.
 *
 * <p>Properties are loaded from the {@code app.gemini} namespace in application.yml:
 * <pre>
 * app:
 *   gemini:
 *     default-temperature: 0.4
 *     stage-temperatures:
 *       drafting: 0.7
 *       risk: 0.1
 *     retry:
 *       max-attempts: 2
 *       initial-backoff-seconds: 1
 * </pre>
 *
 * <p>HTTP retries here cover rate limits and 5xx responses from a single call. Retrying a
 * whole stage when the reply cannot be parsed is configured separately in {@link StageRetryConfig}.
 */
@ConfigurationProperties(prefix = "app.gemini")
@Data
public class GeminiConfig {

    /**
     * Temperature used when a stage has no override.
     */
    private double defaultTemperature = 0.4;

    /**
     * Stage-specific overrides keyed by stage name (intake, risk, drafting, ...).
     */
    private Map<String, Double> stageTemperatures;

    private RetryConfig retry = new RetryConfig();

    public double getTemperatureForStage(String stageName) {
        if (stageTemperatures == null) {
            return defaultTemperature;
        }
        return stageTemperatures.getOrDefault(stageName, defaultTemperature);
    }

    /**
     * Exponential backoff for transient HTTP failures.
     */
    @Data
    public static class RetryConfig {

        private int maxAttempts = 2;

        private long initialBackoffSeconds = 1;

        private long maxBackoffSeconds = 8;

        /**
         * Status codes that trigger a retry. Null means 429 and any 5xx.
         */
        private List<Integer> retryableStatusCodes;
    }
}
