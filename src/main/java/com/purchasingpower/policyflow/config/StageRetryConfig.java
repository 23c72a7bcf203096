package com.purchasingpower.policyflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Round-trip retry policy for workflow stages.
 *
 * <p>A stage attempt is one generation call plus extraction and required-field
 * validation. Failed attempts are retried with the same prompt until
 * {@code maxAttempts} is reached, then the stage substitutes its default dataset.
 *
 * <p>Properties are loaded from the {@code app.stage-retry} namespace:
 * <pre>
 * app:
 *   stage-retry:
 *     max-attempts: 3
 *     backoff-ms: 500
 *     max-backoff-ms: 5000
 *     jitter: 0.5
 *     timeout-ms: 60000
 *     stages:
 *       drafting:
 *         timeout-ms: 120000
 * </pre>
 *
 * <p>Delay before retry N (starting at 0) is {@code min(backoff-ms * 2^N, max-backoff-ms)},
 * randomized by {@code jitter}.
 */
@ConfigurationProperties(prefix = "app.stage-retry")
@Data
public class StageRetryConfig {

    /**
     * Total attempts including the first call.
     */
    private int maxAttempts = 3;

    private long backoffMs = 500;

    private long maxBackoffMs = 5000;

    /**
     * Jitter factor between 0.0 and 1.0.
     */
    private double jitter = 0.5;

    /**
     * Per-call timeout on the generation service.
     */
    private long timeoutMs = 60000;

    /**
     * Per-stage overrides. Unset fields inherit the values above.
     */
    private Map<String, StageOverride> stages = new HashMap<>();

    public Settings settingsFor(String stageName) {
        StageOverride o = stages.get(stageName);
        if (o == null) {
            return new Settings(maxAttempts, Duration.ofMillis(backoffMs),
                    Duration.ofMillis(maxBackoffMs), jitter, Duration.ofMillis(timeoutMs));
        }
        return new Settings(
                o.getMaxAttempts() != null ? o.getMaxAttempts() : maxAttempts,
                Duration.ofMillis(o.getBackoffMs() != null ? o.getBackoffMs() : backoffMs),
                Duration.ofMillis(maxBackoffMs),
                jitter,
                Duration.ofMillis(o.getTimeoutMs() != null ? o.getTimeoutMs() : timeoutMs));
    }

    @Data
    public static class StageOverride {
        private Integer maxAttempts;
        private Long backoffMs;
        private Long timeoutMs;
    }

    /**
     * Effective settings for one stage.
     */
    public record Settings(int maxAttempts, Duration backoff, Duration maxBackoff, double jitter, Duration timeout) {
    }
}
