package com.purchasingpower.policyflow.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes.
 *
 * <ul>
 *   <li>{@link GeminiConfig} - Gemini sampling and HTTP retry settings
 *   <li>{@link StageRetryConfig} - stage round-trip retry, backoff and timeout
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    GeminiConfig.class,
    StageRetryConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
