package com.purchasingpower.policyflow.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Registers {@link ScriptedLLMProvider}; the test profile selects it with {@code app.llm-provider: scripted}.
 */
@TestConfiguration
public class ScriptedLLMConfig {

    @Bean
    public ScriptedLLMProvider scriptedLLMProvider() {
        return new ScriptedLLMProvider();
    }
}
