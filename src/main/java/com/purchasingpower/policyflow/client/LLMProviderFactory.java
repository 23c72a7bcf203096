package com.purchasingpower.policyflow.client;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Selects the active generation provider by {@code app.llm-provider}.
 *
 * Any {@link LLMProvider} bean can be selected by its provider name, so
 * switching between Gemini and a local Ollama model needs no code change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LLMProviderFactory {

    private final List<LLMProvider> providers;

    @Value("${app.llm-provider:gemini}")
    private String providerName;

    @PostConstruct
    public void init() {
        log.info("🚀 LLM Provider configured: {}", providerName);
        log.info("   Active provider: {}", getProvider().getProviderName());
    }

    public LLMProvider getProvider() {
        return providers.stream()
                .filter(p -> p.getProviderName().equalsIgnoreCase(providerName))
                .findFirst()
                .orElseGet(() -> {
                    LLMProvider fallback = providers.stream()
                            .filter(p -> p instanceof GeminiProvider)
                            .findFirst()
                            .orElse(providers.get(0));
                    log.warn("Unknown LLM provider: {}, falling back to {}", providerName, fallback.getProviderName());
                    return fallback;
                });
    }
}
