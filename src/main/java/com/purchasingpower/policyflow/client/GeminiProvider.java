package com.purchasingpower.policyflow.client;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Gemini provider (wrapper for GeminiClient).
 */
@Component
@RequiredArgsConstructor
public class GeminiProvider implements LLMProvider {

    private final GeminiClient geminiClient;

    @Override
    public String chat(List<PromptMessage> messages, String stageName, String sessionId) {
        return geminiClient.callChatApi(messages, stageName, sessionId);
    }

    @Override
    public String getProviderName() {
        return "Gemini";
    }
}
