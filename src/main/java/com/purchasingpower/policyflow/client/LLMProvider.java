package com.purchasingpower.policyflow.client;

import java.util.List;

/**
 * Unified interface for text generation providers (Gemini, Ollama).
 *
 * Replies are free text with no guaranteed schema; callers parse them
 * through the ResponseExtractor.
 */
public interface LLMProvider {

    /**
     * Execute a chat completion.
     *
     * @param messages  role-tagged prompt, system messages first
     * @param stageName workflow stage issuing the call (for logging and temperature)
     * @param sessionId workflow session, may be null before the first checkpoint
     * @return the raw reply text
     */
    String chat(List<PromptMessage> messages, String stageName, String sessionId);

    /**
     * Provider name used for selection ({@code app.llm-provider}) and logging.
     */
    String getProviderName();
}
