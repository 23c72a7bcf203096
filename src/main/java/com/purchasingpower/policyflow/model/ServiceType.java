package com.purchasingpower.policyflow.model;

/**
 * External services whose calls are logged through ExternalCallLogger.
 *
 * @see com.purchasingpower.policyflow.util.ExternalCallLogger
 */
public enum ServiceType {
    GEMINI("🔴", "Gemini"),
    OLLAMA("🔵", "Ollama"),
    DOCUMENT_STORE("🟠", "DocumentStore");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
