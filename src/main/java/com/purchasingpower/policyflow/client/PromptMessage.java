package com.purchasingpower.policyflow.client;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One role-tagged message of a generation request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromptMessage {

    public static final String SYSTEM = "system";
    public static final String USER = "user";

    private String role;
    private String content;

    public static PromptMessage system(String content) {
        return new PromptMessage(SYSTEM, content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage(USER, content);
    }

    public boolean isSystem() {
        return SYSTEM.equals(role);
    }
}
