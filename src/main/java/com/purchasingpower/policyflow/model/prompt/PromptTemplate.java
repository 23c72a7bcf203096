package com.purchasingpower.policyflow.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompt template loaded from YAML.
 *
 * YAML structure:
 * <pre>
 * name: risk
 * version: 1.0
 * requiredFields: [riskScore]
 * systemPrompt: |
 *   You are Ares, the risk analyst...
 * userPrompt: |
 *   Customer profile: {{{profileJson}}}
 * </pre>
 *
 * @see com.purchasingpower.policyflow.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String systemPrompt;
    private String userPrompt;

    /**
     * Top-level fields a structured reply must carry to be accepted.
     */
    private List<String> requiredFields = new ArrayList<>();
}
