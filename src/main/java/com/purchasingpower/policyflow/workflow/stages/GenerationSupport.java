package com.purchasingpower.policyflow.workflow.stages;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.policyflow.client.PromptMessage;
import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.extraction.StructuredCallExecutor;
import com.purchasingpower.policyflow.service.PromptLibraryService;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Prompt rendering plus generation round trip shared by the stage processors.
 * The template name doubles as the retry settings key.
 */
@Component
@RequiredArgsConstructor
public class GenerationSupport {

    private final PromptLibraryService promptLibrary;
    private final StructuredCallExecutor executor;
    private final ObjectMapper objectMapper;

    public <T> RoundTripResult<T> generate(PolicyWorkflowState state,
                                           String templateName,
                                           Map<String, Object> variables,
                                           Class<T> type,
                                           Supplier<T> defaultValue) {
        List<PromptMessage> messages = promptLibrary.render(templateName, variables);
        List<String> requiredFields = promptLibrary.getTemplate(templateName).getRequiredFields();
        return executor.callForObject(templateName, state.getSessionId(), messages,
                requiredFields != null ? requiredFields : List.of(), type, defaultValue);
    }

    public RoundTripResult<String> generateText(PolicyWorkflowState state,
                                                String templateName,
                                                Map<String, Object> variables,
                                                Supplier<String> defaultText) {
        List<PromptMessage> messages = promptLibrary.render(templateName, variables);
        return executor.callForText(templateName, state.getSessionId(), messages, defaultText);
    }

    /**
     * JSON for prompt variables; templates insert it with triple mustaches.
     */
    public String toJson(Object value) {
        if (value == null) {
            return "{}";
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName() + " for prompt", e);
        }
    }
}
