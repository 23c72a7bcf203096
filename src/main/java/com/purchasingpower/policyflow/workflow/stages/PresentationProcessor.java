package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Customer-facing walkthrough of the quoted package: coverage, document and price together.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresentationProcessor implements StageProcessor {

    static final String DEFAULT_PRESENTATION = "Presentation details unavailable.";

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.PRESENTATION;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("customerName", state.getCustomerProfile() != null ? state.getCustomerProfile().getName() : "");
        variables.put("quoteDetails", state.getQuoteDetails() != null ? state.getQuoteDetails() : "");
        variables.put("coverageJson", generation.toJson(state.getCoverage()));
        variables.put("policyDocument", state.getPolicyDocument() != null ? state.getPolicyDocument() : "");

        RoundTripResult<String> result = generation.generateText(
                state, "presentation", variables, () -> DEFAULT_PRESENTATION);

        log.info("🎤 Quote {} presented to customer (defaulted: {})", state.getSessionId(), result.defaulted());
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.PRESENTATION, result.value());
        return updates;
    }
}
