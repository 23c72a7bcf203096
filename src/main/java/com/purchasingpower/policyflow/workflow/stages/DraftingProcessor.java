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
 * Writes the policy document in two passes: a draft, then a polish of that draft.
 * When the draft pass falls back to the standard wording the polish pass is skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DraftingProcessor implements StageProcessor {

    static final String DEFAULT_POLICY_TEXT = "Standard policy language.";

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.DRAFTING;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("profileJson", generation.toJson(state.getCustomerProfile()));
        variables.put("coverageJson", generation.toJson(state.getCoverage()));
        variables.put("quoteId", state.getSessionId());

        RoundTripResult<String> draft = generation.generateText(
                state, "drafting", variables, () -> DEFAULT_POLICY_TEXT);

        String document = draft.value();
        if (!draft.defaulted()) {
            Map<String, Object> polishVariables = new HashMap<>(variables);
            polishVariables.put("draft", draft.value());
            RoundTripResult<String> polished = generation.generateText(
                    state, "polish", polishVariables, draft::value);
            document = polished.value();
        }

        log.info("📜 Policy document drafted ({} chars, defaulted: {})", document.length(), draft.defaulted());
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.POLICY_DOCUMENT, document);
        return updates;
    }
}
