package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.model.policy.PolicyDraft;
import com.purchasingpower.policyflow.model.policy.PricingDetails;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Prices the designed coverage and records the final premium on the draft.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PricingProcessor implements StageProcessor {

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.PRICING;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("profileJson", generation.toJson(state.getCustomerProfile()));
        variables.put("riskJson", generation.toJson(state.getRiskAssessment()));
        variables.put("coverageJson", generation.toJson(state.getCoverage()));

        RoundTripResult<PricingDetails> result = generation.generate(
                state, "pricing", variables, PricingDetails.class, PricingProcessor::defaultPricing);

        PricingDetails pricing = result.value();
        if (pricing.getFinalPremium() == null || pricing.getFinalPremium() <= 0) {
            log.warn("⚠️ Non-positive premium {} replaced by the standard pricing", pricing.getFinalPremium());
            pricing = defaultPricing();
        }
        if (pricing.getBasePremium() == null) {
            pricing.setBasePremium(pricing.getFinalPremium());
        }

        PolicyDraft draft = state.getPolicyDraft() != null ? state.getPolicyDraft() : new PolicyDraft();
        PolicyDraft priced = draft.toBuilder().finalPremium(pricing.getFinalPremium()).build();

        log.info("💰 Final premium {} (base {}, defaulted: {})",
                pricing.getFinalPremium(), pricing.getBasePremium(), result.defaulted());
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.PRICING, pricing);
        updates.put(PolicyWorkflowState.POLICY_DRAFT, priced);
        return updates;
    }

    static PricingDetails defaultPricing() {
        return PricingDetails.builder()
                .basePremium(750.0)
                .finalPremium(825.50)
                .build();
    }
}
