package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.model.policy.PricingDetails;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Presents the priced quote to the customer. Once quoted the session is a Draft.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuoteProcessor implements StageProcessor {

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.QUOTE;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        PricingDetails pricing = state.getPricing() != null ? state.getPricing() : PricingProcessor.defaultPricing();

        Map<String, Object> variables = new HashMap<>();
        variables.put("quoteId", state.getSessionId());
        variables.put("customerName", state.getCustomerProfile() != null ? state.getCustomerProfile().getName() : "");
        variables.put("pricingJson", generation.toJson(pricing));
        variables.put("coverageJson", generation.toJson(state.getCoverage()));

        RoundTripResult<String> result = generation.generateText(
                state, "quote", variables, () -> defaultQuote(state.getSessionId(), pricing));

        log.info("🧾 Quote {} presented (defaulted: {})", state.getSessionId(), result.defaulted());
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.QUOTE_DETAILS, result.value());
        return updates;
    }

    static String defaultQuote(String quoteId, PricingDetails pricing) {
        return String.format(Locale.ROOT, "Quote %s: final premium $%.2f", quoteId, pricing.getFinalPremium());
    }
}
