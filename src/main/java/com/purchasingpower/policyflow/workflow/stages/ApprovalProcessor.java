package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.model.policy.InternalApproval;
import com.purchasingpower.policyflow.model.policy.RegulatoryReview;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

/**
 * Collects the internal approval and the regulatory review of the quote.
 *
 * Both default to a pass when generation fails. Whether the session may go on
 * to issuance is decided afterwards by the approval gate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalProcessor implements StageProcessor {

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.APPROVAL;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("quoteId", state.getSessionId());
        variables.put("profileJson", generation.toJson(state.getCustomerProfile()));
        variables.put("riskJson", generation.toJson(state.getRiskAssessment()));
        variables.put("coverageJson", generation.toJson(state.getCoverage()));
        variables.put("pricingJson", generation.toJson(state.getPricing()));
        variables.put("policyDocument", state.getPolicyDocument() != null ? state.getPolicyDocument() : "");

        RoundTripResult<InternalApproval> approval = generation.generate(
                state, "approval", variables, InternalApproval.class,
                () -> InternalApproval.builder().approved(true).reasons(new ArrayList<>()).build());
        RoundTripResult<RegulatoryReview> review = generation.generate(
                state, "regulatory", variables, RegulatoryReview.class,
                () -> RegulatoryReview.builder().compliance(true).issues(new ArrayList<>()).build());

        log.info("🏛️ Quote {} reviewed: approved={} compliance={} (defaulted: {}/{})", state.getSessionId(),
                approval.value().getApproved(), review.value().getCompliance(),
                approval.defaulted(), review.defaulted());
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.INTERNAL_APPROVAL, approval.value());
        updates.put(PolicyWorkflowState.REGULATORY_REVIEW, review.value());
        return updates;
    }
}
