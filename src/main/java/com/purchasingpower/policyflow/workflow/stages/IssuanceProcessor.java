package com.purchasingpower.policyflow.workflow.stages;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.policyflow.configuration.AppProperties;
import com.purchasingpower.policyflow.exception.StageValidationException;
import com.purchasingpower.policyflow.model.PolicyStatus;
import com.purchasingpower.policyflow.model.policy.CustomerProfile;
import com.purchasingpower.policyflow.model.policy.IssuanceDetails;
import com.purchasingpower.policyflow.model.policy.IssuedPolicy;
import com.purchasingpower.policyflow.model.policy.PolicyDraft;
import com.purchasingpower.policyflow.model.policy.PolicyDraftStatus;
import com.purchasingpower.policyflow.persistence.PersistenceGateway;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Issues the policy. Deterministic: no generation call.
 *
 * The policy number reuses the quote's sequence number with the policy
 * prefix, so QUOTE100010 becomes MV100010.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IssuanceProcessor implements StageProcessor {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final PersistenceGateway gateway;
    private final AppProperties props;
    private final ObjectMapper objectMapper;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.ISSUANCE;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        String stage = getStage().getStageName();
        CustomerProfile profile = state.getCustomerProfile();
        if (profile == null || !Boolean.TRUE.equals(profile.getEligible())) {
            throw new StageValidationException(stage, "Policy cannot be issued for a customer not found eligible");
        }
        if (state.getInternalApproval() == null || state.getRegulatoryReview() == null) {
            throw new StageValidationException(stage, "Quote has not been through approval");
        }
        Long quoteNumber = state.getQuoteNumber();
        if (quoteNumber == null) {
            throw new StageValidationException(stage, "Session has no quote number");
        }
        PolicyDraft draft = state.getPolicyDraft();
        if (draft == null || draft.getFinalPremium() == null) {
            throw new StageValidationException(stage, "Policy draft has not been priced");
        }

        String policyNumber = props.getIdentifiers().policyNumber(quoteNumber);
        LocalDate startDate = LocalDate.now();
        LocalDate endDate = startDate.plusDays(props.getWorkflow().getPolicyTermDays());

        IssuedPolicy issued = IssuedPolicy.builder()
                .id(policyNumber)
                .policyNumber(policyNumber)
                .quoteId(state.getSessionId())
                .quoteNumber(quoteNumber)
                .status(PolicyStatus.ACTIVE)
                .customerProfile(profile)
                .coverage(state.getCoverage())
                .finalPremium(draft.getFinalPremium())
                .policyDocument(state.getPolicyDocument())
                .startDate(startDate)
                .endDate(endDate)
                .issuedAt(Instant.now())
                .build();
        gateway.upsert(props.getPersistence().getIssuedCollection(), objectMapper.convertValue(issued, DOCUMENT_TYPE));

        log.info("🏁 Policy {} issued from quote {} ({} to {})", policyNumber, state.getSessionId(), startDate, endDate);
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.ISSUANCE, IssuanceDetails.builder()
                .policyNumber(policyNumber)
                .startDate(startDate)
                .endDate(endDate)
                .build());
        updates.put(PolicyWorkflowState.POLICY_DRAFT, draft.toBuilder()
                .policyNumber(policyNumber)
                .status(PolicyDraftStatus.ACTIVE)
                .build());
        return updates;
    }
}
