package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.model.policy.CoverageModel;
import com.purchasingpower.policyflow.model.policy.CustomerProfile;
import com.purchasingpower.policyflow.model.policy.IssuanceDetails;
import com.purchasingpower.policyflow.model.policy.MonitoringDetails;
import com.purchasingpower.policyflow.model.policy.PolicyDraft;
import com.purchasingpower.policyflow.model.policy.PolicySummary;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;

/**
 * Final policy summary. Generated prose is kept, the facts are taken from the session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SummaryProcessor implements StageProcessor {

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.SUMMARY;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        PolicySummary facts = factsOf(state);

        Map<String, Object> variables = new HashMap<>();
        variables.put("factsJson", generation.toJson(facts));
        variables.put("quoteDetails", state.getQuoteDetails() != null ? state.getQuoteDetails() : "");

        RoundTripResult<PolicySummary> result = generation.generate(
                state, "summary", variables, PolicySummary.class, () -> facts);

        PolicySummary summary = facts.toBuilder()
                .summary(result.value().getSummary() != null ? result.value().getSummary() : defaultText(facts))
                .build();
        log.info("📜 Policy {} summarized (defaulted: {})", summary.getPolicyNumber(), result.defaulted());
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.SUMMARY, summary);
        return updates;
    }

    static PolicySummary factsOf(PolicyWorkflowState state) {
        CustomerProfile profile = state.getCustomerProfile();
        CoverageModel coverage = state.getCoverage();
        PolicyDraft draft = state.getPolicyDraft();
        IssuanceDetails issuance = state.getIssuance();
        MonitoringDetails monitoring = state.getMonitoring();

        return PolicySummary.builder()
                .policyNumber(issuance != null ? issuance.getPolicyNumber() : null)
                .customerName(profile != null ? profile.getName() : null)
                .coverages(coverage != null && coverage.getCoverages() != null
                        ? new LinkedHashSet<>(coverage.getCoverages())
                        : new LinkedHashSet<>())
                .finalPremium(draft != null ? draft.getFinalPremium() : null)
                .activatedDate(issuance != null ? issuance.getStartDate() : null)
                .endDate(issuance != null ? issuance.getEndDate() : null)
                .monitoringStatus(monitoring != null ? monitoring.getMonitoringStatus() : null)
                .build();
    }

    private static String defaultText(PolicySummary facts) {
        return String.format(Locale.ROOT, "Policy %s for %s is active from %s to %s at $%.2f.",
                facts.getPolicyNumber(), facts.getCustomerName(), facts.getActivatedDate(), facts.getEndDate(),
                facts.getFinalPremium() != null ? facts.getFinalPremium() : 0.0);
    }
}
