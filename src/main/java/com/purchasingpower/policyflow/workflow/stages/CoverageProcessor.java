package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.model.policy.CoverageModel;
import com.purchasingpower.policyflow.model.policy.PolicyDraft;
import com.purchasingpower.policyflow.model.policy.PolicyDraftStatus;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Designs coverages, limits and deductibles, then opens the policy draft.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CoverageProcessor implements StageProcessor {

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.COVERAGE;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("profileJson", generation.toJson(state.getCustomerProfile()));
        variables.put("riskJson", generation.toJson(state.getRiskAssessment()));

        RoundTripResult<CoverageModel> result = generation.generate(
                state, "coverage", variables, CoverageModel.class, CoverageProcessor::defaultCoverage);
        CoverageModel coverage = normalizeKeys(result.value());

        PolicyDraft draft = PolicyDraft.builder()
                .draftId(state.getSessionId())
                .quoteNumber(state.getQuoteNumber())
                .status(PolicyDraftStatus.DRAFT)
                .customerProfile(state.getCustomerProfile())
                .riskAssessment(state.getRiskAssessment())
                .coverage(coverage)
                .build();

        log.info("🛡️ Coverage designed: {} (defaulted: {})", coverage.getCoverages(), result.defaulted());
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.COVERAGE, coverage);
        updates.put(PolicyWorkflowState.POLICY_DRAFT, draft);
        return updates;
    }

    static CoverageModel defaultCoverage() {
        Map<String, Double> limits = new LinkedHashMap<>();
        limits.put("collision", 40000.0);
        limits.put("liability", 100000.0);
        Map<String, Double> deductibles = new LinkedHashMap<>();
        deductibles.put("collision", 1000.0);
        deductibles.put("comprehensive", 500.0);
        return CoverageModel.builder()
                .coverages(new LinkedHashSet<>(List.of("Collision", "Liability", "Comprehensive")))
                .limits(limits)
                .deductibles(deductibles)
                .exclusions(new LinkedHashSet<>(List.of("Wear and Tear")))
                .addOns(new LinkedHashSet<>(List.of("Roadside Assistance")))
                .build();
    }

    /**
     * Limits and deductibles are keyed by lower-case coverage name.
     */
    private CoverageModel normalizeKeys(CoverageModel coverage) {
        coverage.setLimits(lowerCaseKeys(coverage.getLimits()));
        coverage.setDeductibles(lowerCaseKeys(coverage.getDeductibles()));
        if (coverage.getCoverages() == null) coverage.setCoverages(new LinkedHashSet<>());
        if (coverage.getExclusions() == null) coverage.setExclusions(new LinkedHashSet<>());
        if (coverage.getAddOns() == null) coverage.setAddOns(new LinkedHashSet<>());
        return coverage;
    }

    private static Map<String, Double> lowerCaseKeys(Map<String, Double> values) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, value) -> {
                if (key != null && value != null) {
                    normalized.put(key.trim().toLowerCase(Locale.ROOT), value);
                }
            });
        }
        return normalized;
    }
}
