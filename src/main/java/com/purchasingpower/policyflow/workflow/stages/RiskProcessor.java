package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.model.policy.RiskAssessment;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class RiskProcessor implements StageProcessor {

    static final double DEFAULT_RISK_SCORE = 5.0;

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.RISK;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("profileJson", generation.toJson(state.getCustomerProfile()));

        RoundTripResult<RiskAssessment> result = generation.generate(
                state, "risk", variables, RiskAssessment.class, RiskProcessor::defaultAssessment);

        RiskAssessment risk = result.value();
        if (risk.getRiskFactors() == null) {
            risk.setRiskFactors(new ArrayList<>());
        }
        log.info("⚖️ Risk score {} ({} factors, defaulted: {})",
                risk.getRiskScore(), risk.getRiskFactors().size(), result.defaulted());

        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.RISK_INFO, risk);
        return updates;
    }

    static RiskAssessment defaultAssessment() {
        return RiskAssessment.builder()
                .riskScore(DEFAULT_RISK_SCORE)
                .riskFactors(new ArrayList<>(List.of("Default risk assessment")))
                .build();
    }
}
