package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.model.policy.MonitoringDetails;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class MonitoringProcessor implements StageProcessor {

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.MONITORING;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("issuanceJson", generation.toJson(state.getIssuance()));
        variables.put("profileJson", generation.toJson(state.getCustomerProfile()));

        RoundTripResult<MonitoringDetails> result = generation.generate(
                state, "monitoring", variables, MonitoringDetails.class,
                () -> MonitoringDetails.builder().monitoringStatus("Active").build());

        log.info("🔭 Monitoring set up: {} (defaulted: {})", result.value().getMonitoringStatus(), result.defaulted());
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.MONITORING, result.value());
        return updates;
    }
}
