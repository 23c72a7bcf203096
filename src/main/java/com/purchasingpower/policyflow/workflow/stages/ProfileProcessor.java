package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.model.dto.PolicyIntakeRequest;
import com.purchasingpower.policyflow.model.policy.CustomerProfile;
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
 * Adds vehicle, driving history and coverage preferences to the profile.
 * Values already on the profile or in the payload are never replaced.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProfileProcessor implements StageProcessor {

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.PROFILE;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        CustomerProfile current = state.getCustomerProfile() != null
                ? state.getCustomerProfile()
                : new CustomerProfile();
        PolicyIntakeRequest intake = state.getIntake() != null ? state.getIntake() : new PolicyIntakeRequest();
        CustomerProfile fromPayload = CustomerProfile.builder()
                .vehicle(intake.getVehicle())
                .drivingHistory(intake.getDrivingHistory())
                .coveragePreferences(intake.getCoveragePreferences() != null
                        ? new ArrayList<>(intake.getCoveragePreferences())
                        : new ArrayList<>())
                .build();

        Map<String, Object> variables = new HashMap<>();
        variables.put("profileJson", generation.toJson(current.enrichedWith(fromPayload)));
        variables.put("notes", intake.getNotes() != null ? intake.getNotes() : "");

        RoundTripResult<CustomerProfile> result = generation.generate(
                state, "profile", variables, CustomerProfile.class, () -> fromPayload);

        CustomerProfile generated = result.value();
        if (generated != null) {
            // Eligibility belongs to the gate
            generated.setEligible(null);
            generated.setEligibilityReason(null);
        }
        CustomerProfile enriched = current.enrichedWith(fromPayload).enrichedWith(generated);

        log.info("👤 Profile enriched for {}: vehicle={}, history={}", enriched.getName(),
                enriched.getVehicle() != null, enriched.getDrivingHistory() != null);
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.CUSTOMER_PROFILE, enriched);
        return updates;
    }
}
