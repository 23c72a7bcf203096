package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.exception.StageValidationException;
import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.model.dto.PolicyIntakeRequest;
import com.purchasingpower.policyflow.model.policy.CustomerProfile;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the basic customer profile from the intake payload.
 *
 * Structured payload fields win over generated ones; generation only fills
 * gaps from the free-form notes. A profile without a name stops the workflow.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntakeProcessor implements StageProcessor {

    private final GenerationSupport generation;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.INTAKE;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        PolicyIntakeRequest intake = state.getIntake() != null ? state.getIntake() : new PolicyIntakeRequest();
        log.info("📝 Collecting intake for {}", intake.getName() != null ? intake.getName() : "unnamed customer");

        CustomerProfile supplied = basicProfile(intake);

        Map<String, Object> variables = new HashMap<>();
        variables.put("intakeJson", generation.toJson(intake));
        variables.put("notes", intake.getNotes() != null ? intake.getNotes() : "");

        RoundTripResult<CustomerProfile> result = generation.generate(
                state, "intake", variables, CustomerProfile.class, () -> supplied);

        CustomerProfile profile = supplied.enrichedWith(basicFieldsOf(result.value()));
        if (profile.getName() == null || profile.getName().isBlank()) {
            throw new StageValidationException(getStage().getStageName(), "Customer name is missing from the intake data");
        }

        log.info("✅ Intake complete for {} (defaulted: {})", profile.getName(), result.defaulted());
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.CUSTOMER_PROFILE, profile);
        return updates;
    }

    private CustomerProfile basicProfile(PolicyIntakeRequest intake) {
        return CustomerProfile.builder()
                .name(intake.getName())
                .dateOfBirth(intake.getDateOfBirth())
                .address(intake.getAddress())
                .phone(intake.getPhone())
                .email(intake.getEmail())
                .underwritingAnswers(intake.getUnderwritingAnswers() != null
                        ? new LinkedHashMap<>(intake.getUnderwritingAnswers())
                        : new LinkedHashMap<>())
                .build();
    }

    /**
     * Intake only owns contact data; the rest is left to profiling and underwriting.
     */
    private CustomerProfile basicFieldsOf(CustomerProfile generated) {
        if (generated == null) {
            return null;
        }
        return CustomerProfile.builder()
                .name(generated.getName())
                .dateOfBirth(generated.getDateOfBirth())
                .address(generated.getAddress())
                .phone(generated.getPhone())
                .email(generated.getEmail())
                .build();
    }
}
