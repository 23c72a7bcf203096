package com.purchasingpower.policyflow.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.policyflow.model.policy.DrivingHistory;
import com.purchasingpower.policyflow.model.policy.VehicleInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for starting a policy workflow.
 *
 * Structured fields are optional; the intake and profile stages ask the
 * generation service to fill gaps from {@link #notes}. Underwriting answers
 * given here take precedence over generated ones.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicyIntakeRequest implements Serializable {
    private String name;
    private String dateOfBirth;
    private String address;
    private String phone;
    private String email;
    private VehicleInfo vehicle;
    private DrivingHistory drivingHistory;
    @Builder.Default
    private List<String> coveragePreferences = new ArrayList<>();
    @Builder.Default
    private Map<String, String> underwritingAnswers = new LinkedHashMap<>();

    /**
     * Free-form customer statement.
     */
    private String notes;
}
