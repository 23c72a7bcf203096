package com.purchasingpower.policyflow.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class WorkflowProperties {

    /**
     * Answer that trips the eligibility gate on a mandatory question. Compared case-insensitively.
     */
    @NotBlank
    private String negativeAnswer = "No";

    @Min(1)
    private int policyTermDays = 365;
}
