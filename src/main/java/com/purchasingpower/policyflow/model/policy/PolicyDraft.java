package com.purchasingpower.policyflow.model.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Policy record created once coverage is designed.
 *
 * {@code draftId} is the quote id and never changes. The issued
 * {@code policyNumber} is derived from the same {@code quoteNumber}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicyDraft implements Serializable {

    private String draftId;

    private Long quoteNumber;

    private String policyNumber;

    private PolicyDraftStatus status;

    private CustomerProfile customerProfile;

    private RiskAssessment riskAssessment;

    private CoverageModel coverage;

    private Double finalPremium;
}
