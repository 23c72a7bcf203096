package com.purchasingpower.policyflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.policyflow.model.dto.PolicyIntakeRequest;
import com.purchasingpower.policyflow.model.policy.CoverageModel;
import com.purchasingpower.policyflow.model.policy.CustomerProfile;
import com.purchasingpower.policyflow.model.policy.InternalApproval;
import com.purchasingpower.policyflow.model.policy.IssuanceDetails;
import com.purchasingpower.policyflow.model.policy.MonitoringDetails;
import com.purchasingpower.policyflow.model.policy.PolicyDraft;
import com.purchasingpower.policyflow.model.policy.PolicySummary;
import com.purchasingpower.policyflow.model.policy.PricingDetails;
import com.purchasingpower.policyflow.model.policy.RegulatoryReview;
import com.purchasingpower.policyflow.model.policy.RiskAssessment;
import com.purchasingpower.policyflow.model.policy.StageFailure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Cumulative workflow snapshot stored in the drafts collection after every stage.
 *
 * Keyed by {@link #id} (the quote id). Later checkpoints of the same session
 * overwrite earlier ones; none are deleted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowCheckpoint implements Serializable {

    private String id;

    private Long quoteNumber;

    /**
     * Name of the last completed stage, null before the first stage completes.
     */
    private String stage;

    private Instant lastUpdated;

    private PolicyStatus status;

    private CustomerProfile customerProfile;

    private RiskAssessment riskInfo;

    private CoverageModel coverage;

    private PolicyDraft policyDraft;

    private String policyDocument;

    private PricingDetails pricing;

    private String quoteDetails;

    private String presentation;

    private InternalApproval internalApproval;

    private RegulatoryReview regulatoryReview;

    private IssuanceDetails issuance;

    private MonitoringDetails monitoring;

    private PolicySummary summary;

    private String ineligibilityReason;

    /**
     * Set when internal approval or regulatory review refused the quote.
     */
    private String declineReason;

    private StageFailure failure;

    private PolicyIntakeRequest intakeData;
}
