package com.purchasingpower.policyflow.workflow.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.policyflow.model.PolicyStatus;
import com.purchasingpower.policyflow.model.WorkflowCheckpoint;
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
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.state.AgentState;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Graph state for the policy workflow.
 *
 * Keys mirror the {@link WorkflowCheckpoint} fields so a checkpoint can be
 * turned back into a state on resume. Getters handle values that arrive as
 * LinkedHashMap after a checkpoint round trip through the document store.
 */
@Slf4j
public class PolicyWorkflowState extends AgentState {

    public static final String SESSION_ID = "sessionId";
    public static final String QUOTE_NUMBER = "quoteNumber";
    public static final String INTAKE = "intakeData";
    public static final String CUSTOMER_PROFILE = "customerProfile";
    public static final String RISK_INFO = "riskInfo";
    public static final String COVERAGE = "coverage";
    public static final String POLICY_DRAFT = "policyDraft";
    public static final String POLICY_DOCUMENT = "policyDocument";
    public static final String PRICING = "pricing";
    public static final String QUOTE_DETAILS = "quoteDetails";
    public static final String PRESENTATION = "presentation";
    public static final String INTERNAL_APPROVAL = "internalApproval";
    public static final String REGULATORY_REVIEW = "regulatoryReview";
    public static final String ISSUANCE = "issuance";
    public static final String MONITORING = "monitoring";
    public static final String SUMMARY = "summary";
    public static final String STATUS = "status";
    public static final String STAGE = "stage";
    public static final String LAST_UPDATED = "lastUpdated";
    public static final String INELIGIBILITY_REASON = "ineligibilityReason";
    public static final String DECLINE_REASON = "declineReason";
    public static final String FAILURE = "failure";
    public static final String LAST_DECISION = "lastDecision";
    public static final String RESUME_FROM = "resumeFrom";

    private static final ObjectMapper objectMapper = createObjectMapper();

    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public PolicyWorkflowState(Map<String, Object> initData) {
        super(initData);
    }

    // ================================================================
    // SIMPLE GETTERS
    // ================================================================

    public String getSessionId() {
        return this.<String>value(SESSION_ID).orElse(null);
    }

    public Long getQuoteNumber() {
        Object value = value(QUOTE_NUMBER).orElse(null);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            return Long.parseLong((String) value);
        }
        return null;
    }

    /**
     * Name of the last completed stage.
     */
    public String getStage() {
        return this.<String>value(STAGE).orElse(null);
    }

    public String getResumeFrom() {
        return this.<String>value(RESUME_FROM).orElse(null);
    }

    public String getPolicyDocument() {
        return this.<String>value(POLICY_DOCUMENT).orElse(null);
    }

    public String getQuoteDetails() {
        return this.<String>value(QUOTE_DETAILS).orElse(null);
    }

    public String getPresentation() {
        return this.<String>value(PRESENTATION).orElse(null);
    }

    public String getIneligibilityReason() {
        return this.<String>value(INELIGIBILITY_REASON).orElse(null);
    }

    public String getDeclineReason() {
        return this.<String>value(DECLINE_REASON).orElse(null);
    }

    public PolicyStatus getStatus() {
        Object value = value(STATUS).orElse(null);
        if (value instanceof PolicyStatus) {
            return (PolicyStatus) value;
        }
        if (value instanceof String) {
            return PolicyStatus.fromLabel((String) value);
        }
        return null;
    }

    public Instant getLastUpdated() {
        return convertValue(LAST_UPDATED, Instant.class);
    }

    // ================================================================
    // ARTIFACT GETTERS
    // ================================================================

    public PolicyIntakeRequest getIntake() {
        return convertValue(INTAKE, PolicyIntakeRequest.class);
    }

    public CustomerProfile getCustomerProfile() {
        return convertValue(CUSTOMER_PROFILE, CustomerProfile.class);
    }

    public RiskAssessment getRiskAssessment() {
        return convertValue(RISK_INFO, RiskAssessment.class);
    }

    public CoverageModel getCoverage() {
        return convertValue(COVERAGE, CoverageModel.class);
    }

    public PolicyDraft getPolicyDraft() {
        return convertValue(POLICY_DRAFT, PolicyDraft.class);
    }

    public PricingDetails getPricing() {
        return convertValue(PRICING, PricingDetails.class);
    }

    public InternalApproval getInternalApproval() {
        return convertValue(INTERNAL_APPROVAL, InternalApproval.class);
    }

    public RegulatoryReview getRegulatoryReview() {
        return convertValue(REGULATORY_REVIEW, RegulatoryReview.class);
    }

    public IssuanceDetails getIssuance() {
        return convertValue(ISSUANCE, IssuanceDetails.class);
    }

    public MonitoringDetails getMonitoring() {
        return convertValue(MONITORING, MonitoringDetails.class);
    }

    public PolicySummary getSummary() {
        return convertValue(SUMMARY, PolicySummary.class);
    }

    public StageFailure getFailure() {
        return convertValue(FAILURE, StageFailure.class);
    }

    public StageDecision getLastDecision() {
        return convertValue(LAST_DECISION, StageDecision.class);
    }

    // ================================================================
    // CONVENIENCE METHODS
    // ================================================================

    /**
     * Status implied by the artifacts collected so far: Active once issued,
     * Draft once quoted, otherwise InProgress.
     */
    public PolicyStatus progressStatus() {
        if (getIssuance() != null) {
            return PolicyStatus.ACTIVE;
        }
        if (getQuoteDetails() != null) {
            return PolicyStatus.DRAFT;
        }
        return PolicyStatus.IN_PROGRESS;
    }

    /**
     * New state with {@code updates} applied over this one. Null update values remove the key.
     */
    public PolicyWorkflowState with(Map<String, Object> updates) {
        Map<String, Object> merged = new HashMap<>(data());
        updates.forEach((key, value) -> {
            if (value == null) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        });
        return new PolicyWorkflowState(merged);
    }

    public WorkflowCheckpoint toCheckpoint() {
        return WorkflowCheckpoint.builder()
                .id(getSessionId())
                .quoteNumber(getQuoteNumber())
                .stage(getStage())
                .lastUpdated(getLastUpdated())
                .status(getStatus())
                .customerProfile(getCustomerProfile())
                .riskInfo(getRiskAssessment())
                .coverage(getCoverage())
                .policyDraft(getPolicyDraft())
                .policyDocument(getPolicyDocument())
                .pricing(getPricing())
                .quoteDetails(getQuoteDetails())
                .presentation(getPresentation())
                .internalApproval(getInternalApproval())
                .regulatoryReview(getRegulatoryReview())
                .issuance(getIssuance())
                .monitoring(getMonitoring())
                .summary(getSummary())
                .ineligibilityReason(getIneligibilityReason())
                .declineReason(getDeclineReason())
                .failure(getFailure())
                .intakeData(getIntake())
                .build();
    }

    public static PolicyWorkflowState fromCheckpoint(WorkflowCheckpoint checkpoint) {
        Map<String, Object> data = new HashMap<>();
        putIfPresent(data, SESSION_ID, checkpoint.getId());
        putIfPresent(data, QUOTE_NUMBER, checkpoint.getQuoteNumber());
        putIfPresent(data, STAGE, checkpoint.getStage());
        putIfPresent(data, LAST_UPDATED, checkpoint.getLastUpdated());
        putIfPresent(data, STATUS, checkpoint.getStatus());
        putIfPresent(data, CUSTOMER_PROFILE, checkpoint.getCustomerProfile());
        putIfPresent(data, RISK_INFO, checkpoint.getRiskInfo());
        putIfPresent(data, COVERAGE, checkpoint.getCoverage());
        putIfPresent(data, POLICY_DRAFT, checkpoint.getPolicyDraft());
        putIfPresent(data, POLICY_DOCUMENT, checkpoint.getPolicyDocument());
        putIfPresent(data, PRICING, checkpoint.getPricing());
        putIfPresent(data, QUOTE_DETAILS, checkpoint.getQuoteDetails());
        putIfPresent(data, PRESENTATION, checkpoint.getPresentation());
        putIfPresent(data, INTERNAL_APPROVAL, checkpoint.getInternalApproval());
        putIfPresent(data, REGULATORY_REVIEW, checkpoint.getRegulatoryReview());
        putIfPresent(data, ISSUANCE, checkpoint.getIssuance());
        putIfPresent(data, MONITORING, checkpoint.getMonitoring());
        putIfPresent(data, SUMMARY, checkpoint.getSummary());
        putIfPresent(data, INELIGIBILITY_REASON, checkpoint.getIneligibilityReason());
        putIfPresent(data, DECLINE_REASON, checkpoint.getDeclineReason());
        putIfPresent(data, FAILURE, checkpoint.getFailure());
        putIfPresent(data, INTAKE, checkpoint.getIntakeData());
        return new PolicyWorkflowState(data);
    }

    public Map<String, Object> toMap() {
        return new HashMap<>(data());
    }

    private static void putIfPresent(Map<String, Object> data, String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
    }

    /**
     * Typed read of a state value that may be stored as its own type or as a Map.
     */
    private <T> T convertValue(String key, Class<T> type) {
        Object obj = value(key).orElse(null);
        if (obj == null) {
            return null;
        }
        if (type.isInstance(obj)) {
            return type.cast(obj);
        }
        try {
            return objectMapper.convertValue(obj, type);
        } catch (IllegalArgumentException e) {
            log.warn("State value '{}' is not a valid {}: {}", key, type.getSimpleName(), e.getMessage());
            return null;
        }
    }

    // ================================================================
    // BUILDER
    // ================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final HashMap<String, Object> data = new HashMap<>();

        public Builder sessionId(String sessionId) { putIfPresent(data, SESSION_ID, sessionId); return this; }
        public Builder quoteNumber(Long quoteNumber) { putIfPresent(data, QUOTE_NUMBER, quoteNumber); return this; }
        public Builder intake(PolicyIntakeRequest intake) { putIfPresent(data, INTAKE, intake); return this; }
        public Builder status(PolicyStatus status) { putIfPresent(data, STATUS, status); return this; }
        public Builder resumeFrom(String stage) { putIfPresent(data, RESUME_FROM, stage); return this; }

        public PolicyWorkflowState build() {
            return new PolicyWorkflowState(data);
        }
    }
}
