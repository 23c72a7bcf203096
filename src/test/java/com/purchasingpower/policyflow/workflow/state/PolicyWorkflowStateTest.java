package com.purchasingpower.policyflow.workflow.state;

import com.purchasingpower.policyflow.model.PolicyStatus;
import com.purchasingpower.policyflow.model.WorkflowCheckpoint;
import com.purchasingpower.policyflow.model.policy.InternalApproval;
import com.purchasingpower.policyflow.model.policy.IssuanceDetails;
import com.purchasingpower.policyflow.model.policy.RegulatoryReview;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Policy Workflow State Tests")
class PolicyWorkflowStateTest {

    @Test
    @DisplayName("Should derive status from the artifacts collected so far")
    void progressStatus_ShouldFollowArtifacts() {
        PolicyWorkflowState state = PolicyWorkflowState.builder().sessionId("QUOTE100000").build();
        assertThat(state.progressStatus()).isEqualTo(PolicyStatus.IN_PROGRESS);

        PolicyWorkflowState quoted = state.with(Map.of(PolicyWorkflowState.QUOTE_DETAILS, "Quote ready"));
        assertThat(quoted.progressStatus()).isEqualTo(PolicyStatus.DRAFT);

        PolicyWorkflowState issued = quoted.with(Map.of(PolicyWorkflowState.ISSUANCE,
                IssuanceDetails.builder().policyNumber("MV100000").build()));
        assertThat(issued.progressStatus()).isEqualTo(PolicyStatus.ACTIVE);
    }

    @Test
    @DisplayName("Should remove keys whose update value is null")
    void with_NullValue_ShouldRemoveKey() {
        // Given
        PolicyWorkflowState state = PolicyWorkflowState.builder()
                .sessionId("QUOTE100000")
                .status(PolicyStatus.ERROR)
                .build();
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.STATUS, null);

        // When
        PolicyWorkflowState updated = state.with(updates);

        // Then
        assertThat(updated.getStatus()).isNull();
        assertThat(updated.getSessionId()).isEqualTo("QUOTE100000");
        assertThat(state.getStatus()).isEqualTo(PolicyStatus.ERROR);
    }

    @Test
    @DisplayName("Should read artifacts stored as plain maps")
    void getters_MapValues_ShouldConvert() {
        // Given
        Map<String, Object> risk = new LinkedHashMap<>();
        risk.put("riskScore", 4.2);
        Map<String, Object> data = new HashMap<>();
        data.put(PolicyWorkflowState.RISK_INFO, risk);
        data.put(PolicyWorkflowState.STATUS, "Draft");
        data.put(PolicyWorkflowState.QUOTE_NUMBER, "100010");

        // When
        PolicyWorkflowState state = new PolicyWorkflowState(data);

        // Then
        assertThat(state.getRiskAssessment().getRiskScore()).isEqualTo(4.2);
        assertThat(state.getStatus()).isEqualTo(PolicyStatus.DRAFT);
        assertThat(state.getQuoteNumber()).isEqualTo(100010L);
    }

    @Test
    @DisplayName("Should rebuild the same checkpoint from a state made from it")
    void fromCheckpoint_ShouldRoundTripFields() {
        // Given
        WorkflowCheckpoint checkpoint = WorkflowCheckpoint.builder()
                .id("QUOTE100020")
                .quoteNumber(100020L)
                .stage("pricing")
                .status(PolicyStatus.IN_PROGRESS)
                .policyDocument("Standard policy language.")
                .build();

        // When
        WorkflowCheckpoint rebuilt = PolicyWorkflowState.fromCheckpoint(checkpoint).toCheckpoint();

        // Then
        assertThat(rebuilt).isEqualTo(checkpoint);
    }

    @Test
    @DisplayName("Should carry review verdicts and the decline reason through a checkpoint")
    void fromCheckpoint_DeclinedSession_ShouldKeepReviewFields() {
        // Given
        WorkflowCheckpoint checkpoint = WorkflowCheckpoint.builder()
                .id("QUOTE100030")
                .quoteNumber(100030L)
                .stage("approval")
                .status(PolicyStatus.DECLINED)
                .presentation("Your package at a glance.")
                .internalApproval(InternalApproval.builder().approved(false).reasons(List.of("Outside appetite")).build())
                .regulatoryReview(RegulatoryReview.builder().compliance(true).issues(List.of()).build())
                .declineReason("Declined: internal approval refused (Outside appetite)")
                .build();

        // When
        PolicyWorkflowState state = PolicyWorkflowState.fromCheckpoint(checkpoint);

        // Then
        assertThat(state.getInternalApproval().getApproved()).isFalse();
        assertThat(state.getDeclineReason()).contains("Outside appetite");
        assertThat(state.toCheckpoint()).isEqualTo(checkpoint);
    }
}
