package com.purchasingpower.policyflow.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.policyflow.model.WorkflowCheckpoint;
import com.purchasingpower.policyflow.model.policy.StageFailure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for policy workflow endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicyWorkflowResponse {
    private boolean success;
    private String sessionId;
    private String status;
    private String stage;
    private String message;
    private String error;
    private String correlationId;
    private WorkflowCheckpoint checkpoint;

    public static PolicyWorkflowResponse fromCheckpoint(WorkflowCheckpoint checkpoint) {
        StageFailure failure = checkpoint.getFailure();
        return PolicyWorkflowResponse.builder()
                .success(true)
                .sessionId(checkpoint.getId())
                .status(checkpoint.getStatus() != null ? checkpoint.getStatus().getLabel() : null)
                .stage(checkpoint.getStage())
                .message(describe(checkpoint))
                .correlationId(failure != null ? failure.getCorrelationId() : null)
                .checkpoint(checkpoint)
                .build();
    }

    public static PolicyWorkflowResponse accepted(String sessionId) {
        return PolicyWorkflowResponse.builder()
                .success(true)
                .sessionId(sessionId)
                .status("InProgress")
                .message("Policy workflow accepted. Poll the session for progress.")
                .build();
    }

    public static PolicyWorkflowResponse error(String error) {
        return PolicyWorkflowResponse.builder()
                .success(false)
                .error(error)
                .build();
    }

    private static String describe(WorkflowCheckpoint checkpoint) {
        if (checkpoint.getStatus() == null) {
            return null;
        }
        switch (checkpoint.getStatus()) {
            case ACTIVE:
                return checkpoint.getIssuance() != null
                        ? "Policy " + checkpoint.getIssuance().getPolicyNumber() + " issued"
                        : "Policy issued";
            case INELIGIBLE:
                return checkpoint.getIneligibilityReason();
            case DECLINED:
                return checkpoint.getDeclineReason();
            case ERROR:
                return checkpoint.getFailure() != null ? checkpoint.getFailure().getMessage() : "Workflow failed";
            case DRAFT:
                return checkpoint.getQuoteDetails();
            default:
                return "Completed stage: " + checkpoint.getStage();
        }
    }
}
