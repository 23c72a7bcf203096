package com.purchasingpower.policyflow.workflow.gate;

/**
 * Outcome of the approval gate. {@code reason} is set when declined.
 */
public record ApprovalDecision(boolean approved, String reason) {

    public static ApprovalDecision passed() {
        return new ApprovalDecision(true, null);
    }

    public static ApprovalDecision declined(String reason) {
        return new ApprovalDecision(false, reason);
    }
}
