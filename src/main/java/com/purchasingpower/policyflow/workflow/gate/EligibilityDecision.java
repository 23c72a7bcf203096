package com.purchasingpower.policyflow.workflow.gate;

import java.util.List;

/**
 * Outcome of the eligibility gate. {@code reason} is set when not eligible.
 */
public record EligibilityDecision(boolean eligible, String reason, List<String> failedQuestionIds) {

    public static EligibilityDecision passed() {
        return new EligibilityDecision(true, null, List.of());
    }

    public static EligibilityDecision failed(String reason, List<String> failedQuestionIds) {
        return new EligibilityDecision(false, reason, List.copyOf(failedQuestionIds));
    }
}
