package com.purchasingpower.policyflow.workflow.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Decision recorded after a stage, used by the graph for conditional routing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageDecision implements Serializable {

    private NextStep nextStep;

    /**
     * Stage that produced this decision.
     */
    private String stage;

    private String message;

    public enum NextStep {
        PROCEED,      // Continue with the next stage
        INELIGIBLE,   // Eligibility gate tripped, stop
        DECLINED,     // Approval or regulatory review refused, stop
        ERROR,        // Stage failed, stop; the session can be resumed
        COMPLETE      // Last stage done
    }

    public boolean isProceed() {
        return nextStep == NextStep.PROCEED;
    }

    public static StageDecision proceed(String stage) {
        return StageDecision.builder()
                .nextStep(NextStep.PROCEED)
                .stage(stage)
                .message("Stage " + stage + " completed")
                .build();
    }

    public static StageDecision complete(String stage) {
        return StageDecision.builder()
                .nextStep(NextStep.COMPLETE)
                .stage(stage)
                .message("Workflow completed")
                .build();
    }

    public static StageDecision ineligible(String stage, String reason) {
        return StageDecision.builder()
                .nextStep(NextStep.INELIGIBLE)
                .stage(stage)
                .message(reason)
                .build();
    }

    public static StageDecision declined(String stage, String reason) {
        return StageDecision.builder()
                .nextStep(NextStep.DECLINED)
                .stage(stage)
                .message(reason)
                .build();
    }

    public static StageDecision error(String stage, String message) {
        return StageDecision.builder()
                .nextStep(NextStep.ERROR)
                .stage(stage)
                .message(message)
                .build();
    }
}
