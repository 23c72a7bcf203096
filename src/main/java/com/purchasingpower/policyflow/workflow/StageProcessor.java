package com.purchasingpower.policyflow.workflow;

import com.purchasingpower.policyflow.exception.StageValidationException;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;

import java.util.Map;

/**
 * One workflow stage: reads prior artifacts from the state and returns the
 * state updates holding its own artifact.
 *
 * Implementations recover from unusable generation output with their stage
 * default. They throw {@link StageValidationException} only when the
 * artifact cannot be used by the next stage even after that.
 */
public interface StageProcessor {

    WorkflowStage getStage();

    Map<String, Object> execute(PolicyWorkflowState state);
}
