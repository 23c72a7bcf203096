package com.purchasingpower.policyflow.service;

import com.purchasingpower.policyflow.model.WorkflowCheckpoint;
import com.purchasingpower.policyflow.model.dto.PolicyIntakeRequest;

import java.util.Optional;

/**
 * Lifecycle of policy workflow sessions: start, resume and inspect.
 */
public interface PolicyWorkflowService {

    /**
     * Run a new session to completion (or until it halts) on the calling thread.
     *
     * @return the checkpoint written by the last stage that ran
     */
    WorkflowCheckpoint startSession(PolicyIntakeRequest intake);

    /**
     * Reserve a session id and run the session on the workflow executor.
     *
     * @return the reserved session id, usable for polling right away
     */
    String startSessionAsync(PolicyIntakeRequest intake);

    /**
     * Continue a stored session.
     *
     * @throws com.purchasingpower.policyflow.exception.SessionNotFoundException if the session does not exist
     */
    WorkflowCheckpoint resumeSession(String sessionId);

    /**
     * Latest checkpoint of a session, including sessions still running asynchronously.
     */
    Optional<WorkflowCheckpoint> getCheckpoint(String sessionId);
}
