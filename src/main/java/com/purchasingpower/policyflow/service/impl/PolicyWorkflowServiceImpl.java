package com.purchasingpower.policyflow.service.impl;

import com.purchasingpower.policyflow.model.PolicyStatus;
import com.purchasingpower.policyflow.model.WorkflowCheckpoint;
import com.purchasingpower.policyflow.model.dto.PolicyIntakeRequest;
import com.purchasingpower.policyflow.service.PolicyWorkflowService;
import com.purchasingpower.policyflow.workflow.CheckpointStore;
import com.purchasingpower.policyflow.workflow.PolicyWorkflow;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Runs sessions through {@link PolicyWorkflow}.
 *
 * Async sessions are submitted straight to the workflow executor. Until the
 * first checkpoint of such a session is stored, polling answers from a
 * placeholder kept in {@code pendingSessions}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyWorkflowServiceImpl implements PolicyWorkflowService {

    private final PolicyWorkflow policyWorkflow;
    private final CheckpointStore checkpointStore;

    @Qualifier("workflowExecutor")
    private final Executor workflowExecutor;

    private final ConcurrentHashMap<String, WorkflowCheckpoint> pendingSessions = new ConcurrentHashMap<>();

    @Override
    public WorkflowCheckpoint startSession(PolicyIntakeRequest intake) {
        log.info("Starting policy session for {}", intake != null ? intake.getName() : null);
        return policyWorkflow.start(intake).toCheckpoint();
    }

    @Override
    public String startSessionAsync(PolicyIntakeRequest intake) {
        CheckpointStore.SessionKey key = checkpointStore.reserveSession();
        pendingSessions.put(key.sessionId(), WorkflowCheckpoint.builder()
                .id(key.sessionId())
                .quoteNumber(key.quoteNumber())
                .status(PolicyStatus.IN_PROGRESS)
                .lastUpdated(Instant.now())
                .intakeData(intake)
                .build());

        log.info("🚀 Submitting session {} to async executor...", key.sessionId());
        try {
            workflowExecutor.execute(() -> executeSession(intake, key));
        } catch (RuntimeException e) {
            pendingSessions.remove(key.sessionId());
            log.error("❌ Executor rejected session {}: {}", key.sessionId(), e.getMessage());
            throw e;
        }
        return key.sessionId();
    }

    @Override
    public WorkflowCheckpoint resumeSession(String sessionId) {
        log.info("Resuming policy session {}", sessionId);
        return policyWorkflow.resume(sessionId).toCheckpoint();
    }

    @Override
    public Optional<WorkflowCheckpoint> getCheckpoint(String sessionId) {
        Optional<WorkflowCheckpoint> stored = checkpointStore.load(sessionId);
        if (stored.isPresent()) {
            return stored;
        }
        return Optional.ofNullable(pendingSessions.get(sessionId));
    }

    /**
     * Body of an async session, runs on the workflow executor.
     */
    private void executeSession(PolicyIntakeRequest intake, CheckpointStore.SessionKey key) {
        try {
            log.info("🚀 [ASYNC THREAD {}] Executing session: {}", Thread.currentThread().getName(), key.sessionId());
            PolicyWorkflowState result = policyWorkflow.start(intake, key);
            log.info("✅ [ASYNC] Session {} finished with status {}", key.sessionId(), result.getStatus());
        } catch (RuntimeException e) {
            log.error("❌ [ASYNC] Session {} failed", key.sessionId(), e);
        } finally {
            pendingSessions.remove(key.sessionId());
        }
    }
}
