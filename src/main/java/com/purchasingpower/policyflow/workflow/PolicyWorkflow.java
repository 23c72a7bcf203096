package com.purchasingpower.policyflow.workflow;

import com.purchasingpower.policyflow.exception.SessionNotFoundException;
import com.purchasingpower.policyflow.exception.StageValidationException;
import com.purchasingpower.policyflow.model.PolicyStatus;
import com.purchasingpower.policyflow.model.WorkflowCheckpoint;
import com.purchasingpower.policyflow.model.dto.PolicyIntakeRequest;
import com.purchasingpower.policyflow.model.policy.CustomerProfile;
import com.purchasingpower.policyflow.model.policy.PolicyDraft;
import com.purchasingpower.policyflow.model.policy.PolicyDraftStatus;
import com.purchasingpower.policyflow.model.policy.StageFailure;
import com.purchasingpower.policyflow.workflow.gate.ApprovalDecision;
import com.purchasingpower.policyflow.workflow.gate.ApprovalGate;
import com.purchasingpower.policyflow.workflow.gate.EligibilityDecision;
import com.purchasingpower.policyflow.workflow.gate.EligibilityGate;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import com.purchasingpower.policyflow.workflow.state.StageDecision;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Runs the policy stages as a graph, one node per stage in fixed order.
 *
 * <p>Every node writes a checkpoint after it runs, whether it succeeded or
 * failed. A node that fails or trips one of the two gates (eligibility after
 * underwriting, approval before issuance) routes to END, so no later stage
 * runs in that invocation. Resuming re-enters the graph at the
 * stage after the last completed one.
 */
@Slf4j
@Component
public class PolicyWorkflow {

    private static final String NEXT = "next";
    private static final String STOP = "stop";

    private final Map<WorkflowStage, StageProcessor> processors = new EnumMap<>(WorkflowStage.class);
    private final EligibilityGate eligibilityGate;
    private final ApprovalGate approvalGate;
    private final CheckpointStore checkpointStore;

    private CompiledGraph<PolicyWorkflowState> compiledGraph;

    public PolicyWorkflow(List<StageProcessor> stageProcessors,
                          EligibilityGate eligibilityGate,
                          ApprovalGate approvalGate,
                          CheckpointStore checkpointStore) {
        for (StageProcessor processor : stageProcessors) {
            StageProcessor previous = processors.put(processor.getStage(), processor);
            if (previous != null) {
                throw new IllegalStateException("Two processors registered for stage " + processor.getStage()
                        + ": " + previous.getClass().getSimpleName() + " and " + processor.getClass().getSimpleName());
            }
        }
        this.eligibilityGate = eligibilityGate;
        this.approvalGate = approvalGate;
        this.checkpointStore = checkpointStore;
    }

    @PostConstruct
    public void initialize() throws GraphStateException {
        log.info("🚀 Initializing policy workflow graph...");
        for (WorkflowStage stage : WorkflowStage.values()) {
            if (!processors.containsKey(stage)) {
                throw new IllegalStateException("No processor registered for stage " + stage.getStageName());
            }
        }

        StateGraph<PolicyWorkflowState> graph = new StateGraph<>(PolicyWorkflowState::new);

        for (WorkflowStage stage : WorkflowStage.values()) {
            StageProcessor processor = processors.get(stage);
            graph.addNode(stage.getStageName(), node_async(state -> runStage(processor, state)));
        }

        // Entry point: intake for new sessions, the stored resume stage otherwise
        Map<String, String> entries = new HashMap<>();
        for (WorkflowStage stage : WorkflowStage.values()) {
            entries.put(stage.getStageName(), stage.getStageName());
        }
        graph.addConditionalEdges(START,
                edge_async(state -> WorkflowStage.fromName(state.getResumeFrom())
                        .orElse(WorkflowStage.first())
                        .getStageName()),
                entries);

        for (WorkflowStage stage : WorkflowStage.values()) {
            Optional<WorkflowStage> next = stage.next();
            if (next.isEmpty()) {
                graph.addEdge(stage.getStageName(), END);
                continue;
            }
            graph.addConditionalEdges(stage.getStageName(),
                    edge_async(this::route),
                    Map.of(NEXT, next.get().getStageName(), STOP, END));
        }

        this.compiledGraph = graph.compile();
        log.info("✅ Policy workflow graph ready with {} stages", processors.size());
    }

    /**
     * Run a new session from intake to the final summary (or until it halts).
     */
    public PolicyWorkflowState start(PolicyIntakeRequest intake) {
        return start(intake, null);
    }

    /**
     * Run a new session under an id reserved beforehand, used by the async path.
     */
    public PolicyWorkflowState start(PolicyIntakeRequest intake, CheckpointStore.SessionKey reserved) {
        PolicyWorkflowState.Builder initial = PolicyWorkflowState.builder()
                .intake(intake != null ? intake : new PolicyIntakeRequest())
                .status(PolicyStatus.IN_PROGRESS)
                .resumeFrom(WorkflowStage.first().getStageName());
        if (reserved != null) {
            initial.sessionId(reserved.sessionId()).quoteNumber(reserved.quoteNumber());
        }
        log.info("🚀 Starting policy workflow{}", reserved != null ? " " + reserved.sessionId() : "");
        return execute(initial.build().toMap());
    }

    /**
     * Continue a stored session from the stage after its last completed stage.
     *
     * <p>Ineligible and declined sessions, and sessions that completed the
     * last stage, are returned unchanged. A session that failed re-runs its
     * failed stage.
     *
     * @throws SessionNotFoundException if no checkpoint exists for the id
     */
    public PolicyWorkflowState resume(String sessionId) {
        WorkflowCheckpoint checkpoint = checkpointStore.load(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        PolicyWorkflowState stored = PolicyWorkflowState.fromCheckpoint(checkpoint);

        if (checkpoint.getStatus() == PolicyStatus.INELIGIBLE || checkpoint.getStatus() == PolicyStatus.DECLINED) {
            log.info("⛔ Session {} is {}, nothing to resume", sessionId, checkpoint.getStatus());
            return stored;
        }

        Optional<WorkflowStage> lastCompleted = WorkflowStage.fromName(checkpoint.getStage());
        Optional<WorkflowStage> resumeFrom = lastCompleted.isPresent()
                ? lastCompleted.get().next()
                : Optional.of(WorkflowStage.first());
        if (resumeFrom.isEmpty()) {
            log.info("🏁 Session {} already completed {}", sessionId, checkpoint.getStage());
            return stored;
        }

        log.info("🔄 Resuming session {} from {} (was {})", sessionId, resumeFrom.get().getStageName(),
                checkpoint.getStatus());
        Map<String, Object> data = stored.toMap();
        data.remove(PolicyWorkflowState.FAILURE);
        data.put(PolicyWorkflowState.STATUS, stored.progressStatus());
        data.put(PolicyWorkflowState.RESUME_FROM, resumeFrom.get().getStageName());
        return execute(data);
    }

    private PolicyWorkflowState execute(Map<String, Object> initialData) {
        try {
            Optional<PolicyWorkflowState> result = compiledGraph.invoke(initialData);
            PolicyWorkflowState finalState = result.orElseGet(() -> new PolicyWorkflowState(initialData));
            log.info("🏁 Workflow {} stopped after {} with status {}",
                    finalState.getSessionId(), finalState.getStage(), finalState.getStatus());
            return finalState;
        } catch (Exception e) {
            // Node failures are caught inside runStage; this is a checkpoint write or graph failure
            String correlationId = UUID.randomUUID().toString();
            log.error("❌ Workflow execution failed [correlationId={}]", correlationId, e);

            Map<String, Object> errorData = new HashMap<>(initialData);
            errorData.put(PolicyWorkflowState.STATUS, PolicyStatus.ERROR);
            errorData.put(PolicyWorkflowState.FAILURE, StageFailure.builder()
                    .correlationId(correlationId)
                    .stage((String) initialData.get(PolicyWorkflowState.RESUME_FROM))
                    .kind(StageFailure.Kind.UNEXPECTED)
                    .message("Workflow execution failed: " + e.getMessage())
                    .occurredAt(Instant.now())
                    .build());
            return new PolicyWorkflowState(errorData);
        }
    }

    /**
     * Node body: run one stage, record its outcome and write the checkpoint.
     */
    Map<String, Object> runStage(StageProcessor processor, PolicyWorkflowState state) {
        WorkflowStage stage = processor.getStage();
        String stageName = stage.getStageName();
        log.info("▶️ [{}] Stage {} started", state.getSessionId(), stageName);

        Map<String, Object> updates = new HashMap<>();
        try {
            Map<String, Object> produced = new HashMap<>(processor.execute(state));
            if (stage == WorkflowStage.UNDERWRITING) {
                applyEligibilityGate(state.with(produced), produced);
            } else if (stage == WorkflowStage.APPROVAL) {
                applyApprovalGate(state.with(produced), produced);
            }
            updates.putAll(produced);
            updates.put(PolicyWorkflowState.STAGE, stageName);
            if (!updates.containsKey(PolicyWorkflowState.LAST_DECISION)) {
                updates.put(PolicyWorkflowState.STATUS, state.with(produced).progressStatus());
                updates.put(PolicyWorkflowState.LAST_DECISION, stage.next().isPresent()
                        ? StageDecision.proceed(stageName)
                        : StageDecision.complete(stageName));
            }
        } catch (StageValidationException e) {
            recordFailure(updates, state, stageName, StageFailure.Kind.VALIDATION, e.getMessage(), e);
        } catch (Exception e) {
            recordFailure(updates, state, stageName, StageFailure.Kind.UNEXPECTED,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        WorkflowCheckpoint checkpoint = checkpointStore.write(state.with(updates));
        updates.put(PolicyWorkflowState.SESSION_ID, checkpoint.getId());
        updates.put(PolicyWorkflowState.QUOTE_NUMBER, checkpoint.getQuoteNumber());
        updates.put(PolicyWorkflowState.LAST_UPDATED, checkpoint.getLastUpdated());
        log.info("⏹️ [{}] Stage {} finished with status {}", checkpoint.getId(), stageName, checkpoint.getStatus());
        return updates;
    }

    private void applyEligibilityGate(PolicyWorkflowState state, Map<String, Object> produced) {
        CustomerProfile profile = state.getCustomerProfile() != null
                ? state.getCustomerProfile()
                : new CustomerProfile();
        EligibilityDecision decision = eligibilityGate.evaluate(profile);
        CustomerProfile decided = profile.toBuilder()
                .eligible(decision.eligible())
                .eligibilityReason(decision.reason())
                .build();
        produced.put(PolicyWorkflowState.CUSTOMER_PROFILE, decided);

        if (!decision.eligible()) {
            produced.put(PolicyWorkflowState.STATUS, PolicyStatus.INELIGIBLE);
            produced.put(PolicyWorkflowState.INELIGIBILITY_REASON, decision.reason());
            produced.put(PolicyWorkflowState.POLICY_DRAFT, PolicyDraft.builder()
                    .draftId(state.getSessionId())
                    .quoteNumber(state.getQuoteNumber())
                    .status(PolicyDraftStatus.INELIGIBLE)
                    .customerProfile(decided)
                    .build());
            produced.put(PolicyWorkflowState.LAST_DECISION,
                    StageDecision.ineligible(WorkflowStage.UNDERWRITING.getStageName(), decision.reason()));
        }
    }

    private void applyApprovalGate(PolicyWorkflowState state, Map<String, Object> produced) {
        ApprovalDecision decision = approvalGate.evaluate(state.getInternalApproval(), state.getRegulatoryReview());
        if (decision.approved()) {
            return;
        }
        PolicyDraft draft = state.getPolicyDraft() != null
                ? state.getPolicyDraft()
                : PolicyDraft.builder().draftId(state.getSessionId()).quoteNumber(state.getQuoteNumber()).build();
        produced.put(PolicyWorkflowState.STATUS, PolicyStatus.DECLINED);
        produced.put(PolicyWorkflowState.DECLINE_REASON, decision.reason());
        produced.put(PolicyWorkflowState.POLICY_DRAFT, draft.toBuilder()
                .status(PolicyDraftStatus.DECLINED)
                .build());
        produced.put(PolicyWorkflowState.LAST_DECISION,
                StageDecision.declined(WorkflowStage.APPROVAL.getStageName(), decision.reason()));
    }

    private void recordFailure(Map<String, Object> updates,
                               PolicyWorkflowState state,
                               String stageName,
                               StageFailure.Kind kind,
                               String message,
                               Exception e) {
        String correlationId = UUID.randomUUID().toString();
        if (kind == StageFailure.Kind.VALIDATION) {
            log.error("❌ [{}] Stage {} failed validation [correlationId={}]: {}",
                    state.getSessionId(), stageName, correlationId, message);
        } else {
            log.error("❌ [{}] Stage {} failed [correlationId={}]", state.getSessionId(), stageName, correlationId, e);
        }

        updates.put(PolicyWorkflowState.STATUS, PolicyStatus.ERROR);
        updates.put(PolicyWorkflowState.FAILURE, StageFailure.builder()
                .correlationId(correlationId)
                .stage(stageName)
                .kind(kind)
                .message(message)
                .occurredAt(Instant.now())
                .build());
        updates.put(PolicyWorkflowState.LAST_DECISION, StageDecision.error(stageName, message));
    }

    private String route(PolicyWorkflowState state) {
        StageDecision decision = state.getLastDecision();
        if (decision != null && decision.isProceed()) {
            return NEXT;
        }
        log.info("🛑 Routing to end after {}: {}", state.getStage(),
                decision != null ? decision.getNextStep() : "no decision");
        return STOP;
    }
}
