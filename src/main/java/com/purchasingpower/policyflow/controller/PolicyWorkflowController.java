package com.purchasingpower.policyflow.controller;

import com.purchasingpower.policyflow.exception.SessionNotFoundException;
import com.purchasingpower.policyflow.model.WorkflowCheckpoint;
import com.purchasingpower.policyflow.model.dto.PolicyIntakeRequest;
import com.purchasingpower.policyflow.model.dto.PolicyWorkflowResponse;
import com.purchasingpower.policyflow.model.policy.UnderwritingQuestion;
import com.purchasingpower.policyflow.service.PolicyWorkflowService;
import com.purchasingpower.policyflow.service.UnderwritingQuestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for policy workflow sessions.
 *
 * Sessions that stop as Ineligible, Declined or Error are still answered with 200:
 * the outcome is in {@code status}, and Error carries the correlation id.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class PolicyWorkflowController {

    private final PolicyWorkflowService workflowService;
    private final UnderwritingQuestionService questionService;

    /**
     * Run a session to completion and return its final checkpoint.
     */
    @PostMapping("/policies")
    public ResponseEntity<PolicyWorkflowResponse> startPolicy(@RequestBody PolicyIntakeRequest request) {
        try {
            WorkflowCheckpoint checkpoint = workflowService.startSession(request);
            return ResponseEntity.ok(PolicyWorkflowResponse.fromCheckpoint(checkpoint));
        } catch (Exception e) {
            log.error("Failed to run policy workflow", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(PolicyWorkflowResponse.error(e.getMessage()));
        }
    }

    /**
     * Start a session in the background. Returns 202 with the session id to poll.
     */
    @PostMapping("/policies/async")
    public ResponseEntity<PolicyWorkflowResponse> startPolicyAsync(@RequestBody PolicyIntakeRequest request) {
        try {
            String sessionId = workflowService.startSessionAsync(request);
            return ResponseEntity.accepted().body(PolicyWorkflowResponse.accepted(sessionId));
        } catch (Exception e) {
            log.error("Failed to start policy workflow", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(PolicyWorkflowResponse.error(e.getMessage()));
        }
    }

    @PostMapping("/policies/{sessionId}/resume")
    public ResponseEntity<PolicyWorkflowResponse> resumePolicy(@PathVariable String sessionId) {
        try {
            WorkflowCheckpoint checkpoint = workflowService.resumeSession(sessionId);
            return ResponseEntity.ok(PolicyWorkflowResponse.fromCheckpoint(checkpoint));
        } catch (SessionNotFoundException e) {
            log.warn("Resume requested for unknown session {}", sessionId);
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("Failed to resume session {}", sessionId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(PolicyWorkflowResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/policies/{sessionId}")
    public ResponseEntity<PolicyWorkflowResponse> getPolicy(@PathVariable String sessionId) {
        return workflowService.getCheckpoint(sessionId)
                .map(checkpoint -> ResponseEntity.ok(PolicyWorkflowResponse.fromCheckpoint(checkpoint)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/underwriting/questions")
    public ResponseEntity<List<UnderwritingQuestion>> getUnderwritingQuestions() {
        return ResponseEntity.ok(questionService.getQuestions());
    }
}
