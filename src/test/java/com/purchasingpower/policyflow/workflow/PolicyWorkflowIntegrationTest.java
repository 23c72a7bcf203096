package com.purchasingpower.policyflow.workflow;

import com.purchasingpower.policyflow.exception.SessionNotFoundException;
import com.purchasingpower.policyflow.model.PolicyStatus;
import com.purchasingpower.policyflow.model.WorkflowCheckpoint;
import com.purchasingpower.policyflow.model.dto.PolicyIntakeRequest;
import com.purchasingpower.policyflow.model.policy.PolicyDraftStatus;
import com.purchasingpower.policyflow.model.policy.StageFailure;
import com.purchasingpower.policyflow.persistence.PersistenceGateway;
import com.purchasingpower.policyflow.support.ScriptedLLMConfig;
import com.purchasingpower.policyflow.support.ScriptedLLMProvider;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs whole sessions through the graph against the scripted provider and an H2-backed store.
 *
 * Sequence numbers depend on what earlier tests stored, so identifiers are
 * checked against each other rather than against fixed values.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(ScriptedLLMConfig.class)
class PolicyWorkflowIntegrationTest {

    @Autowired
    private PolicyWorkflow policyWorkflow;

    @Autowired
    private CheckpointStore checkpointStore;

    @Autowired
    private PersistenceGateway gateway;

    @Autowired
    private ScriptedLLMProvider provider;

    @BeforeEach
    void setUp() {
        provider.reset();
    }

    private PolicyIntakeRequest intake() {
        return PolicyIntakeRequest.builder()
                .notes("Jane Driver, 2019 Toyota Corolla, wants full coverage")
                .build();
    }

    @Test
    @DisplayName("Should run a new session through every stage and issue the policy")
    void start_HappyPath_ShouldIssuePolicy() {
        // When
        PolicyWorkflowState result = policyWorkflow.start(intake());

        // Then
        assertThat(result.getStatus()).isEqualTo(PolicyStatus.ACTIVE);
        assertThat(result.getStage()).isEqualTo("summary");
        assertThat(result.getFailure()).isNull();

        Long quoteNumber = result.getQuoteNumber();
        assertThat(result.getSessionId()).isEqualTo("QUOTE" + quoteNumber);
        assertThat(result.getCustomerProfile().getName()).isEqualTo("Jane Driver");
        assertThat(result.getCustomerProfile().getEligible()).isTrue();
        assertThat(result.getCustomerProfile().getUnderwritingAnswers())
                .containsEntry("UW-LICENSE", "Yes")
                .containsEntry("UW-RIDESHARE", "No");
        assertThat(result.getRiskAssessment().getRiskScore()).isEqualTo(3.5);
        assertThat(result.getCoverage().getLimits()).containsEntry("collision", 50000.0);
        assertThat(result.getPricing().getFinalPremium()).isEqualTo(980.25);

        String policyNumber = result.getIssuance().getPolicyNumber();
        assertThat(policyNumber).isEqualTo("MV" + quoteNumber);
        assertThat(result.getIssuance().getEndDate())
                .isEqualTo(result.getIssuance().getStartDate().plusDays(365));
        assertThat(result.getPolicyDraft().getStatus()).isEqualTo(PolicyDraftStatus.ACTIVE);
        assertThat(result.getPolicyDraft().getPolicyNumber()).isEqualTo(policyNumber);

        Optional<Map<String, Object>> issued = gateway.findById("PolicyIssued", policyNumber);
        assertThat(issued).isPresent();
        assertThat(issued.get()).containsEntry("quoteId", result.getSessionId());

        assertThat(result.getPresentation()).contains("$980.25");
        assertThat(result.getInternalApproval().getApproved()).isTrue();
        assertThat(result.getRegulatoryReview().getCompliance()).isTrue();
        assertThat(result.getSummary().getPolicyNumber()).isEqualTo(policyNumber);
        assertThat(result.getSummary().getFinalPremium()).isEqualTo(980.25);
        assertThat(result.getSummary().getActivatedDate()).isEqualTo(result.getIssuance().getStartDate());
        assertThat(result.getSummary().getSummary()).contains("Jane Driver");
    }

    @Test
    @DisplayName("Should store a checkpoint that matches the final state")
    void start_HappyPath_ShouldPersistFinalCheckpoint() {
        // When
        PolicyWorkflowState result = policyWorkflow.start(intake());

        // Then
        Optional<WorkflowCheckpoint> stored = checkpointStore.load(result.getSessionId());
        assertThat(stored).isPresent();
        assertThat(stored.get().getStatus()).isEqualTo(PolicyStatus.ACTIVE);
        assertThat(stored.get().getStage()).isEqualTo("summary");
        assertThat(stored.get().getQuoteNumber()).isEqualTo(result.getQuoteNumber());
        assertThat(stored.get().getMonitoring()).isNotNull();
        assertThat(stored.get().getSummary()).isNotNull();
        assertThat(stored.get().getInternalApproval()).isNotNull();
    }

    @Test
    @DisplayName("Should allocate increasing quote numbers for consecutive sessions")
    void start_TwoSessions_ShouldUseDistinctQuoteNumbers() {
        PolicyWorkflowState first = policyWorkflow.start(intake());
        PolicyWorkflowState second = policyWorkflow.start(intake());

        assertThat(second.getQuoteNumber()).isGreaterThan(first.getQuoteNumber());
        assertThat((second.getQuoteNumber() - first.getQuoteNumber()) % 10).isZero();
    }

    @Test
    @DisplayName("Should stop at underwriting when a mandatory answer is No")
    void start_MandatoryNo_ShouldHaltAsIneligible() {
        // Given
        PolicyIntakeRequest request = intake();
        request.setUnderwritingAnswers(Map.of("UW-LICENSE", "No"));

        // When
        PolicyWorkflowState result = policyWorkflow.start(request);

        // Then
        assertThat(result.getStatus()).isEqualTo(PolicyStatus.INELIGIBLE);
        assertThat(result.getStage()).isEqualTo("underwriting");
        assertThat(result.getIneligibilityReason()).contains("UW-LICENSE");
        assertThat(result.getCustomerProfile().getEligible()).isFalse();
        assertThat(result.getPolicyDraft().getStatus()).isEqualTo(PolicyDraftStatus.INELIGIBLE);
        assertThat(provider.callsFor("risk")).isZero();
        assertThat(gateway.findById("PolicyIssued", "MV" + result.getQuoteNumber())).isEmpty();
    }

    @Test
    @DisplayName("Should leave an ineligible session unchanged on resume")
    void resume_IneligibleSession_ShouldNotAdvance() {
        // Given
        PolicyIntakeRequest request = intake();
        request.setUnderwritingAnswers(Map.of("UW-REGISTRATION", "no"));
        String sessionId = policyWorkflow.start(request).getSessionId();

        // When
        PolicyWorkflowState resumed = policyWorkflow.resume(sessionId);

        // Then
        assertThat(resumed.getStatus()).isEqualTo(PolicyStatus.INELIGIBLE);
        assertThat(resumed.getStage()).isEqualTo("underwriting");
        assertThat(provider.callsFor("risk")).isZero();
    }

    @Test
    @DisplayName("Should stop before issuance when internal approval refuses the quote")
    void start_ApprovalRefused_ShouldHaltAsDeclined() {
        // Given
        provider.script("approval", "{\"approved\": false, \"reasons\": [\"Premium below floor\"]}");

        // When
        PolicyWorkflowState result = policyWorkflow.start(intake());

        // Then
        assertThat(result.getStatus()).isEqualTo(PolicyStatus.DECLINED);
        assertThat(result.getStage()).isEqualTo("approval");
        assertThat(result.getDeclineReason()).contains("Premium below floor");
        assertThat(result.getPolicyDraft().getStatus()).isEqualTo(PolicyDraftStatus.DECLINED);
        assertThat(result.getIssuance()).isNull();
        assertThat(provider.callsFor("monitoring")).isZero();
        assertThat(gateway.findById("PolicyIssued", "MV" + result.getQuoteNumber())).isEmpty();

        Optional<WorkflowCheckpoint> stored = checkpointStore.load(result.getSessionId());
        assertThat(stored).isPresent();
        assertThat(stored.get().getStatus()).isEqualTo(PolicyStatus.DECLINED);
        assertThat(stored.get().getDeclineReason()).isEqualTo(result.getDeclineReason());
    }

    @Test
    @DisplayName("Should stop before issuance when regulatory review finds non-compliance")
    void start_RegulatoryNonCompliance_ShouldHaltAsDeclined() {
        // Given
        provider.script("regulatory", "{\"compliance\": false, \"issues\": [\"Missing disclosure\"]}");

        // When
        PolicyWorkflowState result = policyWorkflow.start(intake());

        // Then
        assertThat(result.getStatus()).isEqualTo(PolicyStatus.DECLINED);
        assertThat(result.getStage()).isEqualTo("approval");
        assertThat(result.getDeclineReason()).contains("Missing disclosure");
        assertThat(result.getInternalApproval().getApproved()).isTrue();
        assertThat(result.getIssuance()).isNull();
    }

    @Test
    @DisplayName("Should leave a declined session unchanged on resume")
    void resume_DeclinedSession_ShouldNotAdvance() {
        // Given
        provider.script("approval", "{\"approved\": false, \"reasons\": [\"Outside appetite\"]}");
        String sessionId = policyWorkflow.start(intake()).getSessionId();
        provider.reset();

        // When
        PolicyWorkflowState resumed = policyWorkflow.resume(sessionId);

        // Then
        assertThat(resumed.getStatus()).isEqualTo(PolicyStatus.DECLINED);
        assertThat(resumed.getStage()).isEqualTo("approval");
        assertThat(provider.callsFor("approval")).isZero();
        assertThat(resumed.getIssuance()).isNull();
    }

    @Test
    @DisplayName("Should approve by default when the reviewers are unreachable")
    void start_ReviewOutage_ShouldApproveByDefault() {
        // Given
        provider.failStage("approval").failStage("regulatory").failStage("presentation").failStage("summary");

        // When
        PolicyWorkflowState result = policyWorkflow.start(intake());

        // Then
        assertThat(result.getStatus()).isEqualTo(PolicyStatus.ACTIVE);
        assertThat(result.getPresentation()).isEqualTo("Presentation details unavailable.");
        assertThat(result.getSummary().getPolicyNumber()).isEqualTo(result.getIssuance().getPolicyNumber());
        assertThat(result.getSummary().getSummary()).contains(result.getIssuance().getPolicyNumber());
    }

    @Test
    @DisplayName("Should fall back to the default risk assessment after unusable replies")
    void start_UnusableRiskReplies_ShouldUseDefault() {
        // Given
        provider.script("risk", "no idea", "still no idea", "really no idea");

        // When
        PolicyWorkflowState result = policyWorkflow.start(intake());

        // Then
        assertThat(provider.callsFor("risk")).isEqualTo(3);
        assertThat(result.getRiskAssessment().getRiskScore()).isEqualTo(5.0);
        assertThat(result.getRiskAssessment().getRiskFactors()).containsExactly("Default risk assessment");
        assertThat(result.getStatus()).isEqualTo(PolicyStatus.ACTIVE);
    }

    @Test
    @DisplayName("Should keep going when the provider is down for a stage")
    void start_ProviderOutage_ShouldUseStageDefault() {
        // Given
        provider.failStage("pricing");

        // When
        PolicyWorkflowState result = policyWorkflow.start(intake());

        // Then
        assertThat(result.getStatus()).isEqualTo(PolicyStatus.ACTIVE);
        assertThat(result.getPricing().getFinalPremium()).isEqualTo(825.50);
        assertThat(result.getPolicyDraft().getFinalPremium()).isEqualTo(825.50);
    }

    @Test
    @DisplayName("Should record an error and resume from the failed stage")
    void resume_AfterValidationError_ShouldContinueFromFailedStage() {
        // Given
        provider.script("underwriting", "no idea", "no idea", "no idea");
        PolicyWorkflowState failed = policyWorkflow.start(intake());

        assertThat(failed.getStatus()).isEqualTo(PolicyStatus.ERROR);
        assertThat(failed.getStage()).isEqualTo("profile");
        StageFailure failure = failed.getFailure();
        assertThat(failure.getKind()).isEqualTo(StageFailure.Kind.VALIDATION);
        assertThat(failure.getStage()).isEqualTo("underwriting");
        assertThat(failure.getCorrelationId()).isNotBlank();
        assertThat(provider.callsFor("risk")).isZero();

        // When
        provider.reset();
        PolicyWorkflowState resumed = policyWorkflow.resume(failed.getSessionId());

        // Then
        assertThat(resumed.getStatus()).isEqualTo(PolicyStatus.ACTIVE);
        assertThat(resumed.getSessionId()).isEqualTo(failed.getSessionId());
        assertThat(resumed.getFailure()).isNull();
        assertThat(provider.callsFor("intake")).isZero();
        assertThat(provider.callsFor("profile")).isZero();
        assertThat(provider.callsFor("underwriting")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return a completed session unchanged on resume")
    void resume_CompletedSession_ShouldNotRerunStages() {
        // Given
        PolicyWorkflowState done = policyWorkflow.start(intake());
        provider.reset();

        // When
        PolicyWorkflowState resumed = policyWorkflow.resume(done.getSessionId());

        // Then
        assertThat(resumed.getStatus()).isEqualTo(PolicyStatus.ACTIVE);
        assertThat(resumed.getIssuance().getPolicyNumber()).isEqualTo(done.getIssuance().getPolicyNumber());
        assertThat(provider.callsFor("monitoring")).isZero();
        assertThat(provider.callsFor("summary")).isZero();
    }

    @Test
    @DisplayName("Should reject resume of an unknown session")
    void resume_UnknownSession_ShouldThrow() {
        assertThatThrownBy(() -> policyWorkflow.resume("QUOTE-missing"))
                .isInstanceOf(SessionNotFoundException.class);
    }
}
