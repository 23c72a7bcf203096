package com.purchasingpower.policyflow.workflow.gate;

import com.purchasingpower.policyflow.model.policy.InternalApproval;
import com.purchasingpower.policyflow.model.policy.RegulatoryReview;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Approval Gate Tests")
class ApprovalGateTest {

    private final ApprovalGate gate = new ApprovalGate();

    private static InternalApproval approval(boolean approved, String... reasons) {
        return InternalApproval.builder().approved(approved).reasons(List.of(reasons)).build();
    }

    private static RegulatoryReview review(boolean compliance, String... issues) {
        return RegulatoryReview.builder().compliance(compliance).issues(List.of(issues)).build();
    }

    @Test
    @DisplayName("Should pass when approved and compliant")
    void evaluate_ApprovedAndCompliant_ShouldPass() {
        ApprovalDecision decision = gate.evaluate(approval(true), review(true));

        assertThat(decision.approved()).isTrue();
        assertThat(decision.reason()).isNull();
    }

    @Test
    @DisplayName("Should decline when internal approval refuses")
    void evaluate_NotApproved_ShouldDecline() {
        ApprovalDecision decision = gate.evaluate(approval(false, "Premium below floor"), review(true));

        assertThat(decision.approved()).isFalse();
        assertThat(decision.reason())
                .startsWith("Declined:")
                .contains("internal approval")
                .contains("Premium below floor")
                .doesNotContain("regulatory");
    }

    @Test
    @DisplayName("Should decline when regulatory review finds non-compliance")
    void evaluate_NotCompliant_ShouldDecline() {
        ApprovalDecision decision = gate.evaluate(approval(true), review(false, "Missing disclosure"));

        assertThat(decision.approved()).isFalse();
        assertThat(decision.reason()).contains("regulatory review").contains("Missing disclosure");
    }

    @Test
    @DisplayName("Should name both refusals when both reviewers decline")
    void evaluate_BothRefuse_ShouldListBoth() {
        ApprovalDecision decision = gate.evaluate(approval(false), review(false));

        assertThat(decision.approved()).isFalse();
        assertThat(decision.reason()).contains("internal approval refused; regulatory review");
    }

    @Test
    @DisplayName("Should treat a missing verdict as a pass")
    void evaluate_MissingVerdicts_ShouldPass() {
        assertThat(gate.evaluate(null, null).approved()).isTrue();
        assertThat(gate.evaluate(new InternalApproval(), new RegulatoryReview()).approved()).isTrue();
    }
}
