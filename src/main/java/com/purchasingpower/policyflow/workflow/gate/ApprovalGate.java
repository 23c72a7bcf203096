package com.purchasingpower.policyflow.workflow.gate;

import com.purchasingpower.policyflow.model.policy.InternalApproval;
import com.purchasingpower.policyflow.model.policy.RegulatoryReview;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Second business gate, between the quote and issuance.
 *
 * A quote is declined when internal approval says {@code approved: false} or
 * regulatory review says {@code compliance: false}. A missing verdict counts
 * as a pass; the stage defaults already fill it in when generation fails.
 */
@Slf4j
@Component
public class ApprovalGate {

    public ApprovalDecision evaluate(InternalApproval approval, RegulatoryReview review) {
        List<String> refusals = new ArrayList<>();
        if (approval != null && Boolean.FALSE.equals(approval.getApproved())) {
            refusals.add("internal approval refused" + details(approval.getReasons()));
        }
        if (review != null && Boolean.FALSE.equals(review.getCompliance())) {
            refusals.add("regulatory review found non-compliance" + details(review.getIssues()));
        }

        if (refusals.isEmpty()) {
            log.info("✅ Approval gate passed");
            return ApprovalDecision.passed();
        }
        String reason = "Declined: " + String.join("; ", refusals);
        log.info("⛔ Approval gate tripped: {}", reason);
        return ApprovalDecision.declined(reason);
    }

    private static String details(List<String> items) {
        return items == null || items.isEmpty() ? "" : " (" + String.join(", ", items) + ")";
    }
}
