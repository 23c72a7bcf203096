package com.purchasingpower.policyflow.workflow.gate;

import com.purchasingpower.policyflow.configuration.AppProperties;
import com.purchasingpower.policyflow.model.policy.CustomerProfile;
import com.purchasingpower.policyflow.model.policy.UnderwritingQuestion;
import com.purchasingpower.policyflow.service.UnderwritingQuestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Decides eligibility from the underwriting answers.
 *
 * A customer is ineligible when any mandatory question carries the
 * configured negative answer (case-insensitive). Optional questions never
 * affect the outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EligibilityGate {

    private final UnderwritingQuestionService questionService;
    private final AppProperties props;

    public EligibilityDecision evaluate(CustomerProfile profile) {
        return evaluate(profile, questionService.getQuestions());
    }

    public EligibilityDecision evaluate(CustomerProfile profile, List<UnderwritingQuestion> questions) {
        String negative = props.getWorkflow().getNegativeAnswer();
        Map<String, String> answers = profile != null && profile.getUnderwritingAnswers() != null
                ? profile.getUnderwritingAnswers()
                : Map.of();

        List<UnderwritingQuestion> failed = questions.stream()
                .filter(UnderwritingQuestion::isMandatory)
                .filter(q -> answers.get(q.getId()) != null && negative.equalsIgnoreCase(answers.get(q.getId()).trim()))
                .collect(Collectors.toList());

        if (failed.isEmpty()) {
            log.info("✅ Eligibility gate passed ({} questions checked)", questions.size());
            return EligibilityDecision.passed();
        }

        String reason = "Ineligible: answered '" + negative + "' to mandatory question(s) "
                + failed.stream()
                        .map(q -> q.getId() + " (" + q.getText() + ")")
                        .collect(Collectors.joining("; "));
        log.info("⛔ Eligibility gate tripped: {}", reason);
        return EligibilityDecision.failed(reason,
                failed.stream().map(UnderwritingQuestion::getId).collect(Collectors.toList()));
    }
}
