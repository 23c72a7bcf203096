package com.purchasingpower.policyflow.workflow.stages;

import com.purchasingpower.policyflow.exception.StageValidationException;
import com.purchasingpower.policyflow.extraction.RoundTripResult;
import com.purchasingpower.policyflow.model.dto.PolicyIntakeRequest;
import com.purchasingpower.policyflow.model.policy.CustomerProfile;
import com.purchasingpower.policyflow.model.policy.UnderwritingQuestion;
import com.purchasingpower.policyflow.service.UnderwritingQuestionService;
import com.purchasingpower.policyflow.workflow.StageProcessor;
import com.purchasingpower.policyflow.workflow.WorkflowStage;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Answers the underwriting question set.
 *
 * Answers given with the intake payload take precedence; generation is asked
 * for the rest. Every answer is normalized to one of the question's allowed
 * answers. An unanswered mandatory question is a validation failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnderwritingProcessor implements StageProcessor {

    private final GenerationSupport generation;
    private final UnderwritingQuestionService questionService;

    @Override
    public WorkflowStage getStage() {
        return WorkflowStage.UNDERWRITING;
    }

    @Override
    public Map<String, Object> execute(PolicyWorkflowState state) {
        CustomerProfile profile = state.getCustomerProfile() != null
                ? state.getCustomerProfile()
                : new CustomerProfile();
        List<UnderwritingQuestion> questions = questionService.getQuestions();
        log.info("📋 Underwriting {} with {} questions", profile.getName(), questions.size());

        Map<String, String> supplied = new LinkedHashMap<>();
        PolicyIntakeRequest intake = state.getIntake();
        if (intake != null && intake.getUnderwritingAnswers() != null) {
            supplied.putAll(intake.getUnderwritingAnswers());
        }
        if (profile.getUnderwritingAnswers() != null) {
            supplied.putAll(profile.getUnderwritingAnswers());
        }

        Map<String, String> generated = Map.of();
        boolean allSupplied = questions.stream().allMatch(q -> supplied.containsKey(q.getId()));
        if (!allSupplied) {
            Map<String, Object> variables = new HashMap<>();
            variables.put("profileJson", generation.toJson(profile));
            variables.put("questionsJson", generation.toJson(questions));
            variables.put("notes", intake != null && intake.getNotes() != null ? intake.getNotes() : "");

            RoundTripResult<UnderwritingAnswers> result = generation.generate(
                    state, "underwriting", variables, UnderwritingAnswers.class, UnderwritingAnswers::new);
            if (result.value() != null && result.value().getAnswers() != null) {
                generated = result.value().getAnswers();
            }
        }

        Map<String, String> answers = new LinkedHashMap<>();
        for (UnderwritingQuestion question : questions) {
            String id = question.getId();
            Optional<String> answer = normalized(question, supplied.get(id));
            if (answer.isEmpty()) {
                answer = normalized(question, generated.get(id));
            }
            answer.ifPresent(value -> answers.put(id, value));
        }

        List<String> unanswered = questions.stream()
                .filter(UnderwritingQuestion::isMandatory)
                .map(UnderwritingQuestion::getId)
                .filter(id -> !answers.containsKey(id))
                .collect(Collectors.toList());
        if (!unanswered.isEmpty()) {
            throw new StageValidationException(getStage().getStageName(),
                    "Mandatory underwriting questions unanswered: " + String.join(", ", unanswered));
        }

        log.info("✅ Underwriting answers recorded: {}", answers);
        Map<String, Object> updates = new HashMap<>();
        updates.put(PolicyWorkflowState.CUSTOMER_PROFILE, profile.toBuilder().underwritingAnswers(answers).build());
        return updates;
    }

    private Optional<String> normalized(UnderwritingQuestion question, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Optional<String> answer = question.normalize(raw);
        if (answer.isEmpty()) {
            log.warn("⚠️ Ignoring answer '{}' to {}; allowed: {}", raw, question.getId(), question.getAllowedAnswers());
        }
        return answer;
    }
}
