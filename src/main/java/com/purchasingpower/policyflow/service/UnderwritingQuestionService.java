package com.purchasingpower.policyflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.policyflow.configuration.AppProperties;
import com.purchasingpower.policyflow.model.policy.UnderwritingQuestion;
import com.purchasingpower.policyflow.persistence.PersistenceGateway;
import com.purchasingpower.policyflow.persistence.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the underwriting question set through the persistence gateway.
 * The gateway answers with the bundled reference set when the store has none.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UnderwritingQuestionService {

    private final PersistenceGateway gateway;
    private final AppProperties props;
    private final ObjectMapper objectMapper;

    public List<UnderwritingQuestion> getQuestions() {
        String collection = props.getPersistence().getQuestionsCollection();
        QueryResult result = gateway.query(collection, Map.of());
        if (!result.isSuccess()) {
            log.warn("⚠️ Underwriting questions unavailable: {}", result.getMessage());
            return List.of();
        }

        List<UnderwritingQuestion> questions = new ArrayList<>();
        for (Map<String, Object> document : result.getData()) {
            try {
                questions.add(objectMapper.convertValue(document, UnderwritingQuestion.class));
            } catch (IllegalArgumentException e) {
                log.warn("⚠️ Skipping malformed underwriting question {}: {}", document.get("id"), e.getMessage());
            }
        }
        log.debug("Loaded {} underwriting questions from {}", questions.size(), result.getSource());
        return questions;
    }
}
