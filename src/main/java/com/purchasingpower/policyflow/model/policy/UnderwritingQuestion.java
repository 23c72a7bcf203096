package com.purchasingpower.policyflow.model.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UnderwritingQuestion implements Serializable {

    private String id;

    private String text;

    private boolean mandatory;

    private String explanation;

    @Builder.Default
    private List<String> allowedAnswers = new ArrayList<>(List.of("Yes", "No"));

    /**
     * Match a raw answer against the allowed answers, ignoring case and surrounding whitespace.
     */
    public Optional<String> normalize(String answer) {
        if (answer == null) {
            return Optional.empty();
        }
        String trimmed = answer.trim();
        return allowedAnswers.stream()
                .filter(allowed -> allowed.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
