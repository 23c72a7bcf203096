package com.purchasingpower.policyflow.workflow.stages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reply shape of the underwriting prompt: question id to answer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnderwritingAnswers {

    private Map<String, String> answers = new LinkedHashMap<>();
}
