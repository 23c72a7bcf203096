package com.purchasingpower.policyflow.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.List;

/**
 * Named collections and durable-store switches.
 */
@Data
public class PersistenceProperties {

    /**
     * When false every collection starts on the in-memory mirror.
     */
    private boolean durableEnabled = true;

    @NotBlank
    private String draftsCollection = "PolicyDrafts";

    @NotBlank
    private String issuedCollection = "PolicyIssued";

    @NotBlank
    private String questionsCollection = "UnderwritingQuestions";

    public List<String> collections() {
        return List.of(draftsCollection, issuedCollection, questionsCollection);
    }
}
