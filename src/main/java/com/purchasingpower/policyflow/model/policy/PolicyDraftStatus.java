package com.purchasingpower.policyflow.model.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PolicyDraftStatus {

    DRAFT("Draft"),
    INELIGIBLE("Ineligible"),
    DECLINED("Declined"),
    ACTIVE("Active");

    private final String label;

    PolicyDraftStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static PolicyDraftStatus fromLabel(String value) {
        for (PolicyDraftStatus status : values()) {
            if (status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown policy draft status: " + value);
    }
}
