package com.purchasingpower.policyflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status stored on every workflow checkpoint.
 *
 * <p>State transitions:
 * <pre>
 * InProgress → Draft → Active
 *     ↓          ↓
 * Ineligible  Declined
 *     ↓
 *   Error → InProgress (on resume)
 * </pre>
 *
 * <p>Serialized with the labels used in stored documents ("InProgress", "Active", ...).
 */
public enum PolicyStatus {

    /**
     * Stages are still running.
     */
    IN_PROGRESS("InProgress"),

    /**
     * A priced quote exists and is waiting for issuance.
     */
    DRAFT("Draft"),

    /**
     * Policy issued. Final stages may still record monitoring data.
     */
    ACTIVE("Active"),

    /**
     * Eligibility gate tripped. Terminal.
     */
    INELIGIBLE("Ineligible"),

    /**
     * Internal approval or regulatory review refused the quote. Terminal.
     */
    DECLINED("Declined"),

    /**
     * A stage produced an unusable artifact or threw. Can be resumed.
     */
    ERROR("Error");

    private final String label;

    PolicyStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static PolicyStatus fromLabel(String value) {
        for (PolicyStatus status : values()) {
            if (status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown policy status: " + value);
    }
}
