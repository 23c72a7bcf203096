package com.purchasingpower.policyflow.workflow;

import java.util.Arrays;
import java.util.Optional;

/**
 * Workflow stages in execution order. The stage name is what checkpoints
 * store as the last completed stage and what the graph uses as node name.
 */
public enum WorkflowStage {
    INTAKE("intake"),
    PROFILE("profile"),
    UNDERWRITING("underwriting"),
    RISK("risk"),
    COVERAGE("coverage"),
    DRAFTING("drafting"),
    PRICING("pricing"),
    QUOTE("quote"),
    PRESENTATION("presentation"),
    APPROVAL("approval"),
    ISSUANCE("issuance"),
    MONITORING("monitoring"),
    SUMMARY("summary");

    private final String stageName;

    WorkflowStage(String stageName) {
        this.stageName = stageName;
    }

    public String getStageName() {
        return stageName;
    }

    public Optional<WorkflowStage> next() {
        WorkflowStage[] all = values();
        return ordinal() + 1 < all.length ? Optional.of(all[ordinal() + 1]) : Optional.empty();
    }

    public static WorkflowStage first() {
        return INTAKE;
    }

    public static Optional<WorkflowStage> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(stage -> stage.stageName.equalsIgnoreCase(name) || stage.name().equalsIgnoreCase(name))
                .findFirst();
    }
}
