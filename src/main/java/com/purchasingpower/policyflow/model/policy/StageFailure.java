package com.purchasingpower.policyflow.model.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Recorded failure of one stage. The correlation id also appears in the error log line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StageFailure implements Serializable {

    private String correlationId;

    private String stage;

    private Kind kind;

    private String message;

    private Instant occurredAt;

    public enum Kind {
        VALIDATION,
        UNEXPECTED
    }
}
