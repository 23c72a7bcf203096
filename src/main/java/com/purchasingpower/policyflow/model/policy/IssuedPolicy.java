package com.purchasingpower.policyflow.model.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.policyflow.model.PolicyStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Record written to the issued-policies collection, keyed by policy number.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IssuedPolicy {

    private String id;

    private String policyNumber;

    private String quoteId;

    private Long quoteNumber;

    private PolicyStatus status;

    private CustomerProfile customerProfile;

    private CoverageModel coverage;

    private Double finalPremium;

    private String policyDocument;

    private LocalDate startDate;

    private LocalDate endDate;

    private Instant issuedAt;
}
