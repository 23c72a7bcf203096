package com.purchasingpower.policyflow.model.policy;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Closing record of an issued policy. Number, premium and dates always come
 * from the session, never from generated text.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicySummary implements Serializable {

    @JsonAlias("policy_number")
    private String policyNumber;

    @JsonAlias("customer_name")
    private String customerName;

    @Builder.Default
    private Set<String> coverages = new LinkedHashSet<>();

    @JsonAlias("final_premium")
    private Double finalPremium;

    @JsonAlias("activated_date")
    private LocalDate activatedDate;

    @JsonAlias("end_date")
    private LocalDate endDate;

    @JsonAlias("monitoring_status")
    private String monitoringStatus;

    private String summary;
}
