package com.purchasingpower.policyflow.model.policy;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Internal sign-off on a quote before issuance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InternalApproval implements Serializable {

    private Boolean approved;

    @JsonAlias("reason")
    @Builder.Default
    private List<String> reasons = new ArrayList<>();
}
