package com.purchasingpower.policyflow.model.policy;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DrivingHistory implements Serializable {

    private Integer violations;

    private Integer accidents;

    @JsonAlias("years_licensed")
    private Integer yearsLicensed;
}
