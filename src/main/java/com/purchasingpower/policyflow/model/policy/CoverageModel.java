package com.purchasingpower.policyflow.model.policy;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Coverages with their limits and deductibles, keyed by lower-case coverage name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CoverageModel implements Serializable {

    @Builder.Default
    private Set<String> coverages = new LinkedHashSet<>();

    @Builder.Default
    private Map<String, Double> limits = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> deductibles = new LinkedHashMap<>();

    @Builder.Default
    private Set<String> exclusions = new LinkedHashSet<>();

    @JsonAlias({"add_ons", "addons"})
    @Builder.Default
    private Set<String> addOns = new LinkedHashSet<>();
}
