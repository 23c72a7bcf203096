package com.purchasingpower.policyflow.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.List;

/**
 * Quote and policy identifier conventions.
 *
 * A quote id is {@code quotePrefix + n}; the policy issued from that quote is
 * {@code policyPrefix + n} with the same n. There is no separator.
 */
@Data
public class IdentifierProperties {

    @NotBlank
    private String quotePrefix = "QUOTE";

    @NotBlank
    private String policyPrefix = "MV";

    @NotBlank
    private String sequenceField = "quoteNumber";

    @Min(1)
    private int increment = 10;

    @Min(0)
    private long defaultStart = 100000L;

    public String quoteId(long quoteNumber) {
        return quotePrefix + quoteNumber;
    }

    public String policyNumber(long quoteNumber) {
        return policyPrefix + quoteNumber;
    }

    /**
     * Prefixes stripped before comparing sequence values numerically.
     */
    public List<String> knownPrefixes() {
        return List.of(quotePrefix, policyPrefix);
    }
}
