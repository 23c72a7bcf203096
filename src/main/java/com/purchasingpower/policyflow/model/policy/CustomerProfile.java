package com.purchasingpower.policyflow.model.policy;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Customer data collected by intake and enriched by profiling and underwriting.
 *
 * Once {@link #eligible} is set the profile is only enriched, never rewritten:
 * stages after underwriting add missing values and leave existing ones alone.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CustomerProfile implements Serializable {

    @JsonAlias({"fullName", "full_name"})
    private String name;

    @JsonAlias({"dob", "date_of_birth"})
    private String dateOfBirth;

    private String address;

    private String phone;

    private String email;

    @JsonAlias({"vehicleDetails", "vehicle_details"})
    private VehicleInfo vehicle;

    @JsonAlias("driving_history")
    private DrivingHistory drivingHistory;

    @JsonAlias("coverage_preferences")
    @Builder.Default
    private List<String> coveragePreferences = new ArrayList<>();

    /**
     * Underwriting question id to answer.
     */
    @JsonAlias("underwriting_answers")
    @Builder.Default
    private Map<String, String> underwritingAnswers = new LinkedHashMap<>();

    private Boolean eligible;

    private String eligibilityReason;

    /**
     * Fill fields that are still empty on this profile from {@code other}.
     * Values already present are kept.
     */
    public CustomerProfile enrichedWith(CustomerProfile other) {
        if (other == null) {
            return this;
        }
        CustomerProfileBuilder merged = toBuilder();
        if (isBlank(name)) merged.name(other.getName());
        if (isBlank(dateOfBirth)) merged.dateOfBirth(other.getDateOfBirth());
        if (isBlank(address)) merged.address(other.getAddress());
        if (isBlank(phone)) merged.phone(other.getPhone());
        if (isBlank(email)) merged.email(other.getEmail());
        if (vehicle == null) merged.vehicle(other.getVehicle());
        if (drivingHistory == null) merged.drivingHistory(other.getDrivingHistory());
        if ((coveragePreferences == null || coveragePreferences.isEmpty()) && other.getCoveragePreferences() != null) {
            merged.coveragePreferences(new ArrayList<>(other.getCoveragePreferences()));
        }

        Map<String, String> answers = new LinkedHashMap<>();
        if (other.getUnderwritingAnswers() != null) {
            answers.putAll(other.getUnderwritingAnswers());
        }
        if (underwritingAnswers != null) {
            answers.putAll(underwritingAnswers);
        }
        merged.underwritingAnswers(answers);
        return merged.build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
