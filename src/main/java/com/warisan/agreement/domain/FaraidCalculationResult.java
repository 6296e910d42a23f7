package com.warisan.agreement.domain;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of the automatic Faraid distribution over a family.
 */
public record FaraidCalculationResult(
    List<BeneficiaryWithShare> beneficiaries,
    double totalPercentage,
    String description,
    boolean hasResiduary,
    List<String> warnings
) {
    public FaraidCalculationResult {
        beneficiaries = List.copyOf(Objects.requireNonNullElse(beneficiaries, Collections.emptyList()));
        warnings = List.copyOf(Objects.requireNonNullElse(warnings, Collections.emptyList()));
    }

    public static FaraidCalculationResult empty(String description, String warning) {
        return new FaraidCalculationResult(List.of(), 0.0, description, false, List.of(warning));
    }
}
