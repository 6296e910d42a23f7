package com.warisan.agreement.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Agreement header fields as submitted for create or update.
 * distributionType stays a raw code so unknown values can be reported instead of rejected at parse time.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record AgreementInput(
    String title,
    Optional<String> description,
    Optional<String> distributionType,
    Optional<LocalDate> effectiveDate,
    Optional<LocalDate> expiryDate
) {
    public AgreementInput {
        description = description != null ? description : Optional.empty();
        distributionType = distributionType != null ? distributionType : Optional.empty();
        effectiveDate = effectiveDate != null ? effectiveDate : Optional.empty();
        expiryDate = expiryDate != null ? expiryDate : Optional.empty();
    }

    public static AgreementInput of(String title, DistributionType distributionType) {
        return new AgreementInput(title, Optional.empty(), Optional.of(distributionType.name()), Optional.empty(), Optional.empty());
    }

    public AgreementInput withDates(LocalDate effective, LocalDate expiry) {
        return new AgreementInput(title, description, distributionType, Optional.ofNullable(effective), Optional.ofNullable(expiry));
    }

    public AgreementInput withDescription(String newDescription) {
        return new AgreementInput(title, Optional.ofNullable(newDescription), distributionType, effectiveDate, expiryDate);
    }
}
