package com.warisan.agreement.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Optional;

/**
 * Beneficiary entry of an agreement as submitted by the owner.
 * Exactly one of the two member references is expected; the validator reports violations.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record BeneficiaryInput(
    Optional<Long> familyMemberId,
    Optional<Long> nonRegisteredFamilyMemberId,
    RelationKind relation,
    double sharePercentage,
    Optional<String> shareDescription
) {
    public BeneficiaryInput {
        familyMemberId = familyMemberId != null ? familyMemberId : Optional.empty();
        nonRegisteredFamilyMemberId = nonRegisteredFamilyMemberId != null ? nonRegisteredFamilyMemberId : Optional.empty();
        shareDescription = shareDescription != null ? shareDescription : Optional.empty();
    }

    public static BeneficiaryInput registered(Long familyMemberId, RelationKind relation, double sharePercentage) {
        return new BeneficiaryInput(Optional.of(familyMemberId), Optional.empty(), relation, sharePercentage, Optional.empty());
    }

    public static BeneficiaryInput nonRegistered(Long memberId, RelationKind relation, double sharePercentage) {
        return new BeneficiaryInput(Optional.empty(), Optional.of(memberId), relation, sharePercentage, Optional.empty());
    }
}
