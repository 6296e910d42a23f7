package com.warisan.agreement.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Agreement domain record - immutable value object supplied by the persistence layer.
 * The engine never stores it; status changes produce a new copy.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record Agreement(
    Optional<Long> id,
    String title,
    Optional<String> description,
    DistributionType distributionType,
    AgreementStatus status,
    Optional<LocalDate> effectiveDate,
    Optional<LocalDate> expiryDate,
    String ownerId,
    List<BeneficiaryInput> beneficiaries,
    List<AssetAllocation> assets,
    Optional<LocalDateTime> updatedAt,
    Optional<String> updatedBy
) {
    // Compact constructor for validation
    public Agreement {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (distributionType == null) {
            throw new IllegalArgumentException("distributionType is required");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        if (status == null) {
            status = AgreementStatus.DRAFT;
        }
        id = id != null ? id : Optional.empty();
        description = description != null ? description : Optional.empty();
        effectiveDate = effectiveDate != null ? effectiveDate : Optional.empty();
        expiryDate = expiryDate != null ? expiryDate : Optional.empty();
        beneficiaries = beneficiaries != null ? List.copyOf(beneficiaries) : List.of();
        assets = assets != null ? List.copyOf(assets) : List.of();
        updatedAt = updatedAt != null ? updatedAt : Optional.empty();
        updatedBy = updatedBy != null ? updatedBy : Optional.empty();
    }

    /**
     * Factory method for creating a new draft agreement.
     */
    public static Agreement draft(String title, DistributionType distributionType, String ownerId) {
        return new Agreement(
            Optional.empty(),
            title,
            Optional.empty(),
            distributionType,
            AgreementStatus.DRAFT,
            Optional.empty(),
            Optional.empty(),
            ownerId,
            List.of(),
            List.of(),
            Optional.empty(),
            Optional.empty()
        );
    }

    /**
     * Create a copy with updated status and updatedBy actor.
     * Does not check the transition; callers go through the status machine first.
     */
    public Agreement withStatus(AgreementStatus newStatus, String actor) {
        if (newStatus == null) {
            throw new IllegalArgumentException("status is required");
        }
        return new Agreement(
            id, title, description, distributionType, newStatus, effectiveDate, expiryDate,
            ownerId, beneficiaries, assets, Optional.of(LocalDateTime.now()), Optional.ofNullable(actor)
        );
    }

    /**
     * Create a copy with ID (after insert).
     */
    public Agreement withId(Long newId) {
        return new Agreement(
            Optional.ofNullable(newId), title, description, distributionType, status, effectiveDate, expiryDate,
            ownerId, beneficiaries, assets, updatedAt, updatedBy
        );
    }

    /**
     * Create a copy with new beneficiaries and assets, keeping header fields.
     */
    public Agreement withAllocations(List<BeneficiaryInput> newBeneficiaries, List<AssetAllocation> newAssets) {
        return new Agreement(
            id, title, description, distributionType, status, effectiveDate, expiryDate,
            ownerId, newBeneficiaries, newAssets, updatedAt, updatedBy
        );
    }

    /**
     * Create a copy with header fields taken from an already validated input.
     */
    public Agreement withHeader(AgreementInput input, DistributionType newType, String actor) {
        return new Agreement(
            id, input.title().trim(), input.description(), newType, status, input.effectiveDate(), input.expiryDate(),
            ownerId, beneficiaries, assets, Optional.of(LocalDateTime.now()), Optional.ofNullable(actor)
        );
    }

    /**
     * Header fields of this agreement in input form, for re-validation.
     */
    public AgreementInput toInput() {
        return new AgreementInput(title, description, Optional.of(distributionType.name()), effectiveDate, expiryDate);
    }

    public boolean isActive() {
        return status == AgreementStatus.ACTIVE;
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }
}
