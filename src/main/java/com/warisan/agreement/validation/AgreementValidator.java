package com.warisan.agreement.validation;

import com.warisan.agreement.config.WarisanProperties;
import com.warisan.agreement.domain.AgreementInput;
import com.warisan.agreement.domain.AssetAllocation;
import com.warisan.agreement.domain.BeneficiaryInput;
import com.warisan.agreement.domain.DistributionType;
import com.warisan.agreement.domain.ProposedShare;
import com.warisan.agreement.domain.ValidationResult;
import com.warisan.agreement.faraid.FaraidShareValidator;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Input validation for agreement headers, beneficiaries and assets.
 * Every check runs; all problems are reported together.
 */
@Service
public class AgreementValidator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final FaraidShareValidator faraidShareValidator;
    private final WarisanProperties properties;
    private final Clock clock;

    public AgreementValidator(FaraidShareValidator faraidShareValidator, WarisanProperties properties, Clock clock) {
        this.faraidShareValidator = faraidShareValidator;
        this.properties = properties;
        this.clock = clock;
    }

    // ========================================================================
    // HEADER
    // ========================================================================

    public ValidationResult validateAgreementInput(AgreementInput input) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        var limits = properties.agreement();

        var title = input.title();
        if (title == null || title.trim().isEmpty()) {
            errors.add("Title is required");
        } else if (title.length() > limits.titleMaxLength()) {
            errors.add("Title must be less than " + limits.titleMaxLength() + " characters");
        }

        input.description()
            .filter(d -> d.length() > limits.descriptionMaxLength())
            .ifPresent(d -> errors.add("Description must be less than " + limits.descriptionMaxLength() + " characters"));

        input.distributionType()
            .filter(code -> DistributionType.parse(code).isEmpty())
            .ifPresent(code -> errors.add("Invalid distribution type. Must be one of: " + DistributionType.allowedValues()));

        if (input.effectiveDate().isPresent() && input.expiryDate().isPresent()
            && !input.expiryDate().get().isAfter(input.effectiveDate().get())) {
            errors.add("Expiry date must be after effective date");
        }

        input.effectiveDate()
            .filter(date -> date.isBefore(LocalDate.now(clock)))
            .ifPresent(date -> warnings.add("Effective date is in the past"));

        return ValidationResult.of(errors, warnings);
    }

    // ========================================================================
    // BENEFICIARIES
    // ========================================================================

    /**
     * Validate beneficiaries; FARAID agreements are additionally checked against the Faraid rules.
     */
    public ValidationResult validateBeneficiaries(List<BeneficiaryInput> beneficiaries, DistributionType distributionType) {
        if (beneficiaries == null || beneficiaries.isEmpty()) {
            return ValidationResult.error("At least one beneficiary is required");
        }

        var errors = new ArrayList<String>();
        for (int i = 0; i < beneficiaries.size(); i++) {
            var b = beneficiaries.get(i);
            var prefix = "Beneficiary at index " + i + ": ";

            boolean registered = b.familyMemberId().isPresent();
            boolean nonRegistered = b.nonRegisteredFamilyMemberId().isPresent();
            if (!registered && !nonRegistered) {
                errors.add(prefix + "Must specify either a registered family member or non-registered member");
            }
            if (registered && nonRegistered) {
                errors.add(prefix + "Cannot specify both registered and non-registered member");
            }
            if (!(b.sharePercentage() > 0)) {
                errors.add(prefix + "Share percentage must be a positive number");
            }
            if (b.sharePercentage() > 100) {
                errors.add(prefix + "Share percentage cannot exceed 100%");
            }
            if (b.relation() == null) {
                errors.add(prefix + "Relation is required");
            }
        }

        double total = beneficiaries.stream().mapToDouble(BeneficiaryInput::sharePercentage).sum();
        if (Math.abs(total - 100) > properties.agreement().beneficiaryTotalTolerance()) {
            errors.add(String.format(Locale.ROOT, "Total beneficiary shares must equal 100%%. Current total: %.2f%%", total));
        }

        var result = ValidationResult.of(errors, List.of());
        if (distributionType == DistributionType.FARAID) {
            var proposed = beneficiaries.stream()
                .filter(b -> b.relation() != null)
                .map(b -> new ProposedShare(b.relation(), b.sharePercentage()))
                .toList();
            result = result.merge(faraidShareValidator.validate(proposed));
        }
        return result;
    }

    // ========================================================================
    // ASSETS
    // ========================================================================

    public ValidationResult validateAssets(List<AssetAllocation> assets) {
        if (assets == null || assets.isEmpty()) {
            return ValidationResult.error("At least one asset is required");
        }

        var errors = new ArrayList<String>();
        for (int i = 0; i < assets.size(); i++) {
            var asset = assets.get(i);
            var prefix = "Asset at index " + i + ": ";

            if (asset.assetId() == null) {
                errors.add(prefix + "Asset ID is required");
            }
            asset.allocatedValue()
                .filter(value -> value.signum() < 0)
                .ifPresent(value -> errors.add(prefix + "Allocated value cannot be negative"));
            asset.allocatedPercentage()
                .filter(pct -> pct.signum() < 0 || pct.compareTo(HUNDRED) > 0)
                .ifPresent(pct -> errors.add(prefix + "Allocated percentage must be between 0 and 100"));
        }

        var seen = new HashSet<Long>();
        boolean duplicates = assets.stream()
            .map(AssetAllocation::assetId)
            .filter(Objects::nonNull)
            .anyMatch(id -> !seen.add(id));
        if (duplicates) {
            errors.add("Duplicate assets detected. Each asset can only be added once");
        }

        return ValidationResult.of(errors, List.of());
    }

    // ========================================================================
    // COMPOSITE
    // ========================================================================

    /**
     * Run header, beneficiary and asset validation and merge the results.
     * An unknown distribution type is reported by the header check and skips the Faraid rules.
     */
    public ValidationResult validateSubmission(
        AgreementInput input,
        List<BeneficiaryInput> beneficiaries,
        List<AssetAllocation> assets
    ) {
        var distributionType = input.distributionType()
            .flatMap(code -> DistributionType.parse(code).toJavaOptional())
            .orElse(null);
        return validateAgreementInput(input)
            .merge(validateBeneficiaries(beneficiaries, distributionType))
            .merge(validateAssets(assets));
    }
}
