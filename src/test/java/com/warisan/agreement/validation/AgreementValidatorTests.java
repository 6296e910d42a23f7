package com.warisan.agreement.validation;

import com.warisan.agreement.config.WarisanProperties;
import com.warisan.agreement.domain.AgreementInput;
import com.warisan.agreement.domain.AssetAllocation;
import com.warisan.agreement.domain.BeneficiaryInput;
import com.warisan.agreement.domain.DistributionType;
import com.warisan.agreement.faraid.FaraidCalculator;
import com.warisan.agreement.faraid.FaraidShareValidator;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.warisan.agreement.domain.RelationKind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for agreement input validation.
 */
class AgreementValidatorTests {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final AgreementValidator validator = new AgreementValidator(
        new FaraidShareValidator(new FaraidCalculator(), WarisanProperties.defaults()),
        WarisanProperties.defaults(),
        CLOCK
    );

    @Nested
    class Header {

        @Test
        void validInput_shouldPass() {
            var input = AgreementInput.of("Family estate", DistributionType.HIBAH)
                .withDates(LocalDate.of(2026, 2, 1), LocalDate.of(2027, 2, 1));

            var result = validator.validateAgreementInput(input);

            assertTrue(result.valid());
            assertFalse(result.hasWarnings());
        }

        @Test
        void blankTitle_shouldBeRequired() {
            var result = validator.validateAgreementInput(AgreementInput.of("   ", DistributionType.FARAID));

            assertEquals(List.of("Title is required"), result.errors());
        }

        @Test
        void longTitleAndDescription_shouldFail() {
            var input = AgreementInput.of("t".repeat(201), DistributionType.FARAID)
                .withDescription("d".repeat(1001));

            var result = validator.validateAgreementInput(input);

            assertEquals(List.of(
                "Title must be less than 200 characters",
                "Description must be less than 1000 characters"
            ), result.errors());
        }

        @Test
        void titleAtLimit_shouldPass() {
            var result = validator.validateAgreementInput(AgreementInput.of("t".repeat(200), DistributionType.WAKAF));

            assertTrue(result.valid());
        }

        @Test
        void unknownDistributionType_shouldListAllowedValues() {
            var input = new AgreementInput("Estate", Optional.empty(), Optional.of("LOAN"), Optional.empty(), Optional.empty());

            var result = validator.validateAgreementInput(input);

            assertEquals(List.of("Invalid distribution type. Must be one of: FARAID, HIBAH, WASIYYAH, WAKAF"),
                result.errors());
        }

        @Test
        void expiryNotAfterEffective_shouldFail() {
            var sameDay = AgreementInput.of("Estate", DistributionType.WASIYYAH)
                .withDates(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 1));

            var result = validator.validateAgreementInput(sameDay);

            assertEquals(List.of("Expiry date must be after effective date"), result.errors());
        }

        @Test
        void pastEffectiveDate_shouldOnlyWarn() {
            var input = AgreementInput.of("Estate", DistributionType.HIBAH)
                .withDates(LocalDate.of(2025, 12, 31), null);

            var result = validator.validateAgreementInput(input);

            assertTrue(result.valid());
            assertEquals(List.of("Effective date is in the past"), result.warnings());
        }
    }

    @Nested
    class Beneficiaries {

        @Test
        void emptyList_shouldBeRejected() {
            var result = validator.validateBeneficiaries(List.of(), DistributionType.HIBAH);

            assertEquals(List.of("At least one beneficiary is required"), result.errors());
        }

        @Test
        void invalidEntries_shouldBeReportedByIndex() {
            var neither = new BeneficiaryInput(Optional.empty(), Optional.empty(), SON, 0, Optional.empty());
            var both = new BeneficiaryInput(Optional.of(1L), Optional.of(2L), null, 150, Optional.empty());

            var result = validator.validateBeneficiaries(List.of(neither, both), DistributionType.HIBAH);

            assertEquals(List.of(
                "Beneficiary at index 0: Must specify either a registered family member or non-registered member",
                "Beneficiary at index 0: Share percentage must be a positive number",
                "Beneficiary at index 1: Cannot specify both registered and non-registered member",
                "Beneficiary at index 1: Share percentage cannot exceed 100%",
                "Beneficiary at index 1: Relation is required",
                "Total beneficiary shares must equal 100%. Current total: 150.00%"
            ), result.errors());
        }

        @Test
        void totalWithinTolerance_shouldPass() {
            var result = validator.validateBeneficiaries(List.of(
                BeneficiaryInput.registered(1L, SIBLING, 33.33),
                BeneficiaryInput.registered(2L, SIBLING, 33.33),
                BeneficiaryInput.nonRegistered(3L, COUSIN, 33.34)
            ), DistributionType.HIBAH);

            assertTrue(result.valid());
        }

        @Test
        void faraidResiduaryHeirs_shouldPassWithWarnings() {
            var beneficiaries = List.of(
                BeneficiaryInput.registered(1L, SON, 50),
                BeneficiaryInput.registered(2L, DAUGHTER, 50)
            );

            var result = validator.validateBeneficiaries(beneficiaries, DistributionType.FARAID);

            assertTrue(result.valid());
            assertEquals(2, result.warnings().size());
            assertTrue(result.warnings().get(0).startsWith("SON should receive residuary portion"));
            assertTrue(result.warnings().get(1).startsWith("DAUGHTER should receive residuary portion"));
        }

        @Test
        void faraidRules_shouldOnlyApplyToFaraidAgreements() {
            var beneficiaries = List.of(
                BeneficiaryInput.registered(1L, HUSBAND, 50),
                BeneficiaryInput.registered(2L, DAUGHTER, 50)
            );

            var hibah = validator.validateBeneficiaries(beneficiaries, DistributionType.HIBAH);
            var faraid = validator.validateBeneficiaries(beneficiaries, DistributionType.FARAID);

            assertTrue(hibah.valid());
            assertEquals(List.of("HUSBAND: Expected 25.00% per Faraid rules, got 50%"), faraid.errors());
        }
    }

    @Nested
    class Assets {

        @Test
        void emptyList_shouldBeRejected() {
            assertEquals(List.of("At least one asset is required"), validator.validateAssets(List.of()).errors());
        }

        @Test
        void duplicateAssets_shouldFail() {
            var result = validator.validateAssets(List.of(
                AssetAllocation.whole(1L),
                AssetAllocation.whole(2L),
                AssetAllocation.whole(1L)
            ));

            assertEquals(List.of("Duplicate assets detected. Each asset can only be added once"), result.errors());
        }

        @Test
        void invalidAllocations_shouldBeReportedByIndex() {
            var result = validator.validateAssets(List.of(
                AssetAllocation.whole(null),
                AssetAllocation.value(2L, new BigDecimal("-1")),
                AssetAllocation.percentage(3L, new BigDecimal("100.5")),
                AssetAllocation.percentage(4L, BigDecimal.valueOf(100))
            ));

            assertEquals(List.of(
                "Asset at index 0: Asset ID is required",
                "Asset at index 1: Allocated value cannot be negative",
                "Asset at index 2: Allocated percentage must be between 0 and 100"
            ), result.errors());
        }
    }

    @Test
    void validateSubmission_shouldMergeAllChecks() {
        var input = AgreementInput.of("", DistributionType.FARAID);
        var beneficiaries = List.of(BeneficiaryInput.registered(1L, WIFE, 100));

        var result = validator.validateSubmission(input, beneficiaries, List.of());

        assertEquals(List.of(
            "Title is required",
            "WIFE: Expected 25.00% per Faraid rules, got 100%",
            "At least one asset is required"
        ), result.errors());
    }

    @Test
    void validateSubmission_withUnknownType_shouldSkipFaraidRules() {
        var input = new AgreementInput("Estate", Optional.empty(), Optional.of("LOAN"), Optional.empty(), Optional.empty());
        var beneficiaries = List.of(BeneficiaryInput.registered(1L, WIFE, 100));

        var result = validator.validateSubmission(input, beneficiaries, List.of(AssetAllocation.whole(9L)));

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Invalid distribution type"));
    }
}
