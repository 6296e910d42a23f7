package com.warisan.agreement.faraid;

import com.warisan.agreement.config.WarisanProperties;
import com.warisan.agreement.domain.BeneficiaryWithShare;
import com.warisan.agreement.domain.FamilyMember;
import com.warisan.agreement.domain.MemberType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.warisan.agreement.domain.RelationKind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the per-member Faraid distribution.
 */
class AutoFaraidDistributionServiceTests {

    private final AutoFaraidDistributionService service = new AutoFaraidDistributionService(
        new FaraidCalculator(), new ResiduaryApportioner(), WarisanProperties.defaults());

    private static BeneficiaryWithShare find(List<BeneficiaryWithShare> beneficiaries, long memberId) {
        return beneficiaries.stream()
            .filter(b -> b.memberId() == memberId)
            .findFirst()
            .orElseThrow();
    }

    @Test
    void husbandAndDaughter_shouldWarnAboutUndistributedQuarter() {
        var members = List.of(
            FamilyMember.registered(1L, "Rahman", HUSBAND),
            FamilyMember.registered(2L, "Aisyah", DAUGHTER),
            FamilyMember.registered(3L, "Karim", UNCLE)
        );

        var result = service.calculate(members);

        assertEquals(2, result.beneficiaries().size());
        assertEquals(25.0, find(result.beneficiaries(), 1L).sharePercentage(), 1e-9);
        assertEquals("1/4 (25.0%)", find(result.beneficiaries(), 1L).shareFormatted());
        assertEquals(50.0, find(result.beneficiaries(), 2L).sharePercentage(), 1e-9);
        assertEquals(75.0, result.totalPercentage());
        assertFalse(result.hasResiduary());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).startsWith("Total shares (75.0%) may not equal 100%"));
        assertEquals("Husband: 1/4 (with children); Daughter: 1/2 (single daughter)", result.description());
    }

    @Test
    void sonsAndDaughter_shouldShareWholeEstate() {
        var members = List.of(
            FamilyMember.registered(1L, "Ahmad", SON),
            FamilyMember.registered(2L, "Ali", SON),
            FamilyMember.nonRegistered(3L, "Aisyah", DAUGHTER)
        );

        var result = service.calculate(members);

        var son = find(result.beneficiaries(), 1L);
        var daughter = find(result.beneficiaries(), 3L);
        assertEquals(40.0, son.sharePercentage(), 1e-9);
        assertEquals("2/5 (40.0%)", son.shareFormatted());
        assertEquals(AutoFaraidDistributionService.RESIDUARY_DESCRIPTION, son.description());
        assertEquals(40.0, find(result.beneficiaries(), 2L).sharePercentage(), 1e-9);
        assertEquals(20.0, daughter.sharePercentage(), 1e-9);
        assertEquals("1/5 (20.0%)", daughter.shareFormatted());
        assertEquals(MemberType.NON_REGISTERED, daughter.type());
        assertEquals(100.0, result.totalPercentage());
        assertTrue(result.hasResiduary());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void fixedAndResiduaryHeirs_shouldSumToWhole() {
        var members = List.of(
            FamilyMember.registered(1L, "Fatimah", WIFE),
            FamilyMember.registered(2L, "Ahmad", SON),
            FamilyMember.registered(3L, "Aisyah", DAUGHTER),
            FamilyMember.registered(4L, "Khadijah", MOTHER)
        );

        var result = service.calculate(members);

        assertEquals(4, result.beneficiaries().size());
        assertEquals("1/8 (12.5%)", find(result.beneficiaries(), 1L).shareFormatted());
        assertEquals("1/6 (16.7%)", find(result.beneficiaries(), 4L).shareFormatted());
        assertEquals(find(result.beneficiaries(), 3L).sharePercentage() * 2,
            find(result.beneficiaries(), 2L).sharePercentage(), 1e-9);
        assertEquals(100.0, result.totalPercentage());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void noEligibleHeirs_shouldReturnEmptyResult() {
        var members = List.of(
            FamilyMember.registered(1L, "Karim", UNCLE),
            FamilyMember.registered(2L, "Latif", COUSIN)
        );

        var result = service.calculate(members);

        assertTrue(result.beneficiaries().isEmpty());
        assertEquals(0.0, result.totalPercentage());
        assertFalse(result.hasResiduary());
        assertEquals("No eligible Faraid heirs found among family members", result.description());
        assertEquals(List.of("No eligible family members for Faraid distribution"), result.warnings());
    }

    @Test
    void twoDaughters_shouldSplitTwoThirdsEqually() {
        var members = List.of(
            FamilyMember.registered(1L, "Aisyah", DAUGHTER),
            FamilyMember.registered(2L, "Maryam", DAUGHTER)
        );

        var result = service.calculate(members);

        assertEquals("1/3 (33.3%)", find(result.beneficiaries(), 1L).shareFormatted());
        assertEquals("1/3 (33.3%)", find(result.beneficiaries(), 2L).shareFormatted());
        assertEquals(66.7, result.totalPercentage());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void fatherWithDaughter_shouldFlagResiduaryWithoutApportioning() {
        var members = List.of(
            FamilyMember.registered(1L, "Hassan", FATHER),
            FamilyMember.registered(2L, "Aisyah", DAUGHTER)
        );

        var result = service.calculate(members);

        assertEquals(2, result.beneficiaries().size());
        assertEquals("1/6 (16.7%)", find(result.beneficiaries(), 1L).shareFormatted());
        assertTrue(result.hasResiduary());
        assertEquals(66.7, result.totalPercentage());
        assertFalse(result.warnings().isEmpty());
    }
}
