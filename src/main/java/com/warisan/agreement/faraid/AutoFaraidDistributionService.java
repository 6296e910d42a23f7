package com.warisan.agreement.faraid;

import com.warisan.agreement.config.WarisanProperties;
import com.warisan.agreement.domain.BeneficiaryWithShare;
import com.warisan.agreement.domain.FamilyMember;
import com.warisan.agreement.domain.FaraidCalculationResult;
import com.warisan.agreement.domain.HeirDescriptor;
import com.warisan.agreement.domain.RelationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Computes a complete per-member Faraid distribution for a family.
 * Degenerate families produce an empty result with warnings, never an exception.
 */
@Service
public class AutoFaraidDistributionService {

    private static final Logger log = LoggerFactory.getLogger(AutoFaraidDistributionService.class);

    static final String RESIDUARY_DESCRIPTION = "Residuary share (remaining portion after fixed shares)";

    private final FaraidCalculator calculator;
    private final ResiduaryApportioner apportioner;
    private final WarisanProperties properties;

    public AutoFaraidDistributionService(
        FaraidCalculator calculator,
        ResiduaryApportioner apportioner,
        WarisanProperties properties
    ) {
        this.calculator = calculator;
        this.apportioner = apportioner;
        this.properties = properties;
    }

    public FaraidCalculationResult calculate(List<FamilyMember> familyMembers) {
        var eligibleHeirs = FaraidRuleTable.filterEligibleHeirs(familyMembers);
        if (eligibleHeirs.isEmpty()) {
            log.warn("No eligible Faraid heirs among {} family members", familyMembers.size());
            return FaraidCalculationResult.empty(
                "No eligible Faraid heirs found among family members",
                "No eligible family members for Faraid distribution"
            );
        }

        var heirsByRelation = new LinkedHashMap<RelationKind, List<FamilyMember>>();
        for (FamilyMember heir : eligibleHeirs) {
            heirsByRelation.computeIfAbsent(heir.relation(), r -> new ArrayList<>()).add(heir);
        }
        var descriptors = heirsByRelation.entrySet().stream()
            .map(e -> HeirDescriptor.of(e.getKey(), e.getValue().size()))
            .toList();

        var distribution = calculator.calculate(descriptors);
        var beneficiaries = new ArrayList<BeneficiaryWithShare>();

        // Fixed shares are split equally among heirs of the same relation.
        for (Map.Entry<RelationKind, Double> entry : distribution.shares().entrySet()) {
            var heirs = heirsByRelation.getOrDefault(entry.getKey(), List.of());
            if (heirs.isEmpty()) {
                continue;
            }
            double sharePerHeir = entry.getValue() / heirs.size();
            var basis = FaraidRuleTable.shareBasis(entry.getKey());
            heirs.forEach(heir -> beneficiaries.add(toBeneficiary(heir, sharePerHeir, basis)));
        }

        var residuaryHeirs = distribution.residuary().stream()
            .flatMap(relation -> heirsByRelation.getOrDefault(relation, List.of()).stream())
            .toList();
        var residuaryShares = apportioner.apportion(residuaryHeirs, 1 - distribution.totalFixedShares());
        residuaryHeirs.stream()
            .filter(heir -> residuaryShares.containsKey(heir.id()))
            .forEach(heir -> beneficiaries.add(
                toBeneficiary(heir, residuaryShares.get(heir.id()), RESIDUARY_DESCRIPTION)));

        double totalPercentage = beneficiaries.stream()
            .mapToDouble(BeneficiaryWithShare::sharePercentage)
            .sum();

        var warnings = new ArrayList<String>();
        if (Math.abs(totalPercentage - 100) > properties.faraid().roundingTolerance()) {
            log.warn("Faraid total {}% drifts from 100% for relations {}", totalPercentage, heirsByRelation.keySet());
            warnings.add(String.format(Locale.ROOT,
                "Total shares (%.1f%%) may not equal 100%% due to rounding. "
                    + "This is normal in Faraid calculations and the difference will be adjusted.",
                totalPercentage));
        }

        return new FaraidCalculationResult(
            beneficiaries,
            Math.round(totalPercentage * 10) / 10.0,
            distribution.description(),
            !residuaryHeirs.isEmpty(),
            warnings
        );
    }

    private static BeneficiaryWithShare toBeneficiary(FamilyMember heir, double share, String description) {
        return new BeneficiaryWithShare(
            heir.id(),
            heir.type(),
            heir.name(),
            heir.relation(),
            share * 100,
            ShareFormatter.formatShare(share),
            description
        );
    }
}
