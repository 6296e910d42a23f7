package com.warisan.agreement.faraid;

import com.warisan.agreement.domain.FaraidContext;
import com.warisan.agreement.domain.FaraidDistribution;
import com.warisan.agreement.domain.HeirDescriptor;
import com.warisan.agreement.domain.RelationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes Faraid fixed shares and the relations entitled to the residue.
 *
 * <p>Rules run in a fixed order (spouses, father, mother or grandmother, daughters,
 * granddaughters, sons, grandsons, siblings). Each rule only adds to the result, so the
 * output depends on nothing but the heirs and the context. Apportioning the residue among
 * the claimants is left to {@link ResiduaryApportioner}.
 */
@Service
public class FaraidCalculator {

    private static final Logger log = LoggerFactory.getLogger(FaraidCalculator.class);

    static final String NO_HEIRS_DESCRIPTION = "No valid Faraid heirs identified";

    public FaraidDistribution calculate(List<HeirDescriptor> heirs) {
        return calculate(heirs, FaraidContext.derived());
    }

    /**
     * Calculate the distribution; flags left empty in the context are derived from the heirs.
     */
    public FaraidDistribution calculate(List<HeirDescriptor> heirs, FaraidContext context) {
        var c = HeirCase.of(heirs);
        var ctx = context != null ? context : FaraidContext.derived();

        boolean hasChildren = ctx.hasChildren().orElseGet(c::hasDescendant);
        boolean hasParents = ctx.hasParents().orElseGet(c::hasParent);
        boolean maleDescendant = ctx.isMaleDescendant().orElseGet(c::hasMaleDescendant);

        var builder = new DistributionBuilder();

        applySpouses(c, hasChildren, builder);
        applyFather(c, maleDescendant, builder);
        applyMotherOrGrandmother(c, hasChildren, builder);
        applyDaughters(c, builder);
        applyGranddaughters(c, builder);
        applySons(c, builder);
        applyGrandsons(c, builder);
        applySiblings(c, hasChildren, hasParents, builder);

        var distribution = builder.build();
        log.debug("Faraid distribution for {}: fixed={} residuary={} total={}",
            heirs, distribution.shares(), distribution.residuary(), distribution.totalFixedShares());
        return distribution;
    }

    private void applySpouses(HeirCase c, boolean hasChildren, DistributionBuilder builder) {
        if (c.has(RelationKind.HUSBAND)) {
            builder.fixed(RelationKind.HUSBAND, hasChildren ? 1.0 / 4 : 1.0 / 2,
                hasChildren ? "Husband: 1/4 (with children)" : "Husband: 1/2 (without children)");
        }
        if (c.has(RelationKind.WIFE)) {
            builder.fixed(RelationKind.WIFE, hasChildren ? 1.0 / 8 : 1.0 / 4,
                hasChildren ? "Wife: 1/8 (with children)" : "Wife: 1/4 (without children)");
        }
    }

    private void applyFather(HeirCase c, boolean maleDescendant, DistributionBuilder builder) {
        if (!c.has(RelationKind.FATHER)) {
            return;
        }
        if (maleDescendant) {
            builder.fixed(RelationKind.FATHER, 1.0 / 6, "Father: 1/6 fixed");
        } else {
            builder.fixed(RelationKind.FATHER, 1.0 / 6, "Father: 1/6 fixed + residuary");
            builder.residuary(RelationKind.FATHER);
        }
    }

    private void applyMotherOrGrandmother(HeirCase c, boolean hasChildren, DistributionBuilder builder) {
        if (c.has(RelationKind.MOTHER)) {
            builder.fixed(RelationKind.MOTHER, hasChildren ? 1.0 / 6 : 1.0 / 3,
                hasChildren ? "Mother: 1/6 (with children)" : "Mother: 1/3 (without children)");
        } else if (c.has(RelationKind.GRANDMOTHER)) {
            builder.fixed(RelationKind.GRANDMOTHER, 1.0 / 6, "Grandmother: 1/6 (in absence of mother)");
        }
    }

    private void applyDaughters(HeirCase c, DistributionBuilder builder) {
        int daughters = c.count(RelationKind.DAUGHTER);
        if (daughters == 0) {
            return;
        }
        if (c.has(RelationKind.SON)) {
            builder.residuary(RelationKind.DAUGHTER);
            builder.residuary(RelationKind.SON);
            builder.explain("Daughters and Sons: Residuary (son receives 2x daughter share)");
        } else if (daughters == 1) {
            builder.fixed(RelationKind.DAUGHTER, 1.0 / 2, "Daughter: 1/2 (single daughter)");
        } else {
            builder.fixed(RelationKind.DAUGHTER, 2.0 / 3, "Daughters: 2/3 total (" + daughters + " daughters)");
        }
    }

    private void applyGranddaughters(HeirCase c, DistributionBuilder builder) {
        if (c.has(RelationKind.GRANDDAUGHTER) && !c.has(RelationKind.DAUGHTER)) {
            builder.fixed(RelationKind.GRANDDAUGHTER, 1.0 / 6, "Granddaughter: 1/6 (representing deceased daughter)");
        }
    }

    private void applySons(HeirCase c, DistributionBuilder builder) {
        if (c.has(RelationKind.SON) && !builder.isResiduary(RelationKind.SON)) {
            builder.residuary(RelationKind.SON);
            builder.explain("Son: Residuary (remaining portion)");
        }
    }

    private void applyGrandsons(HeirCase c, DistributionBuilder builder) {
        if (c.has(RelationKind.GRANDSON) && !c.has(RelationKind.SON)) {
            builder.residuary(RelationKind.GRANDSON);
            builder.explain("Grandson: Residuary (in absence of son)");
        }
    }

    // Siblings are blocked by any parent, descendant or grandfather.
    private void applySiblings(HeirCase c, boolean hasChildren, boolean hasParents, DistributionBuilder builder) {
        if (c.has(RelationKind.SIBLING) && !hasParents && !hasChildren && !c.has(RelationKind.GRANDFATHER)) {
            builder.residuary(RelationKind.SIBLING);
            builder.explain("Siblings: Residuary (absence of descendants/ascendants)");
        }
    }

    private static final class DistributionBuilder {
        private final Map<RelationKind, Double> shares = new LinkedHashMap<>();
        private final List<RelationKind> residuary = new ArrayList<>();
        private final List<String> trace = new ArrayList<>();
        private double totalFixedShares;

        void fixed(RelationKind relation, double share, String explanation) {
            shares.put(relation, share);
            totalFixedShares += share;
            trace.add(explanation);
        }

        void residuary(RelationKind relation) {
            if (!residuary.contains(relation)) {
                residuary.add(relation);
            }
        }

        boolean isResiduary(RelationKind relation) {
            return residuary.contains(relation);
        }

        void explain(String explanation) {
            trace.add(explanation);
        }

        FaraidDistribution build() {
            var description = trace.isEmpty() ? NO_HEIRS_DESCRIPTION : String.join("; ", trace);
            return new FaraidDistribution(shares, residuary, totalFixedShares, description);
        }
    }
}
