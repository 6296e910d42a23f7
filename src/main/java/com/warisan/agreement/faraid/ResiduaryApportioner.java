package com.warisan.agreement.faraid;

import com.warisan.agreement.domain.FamilyMember;
import com.warisan.agreement.domain.RelationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the residue among residuary heirs by weighted units.
 *
 * <p>Sons and grandsons standing in for sons take two units, daughters and granddaughters
 * standing in for daughters take one. Siblings and grandfathers take one unit each without
 * distinguishing full or half siblings, which approximates rather than implements the
 * classical rules. Relations without a unit weight (e.g. a father entitled to the residue)
 * receive nothing here.
 */
@Component
public class ResiduaryApportioner {

    private static final Logger log = LoggerFactory.getLogger(ResiduaryApportioner.class);

    /**
     * @param residuaryHeirs heirs flagged as residuary by the calculator
     * @param remainingShare fraction of the estate left after fixed shares
     * @return member id to fraction of the whole estate, empty when nothing can be distributed
     */
    public Map<Long, Double> apportion(List<FamilyMember> residuaryHeirs, double remainingShare) {
        var shares = new LinkedHashMap<Long, Double>();
        if (remainingShare <= 0 || residuaryHeirs.isEmpty()) {
            return shares;
        }

        var byRelation = new EnumMap<RelationKind, List<FamilyMember>>(RelationKind.class);
        for (FamilyMember heir : residuaryHeirs) {
            byRelation.computeIfAbsent(heir.relation(), r -> new ArrayList<>()).add(heir);
        }

        var sons = byRelation.getOrDefault(RelationKind.SON, List.of());
        var daughters = byRelation.getOrDefault(RelationKind.DAUGHTER, List.of());
        var grandsons = sons.isEmpty() ? byRelation.getOrDefault(RelationKind.GRANDSON, List.of()) : List.<FamilyMember>of();
        var granddaughters = daughters.isEmpty()
            ? byRelation.getOrDefault(RelationKind.GRANDDAUGHTER, List.of())
            : List.<FamilyMember>of();
        var siblings = byRelation.getOrDefault(RelationKind.SIBLING, List.of());
        var grandfathers = byRelation.getOrDefault(RelationKind.GRANDFATHER, List.of());

        int totalUnits = sons.size() * 2
            + daughters.size()
            + grandsons.size() * 2
            + granddaughters.size()
            + siblings.size()
            + grandfathers.size();

        if (totalUnits == 0) {
            log.warn("No residuary weight among {} heirs, {} of the estate left undistributed",
                residuaryHeirs.size(), remainingShare);
            return shares;
        }

        double sharePerUnit = remainingShare / totalUnits;
        assign(shares, sons, sharePerUnit * 2);
        assign(shares, daughters, sharePerUnit);
        assign(shares, grandsons, sharePerUnit * 2);
        assign(shares, granddaughters, sharePerUnit);
        assign(shares, siblings, sharePerUnit);
        assign(shares, grandfathers, sharePerUnit);

        log.debug("Residue {} split into {} units of {}", remainingShare, totalUnits, sharePerUnit);
        return shares;
    }

    private static void assign(Map<Long, Double> shares, List<FamilyMember> heirs, double share) {
        heirs.forEach(heir -> shares.put(heir.id(), share));
    }
}
