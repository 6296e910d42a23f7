package com.warisan.agreement.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed shares and residuary claimants computed for a set of heirs.
 * Shares are fractions of the whole estate, kept in the order they were assigned.
 */
public record FaraidDistribution(
    Map<RelationKind, Double> shares,
    List<RelationKind> residuary,
    double totalFixedShares,
    String description
) {
    public FaraidDistribution {
        shares = shares != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(shares))
            : Map.of();
        residuary = residuary != null ? List.copyOf(residuary) : List.of();
        description = description != null ? description : "";
    }

    public Optional<Double> shareOf(RelationKind relation) {
        return Optional.ofNullable(shares.get(relation));
    }

    public boolean isResiduary(RelationKind relation) {
        return residuary.contains(relation);
    }

    /**
     * Portion of the estate left after fixed shares, never negative.
     */
    public double remainingShare() {
        return Math.max(0.0, 1.0 - totalFixedShares);
    }
}
