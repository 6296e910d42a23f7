package com.warisan.agreement.domain;

/**
 * Manually entered share for one beneficiary, in percent of the estate.
 */
public record ProposedShare(
    RelationKind relation,
    double sharePercentage
) {
    public ProposedShare {
        if (relation == null) {
            throw new IllegalArgumentException("relation is required");
        }
    }
}
