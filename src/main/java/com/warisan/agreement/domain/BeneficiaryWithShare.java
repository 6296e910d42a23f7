package com.warisan.agreement.domain;

/**
 * A concrete heir with the share computed for them.
 */
public record BeneficiaryWithShare(
    Long memberId,
    MemberType type,
    String name,
    RelationKind relation,
    double sharePercentage,
    String shareFormatted,
    String description
) {
}
