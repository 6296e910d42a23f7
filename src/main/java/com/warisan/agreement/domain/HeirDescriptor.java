package com.warisan.agreement.domain;

/**
 * Anonymous group of surviving heirs sharing one relation.
 */
public record HeirDescriptor(
    RelationKind relation,
    int count
) {
    public HeirDescriptor {
        if (relation == null) {
            throw new IllegalArgumentException("relation is required");
        }
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1, got " + count);
        }
    }

    public static HeirDescriptor of(RelationKind relation) {
        return new HeirDescriptor(relation, 1);
    }

    public static HeirDescriptor of(RelationKind relation, int count) {
        return new HeirDescriptor(relation, count);
    }
}
