package com.warisan.agreement.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Optional;

/**
 * Family member as supplied by the owner's family records.
 * The Faraid engine only reads id, type, name and relation.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record FamilyMember(
    Long id,
    MemberType type,
    String name,
    RelationKind relation,
    Optional<String> email,
    Optional<String> icNumber
) {
    public FamilyMember {
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
        if (relation == null) {
            throw new IllegalArgumentException("relation is required");
        }
        if (type == null) {
            type = MemberType.REGISTERED;
        }
        email = email != null ? email : Optional.empty();
        icNumber = icNumber != null ? icNumber : Optional.empty();
    }

    public static FamilyMember registered(Long id, String name, RelationKind relation) {
        return new FamilyMember(id, MemberType.REGISTERED, name, relation, Optional.empty(), Optional.empty());
    }

    public static FamilyMember nonRegistered(Long id, String name, RelationKind relation) {
        return new FamilyMember(id, MemberType.NON_REGISTERED, name, relation, Optional.empty(), Optional.empty());
    }
}
