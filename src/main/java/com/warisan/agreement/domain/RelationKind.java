package com.warisan.agreement.domain;

/**
 * Relation of a family member to the estate owner, matching the FamilyRelation column values.
 */
public enum RelationKind {
    FATHER,
    MOTHER,
    HUSBAND,
    WIFE,
    DAUGHTER,
    SON,
    GRANDDAUGHTER,
    GRANDSON,
    GRANDMOTHER,
    GRANDFATHER,
    SIBLING,
    UNCLE,
    AUNT,
    NEPHEW,
    NIECE,
    COUSIN,
    OTHER;

    public boolean isDescendant() {
        return this == SON || this == DAUGHTER || this == GRANDSON || this == GRANDDAUGHTER;
    }

    public boolean isMaleDescendant() {
        return this == SON || this == GRANDSON;
    }

    public boolean isParent() {
        return this == FATHER || this == MOTHER;
    }

    public boolean isSpouse() {
        return this == HUSBAND || this == WIFE;
    }
}
