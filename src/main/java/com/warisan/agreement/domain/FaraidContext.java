package com.warisan.agreement.domain;

import java.util.Optional;

/**
 * Optional overrides for the flags the Faraid calculator otherwise derives from the heir set.
 * An empty field means "derive it".
 */
public record FaraidContext(
    Optional<Boolean> hasChildren,
    Optional<Boolean> hasSpouse,
    Optional<Boolean> hasParents,
    Optional<Boolean> isMaleDescendant
) {
    public FaraidContext {
        hasChildren = hasChildren != null ? hasChildren : Optional.empty();
        hasSpouse = hasSpouse != null ? hasSpouse : Optional.empty();
        hasParents = hasParents != null ? hasParents : Optional.empty();
        isMaleDescendant = isMaleDescendant != null ? isMaleDescendant : Optional.empty();
    }

    public static FaraidContext derived() {
        return new FaraidContext(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static FaraidContext of(boolean hasChildren, boolean hasSpouse, boolean hasParents, boolean isMaleDescendant) {
        return new FaraidContext(
            Optional.of(hasChildren),
            Optional.of(hasSpouse),
            Optional.of(hasParents),
            Optional.of(isMaleDescendant)
        );
    }

    public FaraidContext withHasChildren(boolean value) {
        return new FaraidContext(Optional.of(value), hasSpouse, hasParents, isMaleDescendant);
    }

    public FaraidContext withHasParents(boolean value) {
        return new FaraidContext(hasChildren, hasSpouse, Optional.of(value), isMaleDescendant);
    }

    public FaraidContext withMaleDescendant(boolean value) {
        return new FaraidContext(hasChildren, hasSpouse, hasParents, Optional.of(value));
    }
}
