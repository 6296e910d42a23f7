package com.warisan.agreement.domain;

/**
 * Which signatures a user may place on an agreement right now.
 */
public record SigningCapabilities(
    boolean canSignAsOwner,
    boolean canSignAsBeneficiary,
    boolean canWitness
) {
}
