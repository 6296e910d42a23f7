package com.warisan.agreement.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Agreement status enum matching the AgreementStatus column values.
 */
public enum AgreementStatus {
    DRAFT,
    PENDING_SIGNATURES,
    PENDING_WITNESS,
    ACTIVE,
    COMPLETED,
    CANCELLED,
    EXPIRED;

    /**
     * Statuses reachable from this one, in declaration order.
     */
    public Set<AgreementStatus> allowedTransitions() {
        return switch (this) {
            case DRAFT -> EnumSet.of(PENDING_SIGNATURES, CANCELLED);
            case PENDING_SIGNATURES -> EnumSet.of(DRAFT, PENDING_WITNESS, CANCELLED);
            case PENDING_WITNESS -> EnumSet.of(PENDING_SIGNATURES, ACTIVE, CANCELLED);
            case ACTIVE -> EnumSet.of(COMPLETED);
            case COMPLETED, CANCELLED, EXPIRED -> EnumSet.noneOf(AgreementStatus.class);
        };
    }

    /**
     * Check if transition to target status is valid.
     */
    public boolean canTransitionTo(AgreementStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }

    public String description() {
        return switch (this) {
            case DRAFT -> "Agreement is being created and can be edited";
            case PENDING_SIGNATURES -> "Owner has signed. Waiting for all beneficiaries to sign";
            case PENDING_WITNESS -> "All parties have signed. Waiting for admin witness";
            case ACTIVE -> "Agreement is fully executed and active";
            case COMPLETED -> "Asset distribution has been completed";
            case CANCELLED -> "Agreement has been cancelled";
            case EXPIRED -> "Agreement has expired";
        };
    }
}
