package com.warisan.agreement.domain;

/**
 * Signature and witness progress used to gate status transitions.
 */
public record TransitionContext(
    boolean ownerHasSigned,
    boolean allBeneficiariesSigned,
    boolean witnessed
) {
    public static TransitionContext none() {
        return new TransitionContext(false, false, false);
    }

    public static TransitionContext ownerSigned() {
        return new TransitionContext(true, false, false);
    }

    public static TransitionContext allSigned() {
        return new TransitionContext(true, true, false);
    }

    public static TransitionContext fullyExecuted() {
        return new TransitionContext(true, true, true);
    }
}
