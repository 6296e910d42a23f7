package com.warisan.agreement.domain;

import java.util.List;

/**
 * Signing progress for display: owner, every beneficiary and the witness each count as one signature.
 */
public record SignatureProgress(
    int total,
    int completed,
    int percentage,
    List<Step> steps
) {
    public SignatureProgress {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public record Step(String label, boolean completed) {
    }
}
