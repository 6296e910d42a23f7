package com.warisan.agreement.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Authenticated facts about the user attempting to sign.
 */
public record SignatureContext(
    @JsonProperty("isOwner") boolean isOwner,
    @JsonProperty("isBeneficiary") boolean isBeneficiary,
    @JsonProperty("isAdmin") boolean isAdmin
) {
    public static SignatureContext owner() {
        return new SignatureContext(true, false, false);
    }

    public static SignatureContext beneficiary() {
        return new SignatureContext(false, true, false);
    }

    public static SignatureContext admin() {
        return new SignatureContext(false, false, true);
    }

    public static SignatureContext anonymous() {
        return new SignatureContext(false, false, false);
    }
}
