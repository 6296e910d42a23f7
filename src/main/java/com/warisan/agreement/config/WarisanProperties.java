package com.warisan.agreement.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tolerances and limits for the Faraid and agreement validators.
 */
@ConfigurationProperties(prefix = "warisan")
public record WarisanProperties(
    FaraidProperties faraid,
    AgreementProperties agreement
) {
    public WarisanProperties {
        faraid = faraid != null ? faraid : new FaraidProperties(0, 0, 0);
        agreement = agreement != null ? agreement : new AgreementProperties(0, 0, 0);
    }

    public static WarisanProperties defaults() {
        return new WarisanProperties(null, null);
    }

    /**
     * Tolerances in percentage points.
     */
    public record FaraidProperties(
        double totalTolerance,
        double fixedShareTolerance,
        double roundingTolerance
    ) {
        public FaraidProperties {
            if (totalTolerance <= 0) totalTolerance = 0.01;
            if (fixedShareTolerance <= 0) fixedShareTolerance = 1.0;
            if (roundingTolerance <= 0) roundingTolerance = 1.0;
        }
    }

    public record AgreementProperties(
        int titleMaxLength,
        int descriptionMaxLength,
        double beneficiaryTotalTolerance
    ) {
        public AgreementProperties {
            if (titleMaxLength <= 0) titleMaxLength = 200;
            if (descriptionMaxLength <= 0) descriptionMaxLength = 1000;
            if (beneficiaryTotalTolerance <= 0) beneficiaryTotalTolerance = 0.1;
        }
    }
}
