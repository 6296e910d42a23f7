package com.warisan.agreement.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Asset placed into an agreement, optionally with a value or percentage allocation.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record AssetAllocation(
    Long assetId,
    Optional<BigDecimal> allocatedValue,
    Optional<BigDecimal> allocatedPercentage
) {
    public AssetAllocation {
        allocatedValue = allocatedValue != null ? allocatedValue : Optional.empty();
        allocatedPercentage = allocatedPercentage != null ? allocatedPercentage : Optional.empty();
    }

    public static AssetAllocation whole(Long assetId) {
        return new AssetAllocation(assetId, Optional.empty(), Optional.empty());
    }

    public static AssetAllocation percentage(Long assetId, BigDecimal percentage) {
        return new AssetAllocation(assetId, Optional.empty(), Optional.of(percentage));
    }

    public static AssetAllocation value(Long assetId, BigDecimal value) {
        return new AssetAllocation(assetId, Optional.of(value), Optional.empty());
    }
}
