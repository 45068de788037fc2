package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * End-of-year state of one asset.
 */
@Value
@Builder
public class AssetState {

    @NonNull String assetId;
    @NonNull BigDecimal balance;
    @NonNull BigDecimal contributionsThisYear;
    @NonNull BigDecimal employerMatchThisYear;
    @NonNull BigDecimal growthThisYear;
}
