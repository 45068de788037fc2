package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.model.AssetState;
import com.gillianbc.lifeplan.model.DebtState;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Position carried from one projected year into the next. Debt and asset states are indexed
 * like the profile's debts and assets.
 */
@Value
@Builder(toBuilder = true)
class ProjectionState {

    int yearIndex;
    @Singular List<DebtState> debts;
    @Singular List<AssetState> assets;
    @NonNull BigDecimal netWorth;
    /** Highest gross income seen so far; the retirement income reference. */
    @NonNull BigDecimal peakGrossIncome;
    /** Once reached, retirement readiness is not reported again. */
    boolean retirementReady;
    @NonNull Set<BigDecimal> reachedThresholds;
    @NonNull Set<String> resolvedGoalIds;
}
