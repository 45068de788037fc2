package com.gillianbc.lifeplan.service;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class RetirementReadiness {

    @NonNull BigDecimal currentAssets;
    @NonNull BigDecimal requiredNestEgg;
    /** Share of the nest egg in hand, capped at 1. */
    @NonNull BigDecimal percentageComplete;
    boolean ready;
    @NonNull BigDecimal sustainableWithdrawal;
    @NonNull BigDecimal monthlyIncome;
}
