package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of a person's finances. Owned by the caller and never modified by the engine.
 */
@Value
@Builder(toBuilder = true)
public class Profile {

    @NonNull String id;
    @NonNull @Builder.Default String name = "Profile";
    @Singular List<Income> incomes;
    @Singular List<Debt> debts;
    @Singular List<Asset> assets;
    @Singular List<Obligation> obligations;
    @Singular List<Goal> goals;
    @NonNull @Builder.Default Assumptions assumptions = Assumptions.builder().build();
}
